package com.cliffc.ivl.ast;

import com.cliffc.ivl.type.Type;
import com.cliffc.ivl.util.SB;

/** A declared name with its type and an optional where-clause. */
public final class IdType {
  public final String _name;
  public final Type _t;
  public final Expr _where;     // null if none
  public IdType( String name, Type t, Expr where ) { _name=name; _t=t; _where=where; }
  public IdType( String name, Type t ) { this(name,t,null); }
  public IdType rename( String name ) { return new IdType(name,_t,_where); }
  public SB str( SB sb ) {
    _t.str(sb.p(_name).p(": "));
    if( _where!=null ) _where.str(sb.p(" where "));
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
