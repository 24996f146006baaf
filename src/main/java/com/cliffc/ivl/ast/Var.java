package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Variable or constant reference.  Reading an unset name initializes it. */
public final class Var extends Expr {
  public final String _id;
  public Var( Pos pos, String id ) { super(pos); _id = id; }
  @Override public Value eval( Environment env ) { return env.evalVar(_id,_pos); }
  @Override public SB str( SB sb ) { return sb.p(_id); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) {
    if( !bound.contains(_id) ) acc.add(_id);
  }
  @Override public Expr subst( Map<String,Expr> sub ) {
    Expr e = sub.get(_id);
    return e==null ? this : e;
  }
}
