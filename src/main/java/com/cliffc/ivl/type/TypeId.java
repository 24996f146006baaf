package com.cliffc.ivl.type;

import com.cliffc.ivl.util.SB;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;

/** A user-defined type constructor applied to arguments, or a type variable
 *  (a bare name bound by an enclosing signature or quantifier). */
public final class TypeId extends Type {
  public final String _name;
  public final Type[] _args;
  public TypeId( String name, Type... args ) { _name = name; _args = args; }

  @Override public SB str(SB sb) {
    sb.p(_name);
    for( Type t : _args ) t.str(sb.s());
    return sb;
  }

  @Override public Type subst( Map<String,Type> sub ) {
    if( _args.length==0 ) {
      Type t = sub.get(_name);
      return t==null ? this : t;
    }
    return new TypeId(_name,subst(_args,sub));
  }

  @Override public boolean match( Type actual, Set<String> tvs, Map<String,Type> bind ) {
    if( _args.length==0 && tvs.contains(_name) ) {
      Type prior = bind.get(_name);
      if( prior==null ) { bind.put(_name,actual); return true; }
      return prior.equals(actual);
    }
    if( !(actual instanceof TypeId) ) return false;
    TypeId ti = (TypeId)actual;
    return _name.equals(ti._name) && match(_args,ti._args,tvs,bind);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TypeId) ) return false;
    TypeId ti = (TypeId)o;
    return _name.equals(ti._name) && Arrays.equals(_args,ti._args);
  }
  @Override public int hashCode() { return _name.hashCode()*31+Arrays.hashCode(_args); }
}
