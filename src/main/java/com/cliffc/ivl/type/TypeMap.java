package com.cliffc.ivl.type;

import com.cliffc.ivl.util.SB;

import java.util.*;

/** Map type {@code <tvs>[doms]rng}.  The type variables are bound by the map
 *  type itself and instantiated per selection. */
public final class TypeMap extends Type {
  public final String[] _tvs;
  public final Type[] _doms;
  public final Type _rng;
  public TypeMap( String[] tvs, Type[] doms, Type rng ) { _tvs = tvs; _doms = doms; _rng = rng; }
  public TypeMap( Type rng, Type... doms ) { this(new String[0],doms,rng); }

  @Override public SB str(SB sb) {
    if( _tvs.length>0 ) sb.p('<').p(String.join(", ",_tvs)).p('>');
    return str(sb.p('['),_doms).p(']').p(_rng.toString());
  }

  // Substitution skips the variables this map type binds
  private Map<String,Type> shadow( Map<String,Type> sub ) {
    if( _tvs.length==0 ) return sub;
    Map<String,Type> s2 = new HashMap<>(sub);
    for( String tv : _tvs ) s2.remove(tv);
    return s2;
  }
  private Set<String> shadow( Set<String> tvs ) {
    if( _tvs.length==0 ) return tvs;
    Set<String> s2 = new HashSet<>(tvs);
    for( String tv : _tvs ) s2.remove(tv);
    return s2;
  }

  @Override public Type subst( Map<String,Type> sub ) {
    Map<String,Type> s2 = shadow(sub);
    return new TypeMap(_tvs,subst(_doms,s2),_rng.subst(s2));
  }

  @Override public boolean match( Type actual, Set<String> tvs, Map<String,Type> bind ) {
    if( !(actual instanceof TypeMap) ) return false;
    TypeMap tm = (TypeMap)actual;
    if( _tvs.length != tm._tvs.length ) return false;
    Set<String> t2 = shadow(tvs);
    return match(_doms,tm._doms,t2,bind) && _rng.match(tm._rng,t2,bind);
  }

  /** Range type of a selection with the given index types, instantiating the
   *  map's own type variables by matching the domain. */
  public Type instantiate( Type[] idxs ) {
    if( _tvs.length==0 ) return _rng;
    Map<String,Type> bind = new HashMap<>();
    match(_doms,idxs,new HashSet<>(Arrays.asList(_tvs)),bind);
    return _rng.subst(bind);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TypeMap) ) return false;
    TypeMap tm = (TypeMap)o;
    return Arrays.equals(_tvs,tm._tvs) && Arrays.equals(_doms,tm._doms) && _rng.equals(tm._rng);
  }
  @Override public int hashCode() { return (Arrays.hashCode(_doms)*31+_rng.hashCode())*31+Arrays.hashCode(_tvs); }
}
