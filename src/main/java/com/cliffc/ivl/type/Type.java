package com.cliffc.ivl.type;

import com.cliffc.ivl.util.SB;

import java.util.Map;
import java.util.Set;

/** Static types of the language: booleans, unbounded integers, polymorphic
 *  maps and user-defined (or type-variable) names.  Types are immutable and
 *  compared structurally. */
public abstract class Type {
  public static final TypeBool BOOL = TypeBool.BOOL;
  public static final TypeInt  INT  = TypeInt .INT ;

  public abstract SB str(SB sb);
  @Override public final String toString() { return str(new SB()).toString(); }

  /** Replace free type variables */
  public abstract Type subst( Map<String,Type> sub );

  /** First-order match of this formal type against an actual type, binding
   *  the type variables in {@code tvs}.
   *  @return false on a mismatch */
  public abstract boolean match( Type actual, Set<String> tvs, Map<String,Type> bind );

  static boolean match( Type[] fs, Type[] as, Set<String> tvs, Map<String,Type> bind ) {
    if( fs.length != as.length ) return false;
    for( int i=0; i<fs.length; i++ )
      if( !fs[i].match(as[i],tvs,bind) )
        return false;
    return true;
  }
  static Type[] subst( Type[] ts, Map<String,Type> sub ) {
    Type[] rs = new Type[ts.length];
    for( int i=0; i<ts.length; i++ ) rs[i] = ts[i].subst(sub);
    return rs;
  }
  static SB str( SB sb, Type[] ts ) {
    for( int i=0; i<ts.length; i++ ) {
      if( i>0 ) sb.p(", ");
      ts[i].str(sb);
    }
    return sb;
  }
}
