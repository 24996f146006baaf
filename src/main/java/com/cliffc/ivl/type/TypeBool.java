package com.cliffc.ivl.type;

import com.cliffc.ivl.util.SB;

import java.util.Map;
import java.util.Set;

public final class TypeBool extends Type {
  static final TypeBool BOOL = new TypeBool();
  private TypeBool() {}
  @Override public SB str(SB sb) { return sb.p("bool"); }
  @Override public Type subst( Map<String,Type> sub ) { return this; }
  @Override public boolean match( Type actual, Set<String> tvs, Map<String,Type> bind ) { return actual==this; }
}
