package com.cliffc.ivl.type;

import com.cliffc.ivl.util.SB;

import java.util.Map;
import java.util.Set;

/** Mathematical integers; values are carried in a {@code long}. */
public final class TypeInt extends Type {
  static final TypeInt INT = new TypeInt();
  private TypeInt() {}
  @Override public SB str(SB sb) { return sb.p("int"); }
  @Override public Type subst( Map<String,Type> sub ) { return this; }
  @Override public boolean match( Type actual, Set<String> tvs, Map<String,Type> bind ) { return actual==this; }
}
