package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

public final class BoolLit extends Expr {
  public final boolean _b;
  public BoolLit( Pos pos, boolean b ) { super(pos); _b = b; }
  @Override public Value eval( Environment env ) { return Value.BoolVal.make(_b); }
  @Override public SB str( SB sb ) { return sb.p(_b); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { }
  @Override public Expr subst( Map<String,Expr> sub ) { return this; }
}
