package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

public final class Num extends Expr {
  public final long _n;
  public Num( Pos pos, long n ) { super(pos); _n = n; }
  @Override public Value eval( Environment env ) { return Value.IntVal.make(_n); }
  @Override public SB str( SB sb ) { return sb.p(_n); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { }
  @Override public Expr subst( Map<String,Expr> sub ) { return this; }
}
