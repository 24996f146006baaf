package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Two-state {@code old(e)}: globals read as they were on procedure entry. */
public final class Old extends Expr {
  public final Expr _e;
  public Old( Pos pos, Expr e ) { super(pos); _e = e; }
  @Override public Value eval( Environment env ) { return env.old(() -> _e.eval(env)); }
  @Override public SB str( SB sb ) { return _e.str(sb.p("old(")).p(')'); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { _e.free(acc,bound); }
  @Override public Expr subst( Map<String,Expr> sub ) { return new Old(_pos,_e.subst(sub)); }
}
