package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.type.Type;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Type ascription {@code e : t}; no run-time effect. */
public final class Coerce extends Expr {
  public final Expr _e;
  public final Type _t;
  public Coerce( Pos pos, Expr e, Type t ) { super(pos); _e = e; _t = t; }
  @Override public Value eval( Environment env ) { return _e.eval(env); }
  @Override public SB str( SB sb ) { return _t.str(_e.str(sb.p('(')).p(": ")).p(')'); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { _e.free(acc,bound); }
  @Override public Expr subst( Map<String,Expr> sub ) { return new Coerce(_pos,_e.subst(sub),_t); }
}
