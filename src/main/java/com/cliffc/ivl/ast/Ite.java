package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

public final class Ite extends Expr {
  public final Expr _c, _t, _f;
  public Ite( Pos pos, Expr c, Expr t, Expr f ) { super(pos); _c = c; _t = t; _f = f; }
  @Override public Value eval( Environment env ) { return (_c.eval(env).as_bool() ? _t : _f).eval(env); }
  @Override public SB str( SB sb ) {
    _c.str(sb.p("(if ")).p(" then ");
    _t.str(sb).p(" else ");
    return _f.str(sb).p(')');
  }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { _c.free(acc,bound); _t.free(acc,bound); _f.free(acc,bound); }
  @Override public Expr subst( Map<String,Expr> sub ) { return new Ite(_pos,_c.subst(sub),_t.subst(sub),_f.subst(sub)); }
}
