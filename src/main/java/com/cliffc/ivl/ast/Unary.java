package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

public final class Unary extends Expr {
  public enum Op {
    NEG("-"), NOT("!");
    public final String _str;
    Op( String s ) { _str = s; }
  }
  public final Op _op;
  public final Expr _e;
  public Unary( Pos pos, Op op, Expr e ) { super(pos); _op = op; _e = e; }

  @Override public Value eval( Environment env ) {
    Value v = _e.eval(env);
    if( _op==Op.NOT ) return Value.BoolVal.make(!v.as_bool());
    long n = v.as_int();
    if( n==Long.MIN_VALUE ) throw env.overflow(_pos);
    return Value.IntVal.make(-n);
  }

  @Override public SB str( SB sb ) { return _e.str(sb.p(_op._str).p('(')).p(')'); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { _e.free(acc,bound); }
  @Override public Expr subst( Map<String,Expr> sub ) { return new Unary(_pos,_op,_e.subst(sub)); }
}
