package com.cliffc.ivl.ast;

import com.cliffc.ivl.IVL;
import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.FailureSource;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Binary operators.  {@code &&}, {@code ||}, {@code ==>} and {@code <==}
 *  skip their right operand when the left one decides the result. */
public final class Binary extends Expr {
  public enum Op {
    PLUS("+"), MINUS("-"), TIMES("*"), DIV("div"), MOD("mod"),
    AND("&&"), OR("||"), IMPLIES("==>"), EXPLIES("<=="), EQUIV("<==>"),
    EQ("=="), NEQ("!="), LS("<"), LEQ("<="), GT(">"), GEQ(">="), LC("<:");
    public final String _str;
    Op( String s ) { _str = s; }
    public boolean isArith() { return ordinal() <= MOD.ordinal(); }
  }
  public final Op _op;
  public final Expr _e1, _e2;
  public Binary( Pos pos, Op op, Expr e1, Expr e2 ) { super(pos); _op = op; _e1 = e1; _e2 = e2; }

  @Override public Value eval( Environment env ) {
    Value v1 = _e1.eval(env);
    switch( _op ) {
    case AND:     if( !v1.as_bool() ) return Value.BoolVal.FALSE; break;
    case OR:      if(  v1.as_bool() ) return Value.BoolVal.TRUE ; break;
    case IMPLIES: if( !v1.as_bool() ) return Value.BoolVal.TRUE ; break;
    case EXPLIES: if(  v1.as_bool() ) return Value.BoolVal.TRUE ; break;
    default: break;
    }
    return binOp(env,v1,_e2.eval(env));
  }

  private Value binOp( Environment env, Value v1, Value v2 ) {
    try {
      switch( _op ) {
      case PLUS:  return Value.IntVal.make(Math.addExact     (v1.as_int(),v2.as_int()));
      case MINUS: return Value.IntVal.make(Math.subtractExact(v1.as_int(),v2.as_int()));
      case TIMES: return Value.IntVal.make(Math.multiplyExact(v1.as_int(),v2.as_int()));
      case DIV:
      case MOD: {
        long n1 = v1.as_int(), n2 = v2.as_int();
        if( n2==0 ) throw env.fail(new FailureSource.DivisionByZero(),_pos);
        if( _op==Op.DIV && n1==Long.MIN_VALUE && n2==-1 ) throw new ArithmeticException();
        return Value.IntVal.make(_op==Op.DIV ? ediv(n1,n2) : emod(n1,n2));
      }
      case AND:     return v2;    // Left was true
      case OR:      return v2;    // Left was false
      case IMPLIES: return v2;    // Left was true
      case EXPLIES: return Value.BoolVal.make(!v2.as_bool()); // Left was false
      case EQUIV: return Value.BoolVal.make(v1.as_bool() == v2.as_bool());
      case EQ:  return Value.BoolVal.make( env.objectEq(v1,v2,_pos));
      case NEQ: return Value.BoolVal.make(!env.objectEq(v1,v2,_pos));
      case LS:  return Value.BoolVal.make(v1.as_int() <  v2.as_int());
      case LEQ: return Value.BoolVal.make(v1.as_int() <= v2.as_int());
      case GT:  return Value.BoolVal.make(v1.as_int() >  v2.as_int());
      case GEQ: return Value.BoolVal.make(v1.as_int() >= v2.as_int());
      case LC:  throw env.fail(new FailureSource.Unsupported("orders"),_pos);
      default:  throw IVL.unimpl(_op);
      }
    } catch( ArithmeticException ae ) {
      throw env.overflow(_pos);
    }
  }

  // --- Euclidean division ------------------------------------------------------
  // The remainder is always non-negative: a == b*ediv(a,b) + emod(a,b) and
  // 0 <= emod(a,b) < |b|.
  public static long ediv( long a, long b ) {
    long q = a/b, r = a%b;
    if( r >= 0 ) return q;
    return b > 0 ? q-1 : q+1;
  }
  public static long emod( long a, long b ) {
    long r = a%b;
    if( r >= 0 ) return r;
    return b > 0 ? r+b : r-b;
  }

  @Override public SB str( SB sb ) {
    _e1.str(sb.p('(')).s().p(_op._str).s();
    return _e2.str(sb).p(')');
  }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { _e1.free(acc,bound); _e2.free(acc,bound); }
  @Override public Expr subst( Map<String,Expr> sub ) { return new Binary(_pos,_op,_e1.subst(sub),_e2.subst(sub)); }
}
