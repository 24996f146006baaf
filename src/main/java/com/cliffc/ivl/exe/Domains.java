package com.cliffc.ivl.exe;

import com.cliffc.ivl.ast.*;
import com.cliffc.ivl.type.*;

import java.util.*;

/** Finite domains for quantified variables, by interval abstract
 *  interpretation of the quantifier body.
 *  <p>
 *  Each integer variable starts unconstrained.  Every round refines each
 *  variable in turn by the interval the body implies for it, given the
 *  current intervals of the others, until nothing changes.  The inferred
 *  intervals over-approximate: any assignment making the body true lies
 *  inside them.  Sub-expressions that are not linear in the variable being
 *  refined contribute no information.
 */
public final class Domains {
  // A linear form a*x + b, with interval coefficients
  static final class Linear {
    final Interval _a, _b;
    Linear( Interval a, Interval b ) { _a = a; _b = b; }
    Linear neg() { return new Linear(_a.neg(),_b.neg()); }
    Linear add( Linear l ) { return new Linear(_a.add(l._a),_b.add(l._b)); }
    Linear sub( Linear l ) { return new Linear(_a.sub(l._a),_b.sub(l._b)); }
    @Override public String toString() { return _a+"*x + "+_b; }
  }

  private final Environment _env;
  private final Set<String> _bound;                  // All quantified names
  private final LinkedHashMap<String,Interval> _cs;  // Integer variables only
  private Domains( Environment env, Set<String> bound, LinkedHashMap<String,Interval> cs ) {
    _env = env; _bound = bound; _cs = cs;
  }

  /** Domain of each bound variable, in declaration order.  Booleans range
   *  over both values; integers over their inferred interval; other types
   *  are not supported. */
  public static List<List<Value>> domains( Environment env, Expr body, IdType[] vars, Pos pos ) {
    Set<String> bound = new HashSet<>();
    LinkedHashMap<String,Interval> cs = new LinkedHashMap<>();
    for( IdType v : vars ) {
      bound.add(v._name);
      if( v._t instanceof TypeInt ) cs.put(v._name,Interval.TOP);
      else if( !(v._t instanceof TypeBool) )
        throw env.fail(new FailureSource.Unsupported("quantification over a map or user-defined type"),pos);
    }
    Domains d = new Domains(env,bound,cs);
    d.fixpoint(body);
    List<List<Value>> doms = new ArrayList<>();
    for( IdType v : vars ) {
      if( v._t instanceof TypeBool ) {
        doms.add(List.of(Value.BoolVal.TRUE,Value.BoolVal.FALSE));
        continue;
      }
      Interval i = cs.get(v._name);
      if( i.isBot() ) { doms.add(List.of()); continue; }
      if( !i.isFinite() ) throw env.fail(new FailureSource.InfiniteDomain(v._name,i),pos);
      List<Value> vs = new ArrayList<>();
      for( long x = i._lo; ; x++ ) {
        vs.add(Value.IntVal.make(x));
        if( x==i._hi ) break;
      }
      doms.add(vs);
    }
    return doms;
  }

  /** Refine all intervals until stable */
  public static Map<String,Interval> inferConstraints( Environment env, Expr body, IdType[] vars ) {
    Set<String> bound = new HashSet<>();
    LinkedHashMap<String,Interval> cs = new LinkedHashMap<>();
    for( IdType v : vars ) {
      bound.add(v._name);
      if( v._t instanceof TypeInt ) cs.put(v._name,Interval.TOP);
    }
    new Domains(env,bound,cs).fixpoint(body);
    return cs;
  }

  private void fixpoint( Expr body ) {
    boolean progress = true;
    while( progress ) {
      progress = false;
      for( String x : _cs.keySet() ) {
        Interval old = _cs.get(x);
        Interval nnn = old.meet(interval(body,x));
        if( nnn.isBot() ) {
          // Unsatisfiable: nothing to enumerate for anyone
          for( String y : _cs.keySet() ) _cs.put(y,Interval.BOT);
          return;
        }
        if( !nnn.equals(old) ) { _cs.put(x,nnn); progress = true; }
      }
    }
  }

  /** Interval of values of {@code x} for which {@code e} may hold */
  Interval interval( Expr e, String x ) {
    try {
      return interval0(e,x);
    } catch( RuntimeFailure f ) {
      if( f._src instanceof FailureSource.Internal ) return Interval.TOP;
      throw f;
    }
  }

  private Interval interval0( Expr e, String x ) {
    if( e instanceof BoolLit ) return ((BoolLit)e)._b ? Interval.TOP : Interval.BOT;
    if( !(e instanceof Binary) ) return Interval.TOP;
    Binary b = (Binary)e;
    Expr e1 = b._e1, e2 = b._e2;
    switch( b._op ) {
    case AND: return interval(e1,x).meet(interval(e2,x));
    case OR:  return interval(e1,x).join(interval(e2,x));
    case EQ: {
      if( !isInt(e1) ) return Interval.TOP;
      Linear l = linear(e1,x).sub(linear(e2,x));
      if( l._a.contains(0) && l._b.contains(0) ) return Interval.TOP;
      return l._b.neg().div(l._a);
    }
    case LEQ: return leq(e1,e2,x);
    case LS:  return leq(e1,Expr.minus(e2,Expr.num(1)),x);
    case GEQ: return leq(e2,e1,x);
    case GT:  return leq(e2,Expr.minus(e1,Expr.num(1)),x);
    default:  return Interval.TOP;
    }
  }

  // e1 <= e2, as a*x + b <= 0
  private Interval leq( Expr e1, Expr e2, String x ) {
    Linear l = linear(e1,x).sub(linear(e2,x));
    if( l._a.isBot() || l._b.isBot() ) return Interval.BOT;
    if( l._a.contains(0) && !l._b.meet(Interval.NONPOSITIVES).isBot() ) return Interval.TOP;
    Interval nb = l._b.neg();
    return Interval.lessEqual   (nb.div(l._a.meet(Interval.POSITIVES)))
      .join(Interval.greaterEqual(nb.div(l._a.meet(Interval.NEGATIVES))));
  }

  // Only integer equalities carry bounds
  private boolean isInt( Expr e ) { return _env.tc().exprType(e) instanceof TypeInt; }

  /** Linear form of an integer expression in {@code x} */
  Linear linear( Expr e, String x ) {
    if( e instanceof Num ) return con(Interval.con(((Num)e)._n));
    if( e instanceof Var ) {
      String y = ((Var)e)._id;
      if( y.equals(x) ) return new Linear(Interval.ONE,Interval.ZERO);
      Interval c = _cs.get(y);
      if( c != null ) return con(c);
      if( _bound.contains(y) ) throw notLinear(e);
      return constant(e);
    }
    if( e instanceof Old ) {
      Expr in = ((Old)e)._e;
      return _env.old(() -> linear(in,x));
    }
    if( e instanceof Coerce ) return linear(((Coerce)e)._e,x);
    if( e instanceof Unary && ((Unary)e)._op==Unary.Op.NEG ) return linear(((Unary)e)._e,x).neg();
    if( e instanceof Binary ) {
      Binary b = (Binary)e;
      switch( b._op ) {
      case PLUS:  return linear(b._e1,x).add(linear(b._e2,x));
      case MINUS: return linear(b._e1,x).sub(linear(b._e2,x));
      case TIMES: {
        Linear l = linear(b._e1,x), r = linear(b._e2,x);
        if( l._a.equals(Interval.ZERO) ) return new Linear(l._b.mul(r._a),l._b.mul(r._b));
        if( r._a.equals(Interval.ZERO) ) return new Linear(r._b.mul(l._a),r._b.mul(l._b));
        throw notLinear(e);
      }
      default:
        // div, mod and the rest are not evaluated here: the body may guard them
        throw notLinear(e);
      }
    }
    // Anything else is usable only as a constant
    return constant(e);
  }

  private static Linear con( Interval b ) { return new Linear(Interval.ZERO,b); }

  // Closed sub-expression: evaluate it
  private Linear constant( Expr e ) {
    for( String y : e.freeVars() )
      if( _bound.contains(y) ) throw notLinear(e);
    Value v;
    try {
      v = e.eval(_env);
    } catch( RuntimeFailure f ) {
      // Reported by the body, if it ever evaluates the term
      throw notLinear(e);
    }
    if( !(v instanceof Value.IntVal) ) throw notLinear(e);
    return con(Interval.con(v.as_int()));
  }

  private RuntimeFailure notLinear( Expr e ) {
    return new RuntimeFailure(new FailureSource.Internal(FailureSource.Internal.Code.NOT_LINEAR),e._pos,new TreeMap<>());
  }
}
