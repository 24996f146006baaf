package com.cliffc.ivl.ast;

import java.util.*;

/** Negation-prenex normal form of an existential: negations pushed down to
 *  atoms, implications and equivalences expanded, and existentials nested
 *  under conjunctions, disjunctions and other existentials pulled up into
 *  one top-level binder.  Pulled variables are renamed when they would
 *  clash with a variable already in scope. */
public final class NormalForm {
  private final Quant _q;
  private final Set<String> _used = new HashSet<>();
  private int _fresh;

  public NormalForm( Quant q ) {
    assert q._q==Quant.QOp.EXISTS;
    _q = q;
    collect(q);
  }

  /** @return an equivalent existential whose body has no negated compound
   *  and no existential under a conjunction or disjunction. */
  public Quant prenex() { return (Quant)pnf(nnf(_q,false)); }

  // Collect every name, free or bound, so fresh names never collide
  private void collect( Expr e ) {
    _used.addAll(e.freeVars());
    if( e instanceof Quant ) {
      for( IdType it : ((Quant)e)._vars ) _used.add(it._name);
      collect(((Quant)e)._body);
    } else if( e instanceof Binary ) { collect(((Binary)e)._e1); collect(((Binary)e)._e2); }
    else if( e instanceof Unary ) collect(((Unary)e)._e);
  }
  private String fresh( String x ) {
    String y;
    do y = x+"'"+(_fresh++); while( _used.contains(y) );
    _used.add(y);
    return y;
  }

  // --- Negation normal form --------------------------------------------------
  static Expr nnf( Expr e, boolean neg ) {
    if( e instanceof BoolLit )
      return new BoolLit(e._pos,((BoolLit)e)._b != neg);
    if( e instanceof Unary && ((Unary)e)._op==Unary.Op.NOT )
      return nnf(((Unary)e)._e,!neg);
    if( e instanceof Quant && ((Quant)e)._q != Quant.QOp.LAMBDA ) {
      Quant q = (Quant)e;
      Quant.QOp op = q._q;
      if( neg ) op = op==Quant.QOp.FORALL ? Quant.QOp.EXISTS : Quant.QOp.FORALL;
      return new Quant(q._pos,op,q._tvs,q._vars,nnf(q._body,neg));
    }
    if( e instanceof Binary ) {
      Binary b = (Binary)e;
      Expr x = b._e1, y = b._e2;
      switch( b._op ) {
      case AND:     return mk(b,neg ? Binary.Op.OR  : Binary.Op.AND,nnf(x,neg),nnf(y,neg));
      case OR:      return mk(b,neg ? Binary.Op.AND : Binary.Op.OR ,nnf(x,neg),nnf(y,neg));
      case IMPLIES: return neg ? mk(b,Binary.Op.AND,nnf(x,false),nnf(y,true )) : mk(b,Binary.Op.OR,nnf(x,true ),nnf(y,false));
      case EXPLIES: return neg ? mk(b,Binary.Op.AND,nnf(x,true ),nnf(y,false)) : mk(b,Binary.Op.OR,nnf(x,false),nnf(y,true ));
      case EQUIV:
        return mk(b,Binary.Op.OR,
                  mk(b,Binary.Op.AND,nnf(x,false),nnf(y,neg )),
                  mk(b,Binary.Op.AND,nnf(x,true ),nnf(y,!neg)));
      case EQ:  return neg ? mk(b,Binary.Op.NEQ,x,y) : b;
      case NEQ: return neg ? mk(b,Binary.Op.EQ ,x,y) : b;
      case LS:  return neg ? mk(b,Binary.Op.GEQ,x,y) : b;
      case LEQ: return neg ? mk(b,Binary.Op.GT ,x,y) : b;
      case GT:  return neg ? mk(b,Binary.Op.LEQ,x,y) : b;
      case GEQ: return neg ? mk(b,Binary.Op.LS ,x,y) : b;
      default: break;
      }
    }
    return neg ? new Unary(e._pos,Unary.Op.NOT,e) : e;
  }
  private static Binary mk( Binary b, Binary.Op op, Expr x, Expr y ) { return new Binary(b._pos,op,x,y); }

  // --- Prenex: pull existentials up ------------------------------------------
  private Expr pnf( Expr e ) {
    if( e instanceof Quant ) {
      Quant q = (Quant)e;
      Expr body = pnf(q._body);
      if( q._q==Quant.QOp.EXISTS && body instanceof Quant && ((Quant)body)._q==Quant.QOp.EXISTS )
        return merge(q,(Quant)body,q._pos);
      return new Quant(q._pos,q._q,q._tvs,q._vars,body);
    }
    if( e instanceof Binary ) {
      Binary b = (Binary)e;
      if( b._op==Binary.Op.AND || b._op==Binary.Op.OR ) {
        Expr x = pnf(b._e1), y = pnf(b._e2);
        boolean qx = isExists(x), qy = isExists(y);
        if( !qx && !qy ) return mk(b,b._op,x,y);
        // Rename the left binder away from the right side's names, then the
        // right binder away from everything on the left
        Quant lq = qx ? rename((Quant)x,names(y)) : null;
        Expr lb = qx ? lq._body : x;
        Set<String> lnames = names(lb);
        if( qx ) lnames.addAll(lq.boundNames());
        Quant rq = qy ? rename((Quant)y,lnames) : null;
        Expr rb = qy ? rq._body : y;
        Expr body = mk(b,b._op,lb,rb);
        if( !qx ) return new Quant(rq._pos,Quant.QOp.EXISTS,rq._tvs,rq._vars,body);
        if( !qy ) return new Quant(lq._pos,Quant.QOp.EXISTS,lq._tvs,lq._vars,body);
        return new Quant(lq._pos,Quant.QOp.EXISTS,cat(lq._tvs,rq._tvs),cat(lq._vars,rq._vars),body);
      }
    }
    return e;
  }
  private static boolean isExists( Expr e ) { return e instanceof Quant && ((Quant)e)._q==Quant.QOp.EXISTS; }

  // Free names plus any binder in the prefix
  private static Set<String> names( Expr e ) {
    Set<String> ns = new HashSet<>(e.freeVars());
    if( isExists(e) ) ns.addAll(((Quant)e).boundNames());
    return ns;
  }

  // Outer binder absorbs the inner; inner names clashing with outer ones are renamed
  private Quant merge( Quant outer, Quant inner, Pos pos ) {
    Quant in2 = rename(inner,outer.boundNames());
    return new Quant(pos,Quant.QOp.EXISTS,cat(outer._tvs,in2._tvs),cat(outer._vars,in2._vars),in2._body);
  }

  private Quant rename( Quant q, Set<String> avoid ) {
    Map<String,Expr> sub = new HashMap<>();
    IdType[] vars = q._vars.clone();
    for( int i=0; i<vars.length; i++ )
      if( avoid.contains(vars[i]._name) ) {
        String y = fresh(vars[i]._name);
        sub.put(vars[i]._name,new Var(q._pos,y));
        vars[i] = vars[i].rename(y);
      }
    if( sub.isEmpty() ) return q;
    return new Quant(q._pos,q._q,q._tvs,vars,q._body.subst(sub));
  }

  private static String[] cat( String[] a, String[] b ) {
    String[] c = Arrays.copyOf(a,a.length+b.length);
    System.arraycopy(b,0,c,a.length,b.length);
    return c;
  }
  private static IdType[] cat( IdType[] a, IdType[] b ) {
    IdType[] c = Arrays.copyOf(a,a.length+b.length);
    System.arraycopy(b,0,c,a.length,b.length);
    return c;
  }
}
