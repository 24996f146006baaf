package com.cliffc.ivl.ast;

import com.cliffc.ivl.Context;
import com.cliffc.ivl.exe.Domains;
import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.FailureSource;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Quantifiers and lambdas.  Quantifiers are evaluated by enumerating a
 *  finite domain inferred for each bound variable; {@code forall} is checked
 *  as {@code !exists !}.  Lambdas are not executable. */
public final class Quant extends Expr {
  public enum QOp {
    FORALL("forall"), EXISTS("exists"), LAMBDA("lambda");
    public final String _str;
    QOp( String s ) { _str = s; }
  }
  public final QOp _q;
  public final String[] _tvs;
  public final IdType[] _vars;
  public final Expr _body;
  public Quant( Pos pos, QOp q, String[] tvs, IdType[] vars, Expr body ) {
    super(pos); _q = q; _tvs = tvs; _vars = vars; _body = body;
  }

  @Override public Value eval( Environment env ) {
    switch( _q ) {
    case FORALL: return Value.BoolVal.make(!exists(env,new Quant(_pos,QOp.EXISTS,_tvs,_vars,not(_body))));
    case EXISTS: return Value.BoolVal.make( exists(env,this));
    default:     throw env.fail(new FailureSource.Unsupported("lambda expressions"),_pos);
    }
  }

  // Normalize, bound every variable, then try every combination.  All
  // combinations are evaluated, so a failure in any of them surfaces no
  // matter where a witness sits.
  private static boolean exists( Environment env, Quant q0 ) {
    Quant q = new NormalForm(q0).prenex();
    Context qc = env.tc().enterQuantified(q._tvs,q._vars);
    try( Environment.Scope ignored = env.enterQuantified(qc,q._vars) ) {
      List<List<Value>> doms = Domains.domains(env,q._body,q._vars,q._pos);
      return enumerate(env,q,doms,0);
    }
  }
  // Outermost variable varies slowest
  private static boolean enumerate( Environment env, Quant q, List<List<Value>> doms, int i ) {
    if( i==q._vars.length ) return q._body.eval(env).as_bool();
    boolean any = false;
    for( Value v : doms.get(i) ) {
      env.setLocal(q._vars[i]._name,v);
      any |= enumerate(env,q,doms,i+1);
    }
    return any;
  }

  public Set<String> boundNames() {
    Set<String> ns = new HashSet<>();
    for( IdType it : _vars ) ns.add(it._name);
    return ns;
  }

  @Override public SB str( SB sb ) {
    sb.p('(').p(_q._str).s();
    if( _tvs.length>0 ) sb.p('<').p(String.join(", ",_tvs)).p("> ");
    for( int i=0; i<_vars.length; i++ ) {
      if( i>0 ) sb.p(", ");
      _vars[i]._t.str(sb.p(_vars[i]._name).p(": "));
    }
    return _body.str(sb.p(" :: ")).p(')');
  }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) {
    Set<String> b2 = new HashSet<>(bound);
    b2.addAll(boundNames());
    _body.free(acc,b2);
  }
  @Override public Expr subst( Map<String,Expr> sub ) {
    Map<String,Expr> s2 = new HashMap<>(sub);
    for( IdType it : _vars ) s2.remove(it._name);
    return new Quant(_pos,_q,_tvs,_vars,_body.subst(s2));
  }
}
