package com.cliffc.ivl.exe;

import com.cliffc.ivl.Context;
import com.cliffc.ivl.ast.*;
import com.cliffc.ivl.util.Ary;

import java.util.*;

/** Statement and procedure execution, and the entry points for running a
 *  whole program.
 *  <p>
 *  A program runs by calling its entry procedure with no arguments; unset
 *  inputs are chosen lazily like any other variable.  Procedure bodies are
 *  walked block by block.  At a {@code goto} with several successors the
 *  successors are tried in order, and one that turns out infeasible (an
 *  assumption fails) is rolled back and the next one tried.
 */
public abstract class Interp {

  // --- Entry points ------------------------------------------------------------
  /** One run, choosing default values everywhere */
  public static Outcome executeProgramDet( Program prog, Context tc, String entry ) {
    return run(prog,tc,Generator.DEFAULT,Choice.FIRST,entry);
  }
  /** Every run, over all values of every type; usually infinite */
  public static Iterable<Outcome> executeProgram( Program prog, Context tc, String entry ) {
    return executeProgramGeneric(prog,tc,Generator.ALL,entry);
  }
  /** One run per combination of the generator's candidates */
  public static Iterable<Outcome> executeProgramGeneric( Program prog, Context tc, Generator gen, String entry ) {
    return new Search(choice -> run(prog,tc,gen,choice,entry));
  }

  public static Outcome run( Program prog, Context tc, Generator gen, Choice choice, String entry ) {
    Environment env = new Environment(tc,gen,choice);
    collectDefinitions(env,prog);
    try {
      execCall(env,new String[0],entry,new Expr[0],Pos.NONE);
      return Outcome.pass(env.store(),env.heap());
    } catch( RuntimeFailure f ) {
      return Outcome.fail(f);
    }
  }

  // --- Statements ----------------------------------------------------------------
  /** Execute a basic statement, then reclaim unowned maps */
  public static void exec( Environment env, Stmt s ) {
    s.exec(env);
    env.collectGarbage();
  }

  /** {@code call lhss := name(args)} using the first definition of the
   *  procedure; failures inside get this call site on their trace. */
  public static void execCall( Environment env, String[] lhss, String name, Expr[] args, Pos pos ) {
    Ary<PDef> defs = env.procedures(name);
    if( defs==null ) throw env.fail(new FailureSource.NoImplementation(name),pos);
    Value[] rets;
    try {
      rets = execProcedure(env,env.tc().procSig(name),defs.at(0),args);
    } catch( RuntimeFailure f ) {
      throw f.addFrame(pos,name);
    }
    for( int i=0; i<lhss.length; i++ )
      env.setAnyVar(lhss[i],rets[i]);
  }

  static Value[] execProcedure( Environment env, Context.PSig sig, PDef def, Expr[] args ) {
    Value[] actuals = new Value[args.length];
    for( int i=0; i<args.length; i++ ) actuals[i] = args[i].eval(env);
    Context pc = env.tc().enterProcedure(sig,def._ins,def._outs,def._body._locals);
    try( Environment.Scope ignored = env.enterLocal(pc,def._ins,actuals) ) {
      for( SpecClause r : sig._requires )
        exec(env,new Stmt.Predicate(r.with(def.paramSubst(sig,r._e))).at(def._pos));
      int olds = env.saveOld();
      try {
        Pos pos = execBlock(env,def._body,Body.START);
        Pos exit = pos.isNone() ? def._pos : pos;
        for( SpecClause e : sig._ensures )
          exec(env,new Stmt.Predicate(e.with(def.paramSubst(sig,e._e))).at(exit));
      } finally {
        env.restoreOld(olds);
      }
      Value[] rets = new Value[def._outs.length];
      for( int i=0; i<rets.length; i++ )
        rets[i] = env.evalVar(def._outs[i],def._pos);
      return rets;
    }
  }

  /** Run from a block to a {@code return}.  Gotos with several targets are
   *  choice points of a depth-first search; an infeasible path goes back to
   *  the most recent one with targets left.
   *  @return position of the {@code return} reached */
  static Pos execBlock( Environment env, Body body, String label ) {
    try( Attempt<String> search = new Attempt<>(env) ) {
      while( true ) {
        try {
          return walk(env,body,label,search);
        } catch( RuntimeFailure f ) {
          label = search.retry(f);
        }
      }
    }
  }

  // Follow the first target of every goto until a return
  private static Pos walk( Environment env, Body body, String label, Attempt<String> search ) {
    while( true ) {
      Stmt[] ss = body.at(label);
      for( int i=0; i<ss.length-1; i++ )
        exec(env,ss[i]);
      Stmt last = ss[ss.length-1];
      if( last instanceof Stmt.Return ) return last._pos;
      label = search.choose(Arrays.asList(((Stmt.Goto)last)._labels));
    }
  }

  // --- Definitions -----------------------------------------------------------------
  /** Register function, procedure and constant definitions of a program */
  public static void collectDefinitions( Environment env, Program prog ) {
    Context tc = env.tc();
    for( Decl d : prog ) {
      if( d instanceof Decl.Fun ) {
        Decl.Fun f = (Decl.Fun)d;
        if( f._body==null ) continue;
        String[] formals = new String[f._args.length];
        for( int i=0; i<formals.length; i++ )
          formals[i] = f._args[i]._name==null ? "_"+i : f._args[i]._name;
        env.addFunctionDef(f._name,new FDef(formals,Expr.tt(),f._body));
      } else if( d instanceof Decl.Proc ) {
        Decl.Proc p = (Decl.Proc)d;
        if( p._body != null )
          env.addProcedureDef(p._name,new PDef(names(p._ins),names(p._outs),false,p._body,p._pos));
      } else if( d instanceof Decl.Impl ) {
        Decl.Impl im = (Decl.Impl)d;
        Context.PSig sig = tc.procSig(im._name);
        boolean renamed = !Arrays.equals(im._ins,names(sig._ins)) || !Arrays.equals(im._outs,names(sig._outs));
        for( Body b : im._bodies )
          env.addProcedureDef(im._name,new PDef(im._ins,im._outs,renamed,b,im._pos));
      } else if( d instanceof Decl.Axiom ) {
        Expr e = ((Decl.Axiom)d)._e;
        extractConstantConstraints(env,e);
        extractFunctionDefs(env,e,new ArrayList<>(),new HashSet<>());
      }
    }
  }

  private static String[] names( IdType[] ids ) {
    String[] ns = new String[ids.length];
    for( int i=0; i<ns.length; i++ ) ns[i] = ids[i]._name;
    return ns;
  }

  // c == rhs defines a constant; anything else constrains all its names
  static void extractConstantConstraints( Environment env, Expr e ) {
    if( e instanceof Binary && ((Binary)e)._op==Binary.Op.EQ && ((Binary)e)._e1 instanceof Var ) {
      String c = ((Var)((Binary)e)._e1)._id;
      if( env.tc().isConst(c) ) { env.addConstantDef(c,((Binary)e)._e2); return; }
    }
    for( String x : e.freeVars() )
      env.addConstantConstraint(x,e);
  }

  // Find f(args) == rhs under foralls, conjunctions and implications
  static void extractFunctionDefs( Environment env, Expr e, List<Expr> guards, Set<String> bound ) {
    if( e instanceof Binary ) {
      Binary b = (Binary)e;
      switch( b._op ) {
      case IMPLIES: {
        List<Expr> g2 = new ArrayList<>(guards);
        g2.add(b._e1);
        extractFunctionDefs(env,b._e2,g2,bound);
        return;
      }
      case AND:
        extractFunctionDefs(env,b._e1,guards,bound);
        extractFunctionDefs(env,b._e2,guards,bound);
        return;
      case EQ:
        if( b._e1 instanceof App ) extractFunctionDef(env,(App)b._e1,b._e2,guards,bound);
        return;
      default:
        return;
      }
    }
    if( e instanceof Quant && ((Quant)e)._q==Quant.QOp.FORALL ) {
      Quant q = (Quant)e;
      Set<String> b2 = new HashSet<>(bound);
      b2.addAll(q.boundNames());
      extractFunctionDefs(env,q._body,guards,b2);
    }
  }

  // Bound-variable arguments become formals; closed arguments become fresh
  // formals guarded by an equality.
  private static void extractFunctionDef( Environment env, App app, Expr rhs, List<Expr> guards, Set<String> bound ) {
    int n = app._args.length;
    String[] formals = new String[n];
    List<Expr> gs = new ArrayList<>();
    Set<String> fs = new HashSet<>();
    for( int i=0; i<n; i++ ) {
      Expr a = app._args[i];
      if( a instanceof Var && bound.contains(((Var)a)._id) && !fs.contains(((Var)a)._id) ) {
        formals[i] = ((Var)a)._id;
      } else {
        for( String x : a.freeVars() )
          if( bound.contains(x) && !(a instanceof Var) ) return; // Not simple
        formals[i] = app._fun+"#"+i;
        gs.add(Expr.eq(Expr.var(formals[i]),a));
      }
      fs.add(formals[i]);
    }
    gs.addAll(guards);
    Expr guard = Expr.conj(gs);
    // Everything bound must be a formal
    for( Expr x : new Expr[]{rhs,guard} )
      for( String y : x.freeVars() )
        if( bound.contains(y) && !fs.contains(y) ) return;
    env.addFunctionDef(app._fun,new FDef(formals,guard,rhs));
  }
}
