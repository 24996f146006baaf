package com.cliffc.ivl;

import com.cliffc.ivl.ast.*;
import com.cliffc.ivl.type.*;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/** Type context: what every name in scope denotes.  Program-wide tables
 *  (globals, constants, function and procedure signatures) are shared; the
 *  local scope and type variables are per view.  Views are immutable, and
 *  entering a procedure, function or quantifier makes a new one.
 */
public final class Context {

  /** {@code function f<tvs>(args) returns (ret)} */
  public static final class FSig {
    public final String _name;
    public final String[] _tvs;
    public final Type[] _args;
    public final Type _ret;
    FSig( String name, String[] tvs, Type[] args, Type ret ) { _name=name; _tvs=tvs; _args=args; _ret=ret; }
  }

  /** Procedure signature with its contract */
  public static final class PSig {
    public final String _name;
    public final String[] _tvs;
    public final IdType[] _ins, _outs;
    public final SpecClause[] _requires, _ensures;
    PSig( Decl.Proc p ) {
      _name=p._name; _tvs=p._tvs; _ins=p._ins; _outs=p._outs;
      _requires=p._requires; _ensures=p._ensures;
    }
    /** In-parameters then out-parameters */
    public IdType[] params() {
      IdType[] ps = Arrays.copyOf(_ins,_ins.length+_outs.length);
      System.arraycopy(_outs,0,ps,_ins.length,_outs.length);
      return ps;
    }
  }

  // Program-wide tables
  private static final class Tables {
    final HashMap<String,Type> _globals = new HashMap<>(), _consts = new HashMap<>();
    final HashMap<String,Expr> _where = new HashMap<>();
    final HashMap<String,FSig> _funs = new HashMap<>();
    final HashMap<String,PSig> _procs = new HashMap<>();
  }

  private final Tables _g;
  private final HashMap<String,Type> _locals;
  private final HashMap<String,Expr> _lwhere;
  private final Set<String> _tvs;
  private Context( Tables g, HashMap<String,Type> locals, HashMap<String,Expr> lwhere, Set<String> tvs ) {
    _g=g; _locals=locals; _lwhere=lwhere; _tvs=tvs;
  }

  /** Register the declarations of a program.  Declarations are trusted to be
   *  well-typed; no checking is done. */
  public static @NotNull Context collect( Program prog ) {
    Tables g = new Tables();
    for( Decl d : prog ) {
      if( d instanceof Decl.Const )
        for( IdType it : ((Decl.Const)d)._ids ) g._consts.put(it._name,it._t);
      else if( d instanceof Decl.Vars )
        for( IdType it : ((Decl.Vars)d)._ids ) {
          g._globals.put(it._name,it._t);
          if( it._where!=null ) g._where.put(it._name,it._where);
        }
      else if( d instanceof Decl.Fun ) {
        Decl.Fun f = (Decl.Fun)d;
        Type[] args = new Type[f._args.length];
        for( int i=0; i<args.length; i++ ) args[i] = f._args[i]._t;
        g._funs.put(f._name,new FSig(f._name,f._tvs,args,f._ret));
      }
      else if( d instanceof Decl.Proc ) g._procs.put(((Decl.Proc)d)._name,new PSig((Decl.Proc)d));
    }
    return new Context(g,new HashMap<>(),new HashMap<>(),Set.of());
  }

  // --- Lookups ---------------------------------------------------------------
  public boolean isLocal ( String id ) { return _locals.containsKey(id); }
  public boolean isGlobal( String id ) { return _g._globals.containsKey(id); }
  public boolean isConst ( String id ) { return _g._consts.containsKey(id); }
  public boolean isTypeVar( Type t ) { return t instanceof TypeId && ((TypeId)t)._args.length==0 && _tvs.contains(((TypeId)t)._name); }

  /** Type of a local, global or constant */
  public Type lookupVar( String id ) {
    Type t = _locals.get(id);
    if( t==null ) t = _g._globals.get(id);
    if( t==null ) t = _g._consts.get(id);
    if( t==null ) throw new IllegalStateException("unknown variable "+id);
    return t;
  }
  /** @return where-clause of a local or global, or null */
  public Expr where( String id ) {
    return _locals.containsKey(id) ? _lwhere.get(id) : _g._where.get(id);
  }
  public FSig funSig( String f ) {
    FSig sig = _g._funs.get(f);
    if( sig==null ) throw new IllegalStateException("unknown function "+f);
    return sig;
  }
  public PSig procSig( String p ) {
    PSig sig = _g._procs.get(p);
    if( sig==null ) throw new IllegalStateException("unknown procedure "+p);
    return sig;
  }

  // --- Scope changes -----------------------------------------------------------
  /** View with no locals, for code outside any procedure: axioms, constant
   *  definitions and global where-clauses. */
  public Context global() { return new Context(_g,new HashMap<>(),new HashMap<>(),Set.of()); }

  /** Function body view: only the formals are local. */
  public Context enterFunction( String fun, String[] formals ) {
    FSig sig = funSig(fun);
    HashMap<String,Type> locals = new HashMap<>();
    for( int i=0; i<formals.length; i++ ) locals.put(formals[i],sig._args[i]);
    return new Context(_g,locals,new HashMap<>(),new HashSet<>(Arrays.asList(sig._tvs)));
  }

  /** Procedure body view: parameters under the implementation's names, with
   *  the signature's types and where-clauses, plus the body's locals. */
  public Context enterProcedure( PSig sig, String[] ins, String[] outs, IdType[] locals ) {
    IdType[] ps = sig.params();
    String[] names = new String[ps.length];
    System.arraycopy(ins ,0,names,0,ins.length);
    System.arraycopy(outs,0,names,ins.length,outs.length);
    Map<String,Expr> rename = new HashMap<>();
    for( int i=0; i<ps.length; i++ )
      if( !ps[i]._name.equals(names[i]) ) rename.put(ps[i]._name,Expr.var(names[i]));
    HashMap<String,Type> ls = new HashMap<>();
    HashMap<String,Expr> ws = new HashMap<>();
    for( int i=0; i<ps.length; i++ ) {
      ls.put(names[i],ps[i]._t);
      if( ps[i]._where!=null ) ws.put(names[i],ps[i]._where.subst(rename));
    }
    for( IdType l : locals ) {
      ls.put(l._name,l._t);
      if( l._where!=null ) ws.put(l._name,l._where);
    }
    return new Context(_g,ls,ws,new HashSet<>(Arrays.asList(sig._tvs)));
  }

  /** Quantifier body view: the bound variables join the local scope,
   *  shadowing any local of the same name. */
  public Context enterQuantified( String[] tvs, IdType[] vars ) {
    HashMap<String,Type> ls = new HashMap<>(_locals);
    HashMap<String,Expr> ws = new HashMap<>(_lwhere);
    for( IdType v : vars ) { ls.put(v._name,v._t); ws.remove(v._name); }
    Set<String> ts = _tvs;
    if( tvs.length>0 ) { ts = new HashSet<>(_tvs); ts.addAll(Arrays.asList(tvs)); }
    return new Context(_g,ls,ws,ts);
  }

  // --- Expression types --------------------------------------------------------
  /** Type of a well-typed expression; polymorphic functions and maps are
   *  instantiated by matching their argument types. */
  public Type exprType( Expr e ) {
    if( e instanceof BoolLit ) return Type.BOOL;
    if( e instanceof Num ) return Type.INT;
    if( e instanceof Var ) return lookupVar(((Var)e)._id);
    if( e instanceof App ) {
      App a = (App)e;
      FSig sig = funSig(a._fun);
      if( sig._tvs.length==0 ) return sig._ret;
      Map<String,Type> bind = new HashMap<>();
      Set<String> tvs = new HashSet<>(Arrays.asList(sig._tvs));
      for( int i=0; i<a._args.length; i++ )
        sig._args[i].match(exprType(a._args[i]),tvs,bind);
      return sig._ret.subst(bind);
    }
    if( e instanceof MapSel ) {
      MapSel s = (MapSel)e;
      TypeMap tm = (TypeMap)exprType(s._m);
      Type[] idx = new Type[s._args.length];
      for( int i=0; i<idx.length; i++ ) idx[i] = exprType(s._args[i]);
      return tm.instantiate(idx);
    }
    if( e instanceof MapUpd ) return exprType(((MapUpd)e)._m);
    if( e instanceof Old ) return exprType(((Old)e)._e);
    if( e instanceof Ite ) return exprType(((Ite)e)._t);
    if( e instanceof Coerce ) return ((Coerce)e)._t;
    if( e instanceof Unary ) return ((Unary)e)._op==Unary.Op.NEG ? Type.INT : Type.BOOL;
    if( e instanceof Binary ) return ((Binary)e)._op.isArith() ? Type.INT : Type.BOOL;
    if( e instanceof Quant ) {
      Quant q = (Quant)e;
      if( q._q != Quant.QOp.LAMBDA ) return Type.BOOL;
      Type[] doms = new Type[q._vars.length];
      for( int i=0; i<doms.length; i++ ) doms[i] = q._vars[i]._t;
      return new TypeMap(q._tvs,doms,enterQuantified(q._tvs,q._vars).exprType(q._body));
    }
    throw IVL.unimpl(e);
  }
}
