package com.cliffc.ivl.exe;

import com.cliffc.ivl.Context;
import com.cliffc.ivl.ast.*;
import com.cliffc.ivl.type.Type;
import com.cliffc.ivl.type.TypeMap;
import com.cliffc.ivl.util.Ary;

import java.util.*;
import java.util.function.Supplier;

/** Mutable state of one execution: variable stores, the map heap, the
 *  registered definitions, the current type context and the source of
 *  non-deterministic choices.
 *  <p>
 *  Variables are initialized lazily: reading an unset variable chooses a
 *  value for it and then assumes its where-clause.  Globals keep an "old"
 *  snapshot taken at procedure entry; a global initialized lazily is written
 *  into every global store that lacks it, since nothing can have assigned it
 *  yet.  Every store and every heap cell owns a count on the cells it
 *  references.
 */
public final class Environment {
  private HashMap<String,Value> _locals  = new HashMap<>();
  private HashMap<String,Value> _globals = new HashMap<>();
  private HashMap<String,Value> _old     = new HashMap<>();
  private ArrayList<HashMap<String,Value>> _olds = new ArrayList<>(); // Saved snapshots of callers
  private boolean _inOld;                                             // Globals and old are swapped
  private final Heap _heap = new Heap();
  private final HashMap<String,TreeMap<List<Value>,Value>> _memo = new HashMap<>(); // Uninterpreted results

  // Definitions
  private final HashMap<String,Expr> _constDefs = new HashMap<>();
  private final HashMap<String,Ary<Expr>> _constConstraints = new HashMap<>();
  private final HashMap<String,Ary<FDef>> _funs  = new HashMap<>();
  private final HashMap<String,Ary<PDef>> _procs = new HashMap<>();

  private Context _tc;
  private final Generator _gen;
  private final Choice _choice;

  public Environment( Context tc, Generator gen, Choice choice ) { _tc = tc; _gen = gen; _choice = choice; }

  public Context tc() { return _tc; }
  public Heap heap() { return _heap; }

  // --- Definitions -----------------------------------------------------------
  public void addConstantDef( String c, Expr def ) { _constDefs.put(c,def); }
  public void addConstantConstraint( String c, Expr e ) {
    _constConstraints.computeIfAbsent(c,k -> new Ary<>(Expr.class)).add(e);
  }
  public void addFunctionDef ( String f, FDef def ) { _funs .computeIfAbsent(f,k -> new Ary<>(FDef.class)).add(def); }
  public void addProcedureDef( String p, PDef def ) { _procs.computeIfAbsent(p,k -> new Ary<>(PDef.class)).add(def); }
  /** @return definitions in registration order, or null */
  public Ary<FDef> functions ( String f ) { return _funs .get(f); }
  public Ary<PDef> procedures( String p ) { return _procs.get(p); }
  public Expr constantDef( String c ) { return _constDefs.get(c); }
  public Ary<Expr> constantConstraints( String c ) { return _constConstraints.get(c); }

  // --- Failures --------------------------------------------------------------
  /** Build a failure carrying the current store; callers throw it */
  public RuntimeFailure fail( FailureSource src, Pos pos ) { return new RuntimeFailure(src,pos,flatStore()); }
  public RuntimeFailure overflow( Pos pos ) { return fail(new FailureSource.Unsupported("integer overflow"),pos); }

  /** Locals over globals, maps fully dereferenced */
  public TreeMap<String,Value> flatStore() {
    TreeMap<String,Value> all = new TreeMap<>();
    for( Map.Entry<String,Value> e : _globals.entrySet() ) all.put(e.getKey(),Value.deepDeref(_heap,e.getValue()));
    for( Map.Entry<String,Value> e : _locals .entrySet() ) all.put(e.getKey(),Value.deepDeref(_heap,e.getValue()));
    return all;
  }
  /** Locals over globals, as stored */
  public TreeMap<String,Value> store() {
    TreeMap<String,Value> all = new TreeMap<>(_globals);
    all.putAll(_locals);
    return all;
  }

  // --- Choice ------------------------------------------------------------------
  /** A value of type {@code t}: a fresh empty map for map types, otherwise a
   *  choice among the generator's candidates. */
  public Value generateValue( Type t, Pos pos ) {
    if( _tc.isTypeVar(t) )
      throw fail(new FailureSource.Unsupported("choice of a value from unknown type "+t),pos);
    if( t instanceof TypeMap ) return allocate(Value.MapVal.empty());
    return _choice.pick(_gen.values(t));
  }

  /** Result of a function application no definition covers.  Results on
   *  non-map arguments are remembered, so the function stays a function. */
  public Value uninterpreted( App app, Value[] args ) {
    Type t = _tc.exprType(app);
    boolean memo = true;
    for( Value a : args ) if( a.is_ref() ) memo = false;
    String fun = app._fun+":"+t;
    List<Value> key = List.of(args);
    if( memo ) {
      TreeMap<List<Value>,Value> m = _memo.get(fun);
      Value v = m==null ? null : m.get(key);
      if( v != null ) return v;
    }
    Value v = generateValue(t,app._pos);
    if( memo ) {
      incRef(v);
      put(_memo.computeIfAbsent(fun,k -> new TreeMap<>(Value.KEYS)),key,v);
    }
    return v;
  }

  // --- Stores ------------------------------------------------------------------
  // Every store and memo change goes through here, to be logged under a mark.
  // A null value removes the key.
  private <K> Value put( Map<K,Value> map, K key, Value v ) {
    Value prior = v==null ? map.remove(key) : map.put(key,v);
    if( _marks > 0 ) _log.add(new Undo(map,key,prior));
    return prior;
  }

  private void setVar( HashMap<String,Value> store, String id, Value v ) {
    incRef(v);
    Value prior = put(store,id,v);
    if( prior != null ) decRef(prior);
  }
  public void setLocal ( String id, Value v ) { setVar(_locals,id,v); }
  public void setAnyVar( String id, Value v ) { setVar(_tc.isLocal(id) ? _locals : _globals,id,v); }

  /** Read a variable or constant, initializing it on first use */
  public Value evalVar( String id, Pos pos ) {
    if( _tc.isLocal(id) ) {
      Value v = _locals.get(id);
      if( v != null ) return v;
      v = generateValue(_tc.lookupVar(id),pos);
      setVar(_locals,id,v);
      checkWhere(id,pos);
      return v;
    }
    Value v = _globals.get(id);
    if( v != null ) return v;
    if( _tc.isGlobal(id) ) {
      v = generateValue(_tc.lookupVar(id),pos);
      initGlobal(id,v);
      checkWhere(id,pos);
      return v;
    }
    if( !_tc.isConst(id) ) throw new IllegalStateException("unknown variable "+id);
    Expr def = _constDefs.get(id);
    if( def==null ) v = generateValue(_tc.lookupVar(id),pos);
    else try( Scope ignored = enterLocal(_tc.global(),new String[0],new Value[0]) ) {
      v = def.eval(this);
    }
    initGlobal(id,v);
    checkConstConstraints(id,pos);
    return v;
  }

  // Unassigned so far, so the same in every global store
  private void initGlobal( String id, Value v ) {
    setVar(_globals,id,v);
    if( !_old.containsKey(id) ) setVar(_old,id,v);
    for( HashMap<String,Value> s : _olds )
      if( !s.containsKey(id) ) setVar(s,id,v);
  }

  // --- Checks ------------------------------------------------------------------
  /** Check a clause; no garbage collection, so temporaries of an enclosing
   *  evaluation stay alive. */
  public void execPredicate( SpecClause clause, Pos pos ) {
    if( !clause._e.eval(this).as_bool() )
      throw fail(new FailureSource.SpecViolation(clause),pos);
  }

  /** Assume the where-clause of a freshly initialized variable */
  public void checkWhere( String id, Pos pos ) {
    Expr w = _tc.where(id);
    if( w==null ) return;
    SpecClause c = new SpecClause(SpecClause.Kind.WHERE,true,w);
    if( _tc.isLocal(id) ) { execPredicate(c,pos); return; }
    try( Scope ignored = enterLocal(_tc.global(),new String[0],new Value[0]) ) {
      execPredicate(c,pos);
    }
  }

  /** Assume the axioms mentioning a freshly initialized constant */
  public void checkConstConstraints( String id, Pos pos ) {
    Ary<Expr> cs = _constConstraints.get(id);
    if( cs==null ) return;
    try( Scope ignored = enterLocal(_tc.global(),new String[0],new Value[0]) ) {
      for( Expr c : cs )
        execPredicate(new SpecClause(SpecClause.Kind.AXIOM,true,c),pos);
    }
  }

  // --- Heap --------------------------------------------------------------------
  public Value.RefVal allocate( Value.MapVal cell ) { return new Value.RefVal(_heap.alloc(cell)); }
  public void incRef( Value v ) { if( v.is_ref() ) _heap.incRefCount(v.as_ref()); }
  public void decRef( Value v ) { if( v.is_ref() ) _heap.decRefCount(v.as_ref()); }

  /** Free every unowned cell, releasing what it owns in turn */
  public void collectGarbage() {
    while( _heap.hasGarbage() ) {
      Value.MapVal cell = _heap.dealloc();
      if( cell.has_base() ) _heap.decRefCount(cell._base);
      for( Value v : cell._over.values() ) decRef(v);
    }
  }

  /** Map elements cannot be indexed by maps */
  public void checkIndex( Value[] idx, Pos pos ) {
    for( Value v : idx )
      if( v.is_ref() )
        throw fail(new FailureSource.Unsupported("map as an index"),pos);
  }

  /** Equality, failing when it cannot be decided yet */
  public boolean objectEq( Value v1, Value v2, Pos pos ) {
    Boolean b = Value.objectEq(_heap,v1,v2);
    if( b==null )
      throw fail(new FailureSource.MapEquality(Value.deepDeref(_heap,v1),Value.deepDeref(_heap,v2)),pos);
    return b;
  }

  // --- Scopes ------------------------------------------------------------------
  /** Restores the type context and local store on exit, releasing the
   *  references the scope's locals own.  Use with try-with-resources. */
  public final class Scope implements AutoCloseable {
    private final Context _savedTc;
    private final HashMap<String,Value> _savedLocals; // Caller's store, for a fresh scope
    private final String[] _names;                    // Bound names, for an extending scope
    private final Value[] _shadowed;
    private Scope( Context tc, HashMap<String,Value> locals, String[] names, Value[] shadowed ) {
      _savedTc = tc; _savedLocals = locals; _names = names; _shadowed = shadowed;
    }
    @Override public void close() {
      if( _savedLocals != null ) {
        for( Value v : _locals.values() ) decRef(v);
        _locals = _savedLocals;
      } else {
        for( int i=_names.length-1; i>=0; i-- ) {
          Value v = put(_locals,_names[i],null);
          if( v != null ) decRef(v);
          if( _shadowed[i] != null ) put(_locals,_names[i],_shadowed[i]);
        }
      }
      _tc = _savedTc;
    }
  }

  /** Procedure or function body: a fresh local store with the formals bound */
  public Scope enterLocal( Context tc, String[] formals, Value[] actuals ) {
    Scope s = new Scope(_tc,_locals,null,null);
    _tc = tc;
    _locals = new HashMap<>();
    for( int i=0; i<actuals.length; i++ )
      setVar(_locals,formals[i],actuals[i]);
    return s;
  }

  /** Quantifier body: the current locals stay visible and the bound names
   *  shadow any local of the same name until the scope closes */
  public Scope enterQuantified( Context tc, IdType[] vars ) {
    String[] names = new String[vars.length];
    Value[] shadowed = new Value[vars.length];
    for( int i=0; i<vars.length; i++ ) {
      names[i] = vars[i]._name;
      shadowed[i] = put(_locals,names[i],null);
    }
    Scope s = new Scope(_tc,null,names,shadowed);
    _tc = tc;
    return s;
  }

  // --- Two-state -----------------------------------------------------------------
  /** Evaluate with globals as they were on entry to the current procedure */
  public <T> T old( Supplier<T> s ) {
    if( _inOld ) return s.get();
    HashMap<String,Value> cur = _globals;
    _globals = _old;
    _old = cur;
    _inOld = true;
    try {
      return s.get();
    } finally {
      _old = _globals;
      _globals = cur;
      _inOld = false;
    }
  }

  /** Procedure entry: current globals become the old snapshot.
   *  @return token for {@link #restoreOld} */
  public int saveOld() {
    assert !_inOld;
    int depth = _olds.size();
    _olds.add(_old);
    _old = new HashMap<>(_globals);
    for( Value v : _old.values() ) incRef(v);
    return depth;
  }
  /** Procedure exit: back to the caller's snapshot */
  public void restoreOld( int depth ) {
    assert !_inOld;
    while( _olds.size() > depth ) {
      for( Value v : _old.values() ) decRef(v);
      _old = _olds.remove(_olds.size()-1);
    }
  }

  // --- Marks -------------------------------------------------------------------
  // Undo log entry: the value a key had before a change, null if absent
  private static final class Undo {
    final Map<?,Value> _map;
    final Object _key;
    final Value _prior;
    Undo( Map<?,Value> map, Object key, Value prior ) { _map = map; _key = key; _prior = prior; }
    @SuppressWarnings("unchecked")
    void undo() {
      Map<Object,Value> m = (Map<Object,Value>)_map;
      if( _prior==null ) m.remove(_key);
      else m.put(_key,_prior);
    }
  }
  private final Ary<Undo> _log = new Ary<>(Undo.class);
  private int _marks;           // Outstanding marks; nothing is logged without one

  /** A point to return to when a branch turns out infeasible.  Only taken
   *  between statements of a procedure body, and only returned to from the
   *  same body, so scopes and old snapshots are as they were; only store,
   *  memo and heap contents need undoing. */
  public final class Mark {
    private final int _store, _heapPos;
    private final Context _tc;
    private Mark() { _store = _log._len; _heapPos = _heap.mark(); _tc = Environment.this._tc; }
  }

  public Mark mark() {
    assert !_inOld;
    _marks++;
    return new Mark();
  }
  /** Undo every change since the mark; the mark stays usable */
  public void rollback( Mark m ) {
    assert _marks > 0 && _tc==m._tc && !_inOld;
    while( _log._len > m._store )
      _log.pop().undo();
    _heap.rollback(m._heapPos);
  }
  /** Done with a mark.  Marks are released newest first. */
  public void release( Mark m ) {
    assert _marks > 0 && m._store <= _log._len;
    _heap.release();
    if( --_marks==0 ) _log.clear();
  }
}
