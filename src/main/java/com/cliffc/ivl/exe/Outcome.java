package com.cliffc.ivl.exe;

import com.cliffc.ivl.util.SB;

import java.util.Map;
import java.util.TreeMap;

/** Result of one complete execution: the final store and heap, or the
 *  failure that stopped it. */
public final class Outcome {
  public final RuntimeFailure _fail;        // null on success
  private final TreeMap<String,Value> _store;
  private final Heap _heap;
  private Outcome( RuntimeFailure fail, TreeMap<String,Value> store, Heap heap ) { _fail = fail; _store = store; _heap = heap; }

  public static Outcome pass( TreeMap<String,Value> store, Heap heap ) { return new Outcome(null,store,heap); }
  public static Outcome fail( RuntimeFailure f ) { return new Outcome(f,null,null); }

  /** Ran to completion */
  public boolean isPass() { return _fail==null; }
  /** The run does not count: the path is infeasible, or not executable */
  public boolean isInvalid() {
    return _fail != null && _fail.kind() != FailureSource.Kind.ERROR;
  }
  /** Found an error */
  public boolean isFail() { return _fail != null && _fail.kind()==FailureSource.Kind.ERROR; }

  /** Final values, maps fully dereferenced */
  public TreeMap<String,Value> store() {
    assert isPass();
    TreeMap<String,Value> s = new TreeMap<>();
    for( Map.Entry<String,Value> e : _store.entrySet() )
      s.put(e.getKey(),Value.deepDeref(_heap,e.getValue()));
    return s;
  }
  public Value value( String id ) {
    assert isPass();
    Value v = _store.get(id);
    return v==null ? null : Value.deepDeref(_heap,v);
  }
  public Heap heap() { return _heap; }

  public SB str( SB sb ) {
    if( _fail != null ) return _fail.str(sb.p("Failed: "));
    sb.p("Passed:");
    for( Map.Entry<String,Value> e : store().entrySet() )
      e.getValue().str(sb.s().p(e.getKey()).p(" = "));
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
