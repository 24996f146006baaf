package com.cliffc.ivl.exe;

import com.cliffc.ivl.ast.Pos;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** A failed execution: the source of the failure, where it happened, the
 *  variable values at that point, and the chain of calls leading there.
 *  <p>
 *  Failures are ordinary control flow for the executor (infeasible paths are
 *  pruned by catching them), so no JVM stack trace is recorded.
 */
public final class RuntimeFailure extends RuntimeException {
  /** A call site on the trace */
  public static final class Frame {
    public final Pos _pos;
    public final String _name;
    public Frame( Pos pos, String name ) { _pos = pos; _name = name; }
    public SB str( SB sb ) { return _pos.str(sb.p("in call to ").p(_name).s()); }
    @Override public String toString() { return str(new SB()).toString(); }
  }

  public final FailureSource _src;
  public final Pos _pos;
  public final TreeMap<String,Value> _store;  // Deep-dereferenced
  private final ArrayDeque<Frame> _trace = new ArrayDeque<>();

  public RuntimeFailure( FailureSource src, Pos pos, TreeMap<String,Value> store ) {
    super(null,null,false,false);
    _src = src; _pos = pos; _store = store;
  }

  public FailureSource.Kind kind() { return _src.kind(); }

  /** Record that the failure propagated out of a call.
   *  @return this, for rethrowing */
  public RuntimeFailure addFrame( Pos pos, String name ) {
    _trace.addFirst(new Frame(pos,name));
    return this;
  }
  /** Call frames, outermost first */
  public List<Frame> trace() { return new ArrayList<>(_trace); }

  /** Values of the store variables mentioned by a violated clause, or the
   *  whole store for other failures */
  public Map<String,Value> relevantStore() {
    if( !(_src instanceof FailureSource.SpecViolation) ) return _store;
    Set<String> fv = ((FailureSource.SpecViolation)_src)._clause._e.freeVars();
    TreeMap<String,Value> rel = new TreeMap<>();
    for( Map.Entry<String,Value> e : _store.entrySet() )
      if( fv.contains(e.getKey()) ) rel.put(e.getKey(),e.getValue());
    return rel;
  }

  public SB str( SB sb ) {
    _pos.str(_src.str(sb).p(' '));
    Map<String,Value> rel = relevantStore();
    if( !rel.isEmpty() ) {
      sb.p(" with");
      for( Map.Entry<String,Value> e : rel.entrySet() )
        e.getValue().str(sb.s().p(e.getKey()).p(" = "));
    }
    // Innermost call first, like a stack dump
    Iterator<Frame> it = _trace.descendingIterator();
    while( it.hasNext() ) it.next().str(sb.nl().p("  "));
    return sb;
  }
  @Override public String getMessage() { return str(new SB()).toString(); }
  @Override public String toString() { return getMessage(); }
}
