package com.cliffc.ivl.exe;

import com.cliffc.ivl.IVL;

import java.util.ArrayList;
import java.util.List;

/** Depth-first search along one path, with an explicit stack of choice
 *  points.  The path goes on with the first alternative of each choice
 *  point.  When it is pruned as infeasible, the most recent choice point
 *  with alternatives left is restored and the next alternative taken.  A
 *  real failure, or pruning with nothing left to try, propagates.
 *  <p>
 *  Close the search when the path is done, to release its marks.
 */
public final class Attempt<A> implements AutoCloseable {
  public enum Status { PRUNED, FAILED }

  /** Failures of free clauses mean the path was infeasible */
  public static Status status( RuntimeFailure f ) {
    return f.kind()==FailureSource.Kind.UNREACHABLE ? Status.PRUNED : Status.FAILED;
  }

  // Alternatives not yet taken, and the state to take them from
  private static final class Point<A> {
    final List<A> _alts;
    int _next = 1;
    final Environment.Mark _mark;
    Point( List<A> alts, Environment.Mark mark ) { _alts = alts; _mark = mark; }
  }

  private final Environment _env;
  private final ArrayList<Point<A>> _points = new ArrayList<>();
  public Attempt( Environment env ) { _env = env; }

  /** Number of choice points with alternatives left */
  public int depth() { return _points.size(); }

  /** Take the first alternative, keeping the rest for {@link #retry} */
  public A choose( List<A> alts ) {
    if( alts.isEmpty() ) throw new IllegalArgumentException("no alternatives");
    if( alts.size() > 1 ) _points.add(new Point<>(alts,_env.mark()));
    return alts.get(0);
  }

  /** The path failed with {@code f}: roll back to the most recent choice
   *  point and return its next alternative, or rethrow {@code f}. */
  public A retry( RuntimeFailure f ) {
    if( status(f)==Status.FAILED || _points.isEmpty() ) throw f;
    Point<A> p = _points.get(_points.size()-1);
    if( IVL.DEBUG ) IVL.p(null,"pruned "+p._alts.get(p._next-1)+": "+f.getMessage());
    _env.rollback(p._mark);
    A a = p._alts.get(p._next++);
    if( p._next==p._alts.size() ) {
      _points.remove(_points.size()-1);
      _env.release(p._mark);
    }
    return a;
  }

  @Override public void close() {
    while( !_points.isEmpty() )
      _env.release(_points.remove(_points.size()-1)._mark);
  }
}
