package com.cliffc.ivl.exe;

import java.util.*;
import java.util.function.Function;

/** Every outcome of a non-deterministic program, lazily.
 *  <p>
 *  A run is identified by the index it takes at each choice point.  Each
 *  outcome comes from a fresh run replaying a prefix of indices and taking
 *  the first candidate past it.  Prefixes are explored breadth-first, each
 *  exactly once, so any finite choice vector is reached eventually even when
 *  the candidates are infinite.
 */
public final class Search implements Iterable<Outcome> {
  private final Function<Choice,Outcome> _run;
  public Search( Function<Choice,Outcome> run ) { _run = run; }

  @Override public Iterator<Outcome> iterator() { return new Iter(); }

  private final class Iter implements Iterator<Outcome> {
    private final ArrayDeque<int[]> _todo = new ArrayDeque<>();
    Iter() { _todo.add(new int[0]); }
    @Override public boolean hasNext() { return !_todo.isEmpty(); }
    @Override public Outcome next() {
      int[] prefix = _todo.poll();
      if( prefix==null ) throw new NoSuchElementException();
      Replay r = new Replay(prefix);
      Outcome o = _run.apply(r);
      // Successors: bump the last replayed index or any later one that
      // has another candidate.  Every prefix has one parent.
      for( int j = Math.max(prefix.length-1,0); j < r._n; j++ )
        if( r._more[j] ) {
          int[] kid = Arrays.copyOf(r._taken,j+1);
          kid[j]++;
          _todo.add(kid);
        }
      return o;
    }
  }

  /** Follows a prefix of indices, then always the first candidate */
  static final class Replay implements Choice {
    private final int[] _prefix;
    int[] _taken = new int[4];
    boolean[] _more = new boolean[4];
    int _n;
    Replay( int[] prefix ) { _prefix = prefix; }
    @Override public Value pick( Producer p ) {
      int idx = _n < _prefix.length ? _prefix[_n] : 0;
      Iterator<Value> it = p.iterator();
      Value v = null;
      for( int i=0; i<=idx; i++ ) {
        if( !it.hasNext() ) throw new IllegalStateException("replay diverged at choice "+_n);
        v = it.next();
      }
      if( _n == _taken.length ) {
        _taken = Arrays.copyOf(_taken,_n<<1);
        _more  = Arrays.copyOf(_more ,_n<<1);
      }
      _taken[_n] = idx;
      _more [_n] = it.hasNext();
      _n++;
      return v;
    }
  }
}
