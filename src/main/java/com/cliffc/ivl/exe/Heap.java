package com.cliffc.ivl.exe;

import com.cliffc.ivl.util.Ary;
import com.cliffc.ivl.util.SB;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/** Reference-counted arena of map cells.  References are indices handed out
 *  in increasing order and never reused, short of a rollback taking back the
 *  allocation.  A cell's base always has a smaller index, so base chains are
 *  acyclic.
 *  <p>
 *  A fresh cell has count zero and sits in the garbage set until someone
 *  takes ownership with {@link #incRefCount}.  Counts only record ownership
 *  by stores and by other cells; collection itself is driven by the
 *  {@link Environment}, which knows how to release a dead cell's contents.
 *  <p>
 *  While a mark is outstanding every change is logged, so a search can
 *  return to the heap as it was at the mark.
 */
public final class Heap {
  private Value.MapVal[] _cells;
  private int[] _counts;
  private int _fresh;           // Next reference
  private final BitSet _garbage; // Allocated cells with count zero

  public Heap() {
    _cells = new Value.MapVal[4];
    _counts = new int[4];
    _garbage = new BitSet();
  }

  public int alloc( Value.MapVal cell ) {
    assert !cell.has_base() || isLive(cell._base);
    if( _fresh == _cells.length ) {
      _cells  = Arrays.copyOf(_cells ,_fresh<<1);
      _counts = Arrays.copyOf(_counts,_fresh<<1);
    }
    int r = _fresh++;
    _cells[r] = cell;
    _counts[r] = 0;
    _garbage.set(r);
    log(ALLOC,r,null);
    return r;
  }

  public Value.MapVal at( int r ) {
    assert isLive(r) : "dangling ref_"+r;
    return _cells[r];
  }
  public void update( int r, Value.MapVal cell ) {
    assert isLive(r) && cell._base==_cells[r]._base;
    log(UPDATE,r,_cells[r]);
    _cells[r] = cell;
  }

  public boolean isLive( int r ) { return 0 <= r && r < _fresh && _cells[r] != null; }
  public int count( int r ) { return _counts[r]; }

  public void incRefCount( int r ) {
    assert isLive(r);
    _counts[r]++;
    _garbage.clear(r);
    log(INC,r,null);
  }
  public void decRefCount( int r ) {
    assert isLive(r) && _counts[r] > 0;
    if( --_counts[r]==0 ) _garbage.set(r);
    log(DEC,r,null);
  }

  public boolean hasGarbage() { return !_garbage.isEmpty(); }
  /** Remove one unowned cell and return its contents for releasing */
  public Value.MapVal dealloc() {
    int r = _garbage.nextSetBit(0);
    assert r >= 0 && _counts[r]==0;
    _garbage.clear(r);
    Value.MapVal cell = _cells[r];
    _cells[r] = null;
    log(FREE,r,cell);
    return cell;
  }

  // --- Undo log ----------------------------------------------------------------
  private static final int ALLOC=0, UPDATE=1, INC=2, DEC=3, FREE=4;
  private static final class Undo {
    final int _op, _r;
    final Value.MapVal _cell;   // Prior contents, for UPDATE and FREE
    Undo( int op, int r, Value.MapVal cell ) { _op = op; _r = r; _cell = cell; }
  }
  private final Ary<Undo> _log = new Ary<>(Undo.class);
  private int _marks;           // Outstanding marks; nothing is logged without one

  private void log( int op, int r, Value.MapVal cell ) {
    if( _marks > 0 ) _log.add(new Undo(op,r,cell));
  }

  /** Start logging changes.
   *  @return position to {@link #rollback} to */
  public int mark() { _marks++; return _log._len; }
  /** Done with a mark; the log is dropped along with the last one */
  public void release() {
    assert _marks > 0;
    if( --_marks==0 ) _log.clear();
  }
  /** Undo every change logged since the mark, newest first */
  public void rollback( int mark ) {
    assert _marks > 0 && mark <= _log._len;
    while( _log._len > mark ) {
      Undo u = _log.pop();
      int r = u._r;
      switch( u._op ) {
      case ALLOC:
        assert r==_fresh-1;
        _fresh--;
        _cells[r] = null;
        _garbage.clear(r);
        break;
      case UPDATE: _cells[r] = u._cell; break;
      case INC:    if( --_counts[r]==0 ) _garbage.set(r); break;
      case DEC:    _counts[r]++; _garbage.clear(r); break;
      case FREE:   _cells[r] = u._cell; _garbage.set(r); break;
      default: throw new IllegalStateException("bad undo "+u._op);
      }
    }
  }

  /** Element at the key following the base chain, or null if none of the
   *  cells on the chain has it yet. */
  public Value lookup( int r, List<Value> key ) {
    while( true ) {
      Value.MapVal cell = at(r);
      Value v = cell._over.get(key);
      if( v != null || !cell.has_base() ) return v;
      r = cell._base;
    }
  }

  /** Number of live cells */
  public int size() {
    int n = 0;
    for( int r=0; r<_fresh; r++ ) if( _cells[r] != null ) n++;
    return n;
  }

  public SB str( SB sb ) {
    for( int r=0; r<_fresh; r++ )
      if( _cells[r] != null )
        _cells[r].str(sb.p("ref_").p(r).p(" -> ")).p(" (").p(_counts[r]).p(')').nl();
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
