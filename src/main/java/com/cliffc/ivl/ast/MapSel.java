package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Heap;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Map selection {@code m[args]}.  Walks the base chain of the map's cell;
 *  on a miss everywhere a value is chosen and cached in the base-most cell,
 *  so every map sharing that base sees the same element. */
public final class MapSel extends Expr {
  public final Expr _m;
  public final Expr[] _args;
  public MapSel( Pos pos, Expr m, Expr[] args ) { super(pos); _m = m; _args = args; }

  @Override public Value eval( Environment env ) {
    int ref = _m.eval(env).as_ref();
    Value[] idx = eval(_args,env);
    env.checkIndex(idx,_pos);
    List<Value> key = List.of(idx);
    Heap heap = env.heap();
    while( true ) {
      Value.MapVal cell = heap.at(ref);
      Value v = cell._over.get(key);
      if( v != null ) return v;
      if( !cell.has_base() ) break;
      ref = cell._base;
    }
    Value v = env.generateValue(env.tc().exprType(this),_pos);
    env.incRef(v);
    heap.update(ref,heap.at(ref).put(key,v));
    return v;
  }

  @Override public SB str( SB sb ) { return str(_m.str(sb).p('['),_args).p(']'); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { _m.free(acc,bound); free(_args,acc,bound); }
  @Override public Expr subst( Map<String,Expr> sub ) { return new MapSel(_pos,_m.subst(sub),subst(_args,sub)); }
}
