package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Map update {@code m[args := v]}.  Allocates a new cell layered over the
 *  original map's base (or over the original map when it has none); the
 *  original map is unchanged. */
public final class MapUpd extends Expr {
  public final Expr _m;
  public final Expr[] _args;
  public final Expr _v;
  public MapUpd( Pos pos, Expr m, Expr[] args, Expr v ) { super(pos); _m = m; _args = args; _v = v; }

  @Override public Value eval( Environment env ) {
    int ref = _m.eval(env).as_ref();
    Value[] idx = eval(_args,env);
    env.checkIndex(idx,_pos);
    Value v = _v.eval(env);
    List<Value> key = List.of(idx);
    // Re-read: evaluating the operands may have cached entries in the cell
    Value.MapVal cell = env.heap().at(ref);
    Value.MapVal fresh;
    if( cell.has_base() ) {
      fresh = cell.put(key,v);
      for( Value x : fresh._over.values() ) env.incRef(x);
    } else {
      fresh = new Value.MapVal(ref,new TreeMap<>(Value.KEYS)).put(key,v);
      env.incRef(v);
    }
    env.heap().incRefCount(fresh._base);
    return env.allocate(fresh);
  }

  @Override public SB str( SB sb ) {
    str(_m.str(sb).p('['),_args).p(" := ");
    return _v.str(sb).p(']');
  }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) {
    _m.free(acc,bound); free(_args,acc,bound); _v.free(acc,bound);
  }
  @Override public Expr subst( Map<String,Expr> sub ) {
    return new MapUpd(_pos,_m.subst(sub),subst(_args,sub),_v.subst(sub));
  }
}
