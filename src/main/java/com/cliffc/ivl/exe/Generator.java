package com.cliffc.ivl.exe;

import com.cliffc.ivl.IVL;
import com.cliffc.ivl.type.*;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.LongFunction;

/** Source of candidate values for non-deterministic choices, by type.  Map
 *  types never reach a generator: fresh maps are allocated empty and their
 *  elements chosen lazily. */
public interface Generator {
  Producer values( Type t );

  /** One canonical value per type */
  Generator DEFAULT = t -> Producer.single(defaultValue(t));
  /** Every value of every type, in a fair order */
  Generator ALL = Generator::allValues;

  static Value defaultValue( Type t ) {
    if( t instanceof TypeBool ) return Value.BoolVal.FALSE;
    if( t instanceof TypeInt  ) return Value.IntVal.make(0);
    if( t instanceof TypeId   ) return new Value.CustomVal(0);
    throw IVL.TODO("no default value for "+t);
  }

  static Producer allValues( Type t ) {
    if( t instanceof TypeBool ) return () -> List.<Value>of(Value.BoolVal.FALSE,Value.BoolVal.TRUE).iterator();
    if( t instanceof TypeInt  ) return () -> new Integers(Value.IntVal::make);
    if( t instanceof TypeId   ) return () -> new Integers(Value.CustomVal::new);
    throw IVL.TODO("cannot enumerate "+t);
  }

  /** 0, 1, -1, 2, -2, ... */
  final class Integers implements Iterator<Value> {
    private final LongFunction<Value> _mk;
    private long _i;
    Integers( LongFunction<Value> mk ) { _mk = mk; }
    @Override public boolean hasNext() { return _i < Long.MAX_VALUE; }
    @Override public Value next() {
      if( !hasNext() ) throw new NoSuchElementException();
      long i = _i++;
      return _mk.apply((i&1)==1 ? (i+1)>>1 : -(i>>1));
    }
  }
}
