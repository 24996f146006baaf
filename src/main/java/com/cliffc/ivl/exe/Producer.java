package com.cliffc.ivl.exe;

import java.util.Collections;

/** A restartable, possibly infinite, lazy sequence of candidate values. */
public interface Producer extends Iterable<Value> {
  static Producer single( Value v ) { return () -> Collections.singletonList(v).iterator(); }
}
