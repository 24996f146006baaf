package com.cliffc.ivl.exe;

/** Picks one value out of a producer at each point of non-deterministic
 *  choice during a single run. */
public interface Choice {
  Value pick( Producer p );

  /** Always the first candidate */
  Choice FIRST = p -> p.iterator().next();
}
