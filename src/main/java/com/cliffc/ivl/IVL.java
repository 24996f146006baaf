package com.cliffc.ivl;

/** An executor for a small intermediate verification language: procedures
 *  with contracts, non-deterministic choice, first-class maps, two-state
 *  {@code old} expressions and bounded quantifiers.
 */
public abstract class IVL {
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }
  public static RuntimeException unimpl( Object x ) { return TODO("unexpected "+x); }

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !IVL.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
