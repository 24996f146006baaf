package com.cliffc.ivl.type;

import com.cliffc.ivl.util.SB;

/** Integer intervals over the extended integers, for bounding quantified
 *  variables.  Bounds are longs with {@link #NINF} and {@link #PINF} standing
 *  for the infinities; finite arithmetic that overflows saturates to the
 *  matching infinity, which only ever widens a result.
 *  <p>
 *  Lattice: {@link #BOT} is the empty interval, {@link #TOP} is
 *  {@code [-inf,+inf]}; {@link #meet} intersects, {@link #join} takes the
 *  hull.  Any non-empty interval has {@code lo <= hi}, {@code lo < +inf} and
 *  {@code hi > -inf}.
 */
public final class Interval {
  public static final long NINF = Long.MIN_VALUE;
  public static final long PINF = Long.MAX_VALUE;

  public final long _lo, _hi;
  private Interval( long lo, long hi ) { _lo=lo; _hi=hi; }

  public static final Interval BOT  = new Interval(PINF,NINF);
  public static final Interval TOP  = new Interval(NINF,PINF);
  public static final Interval ZERO = new Interval(0,0);
  public static final Interval ONE  = new Interval(1,1);
  public static final Interval POSITIVES    = new Interval(1,PINF);
  public static final Interval NEGATIVES    = new Interval(NINF,-1);
  public static final Interval NONPOSITIVES = new Interval(NINF,0);

  public static Interval make( long lo, long hi ) {
    if( lo > hi || lo==PINF || hi==NINF ) return BOT;
    if( lo==NINF && hi==PINF ) return TOP;
    return new Interval(lo,hi);
  }
  public static Interval con( long x ) { return make(x,x); }
  /** {@code [-inf, x._hi]} */
  public static Interval lessEqual   ( Interval x ) { return x.isBot() ? BOT : make(NINF,x._hi); }
  /** {@code [x._lo, +inf]} */
  public static Interval greaterEqual( Interval x ) { return x.isBot() ? BOT : make(x._lo,PINF); }

  public boolean isBot() { return this==BOT; }
  public boolean isTop() { return _lo==NINF && _hi==PINF; }
  public boolean isFinite() { return !isBot() && _lo!=NINF && _hi!=PINF; }
  public boolean contains( long x ) { return _lo <= x && x <= _hi; }
  /** Number of elements of a finite interval */

  // --- Lattice ---------------------------------------------------------------
  public Interval meet( Interval t ) {
    if( isBot() || t.isBot() ) return BOT;
    return make(Math.max(_lo,t._lo),Math.min(_hi,t._hi));
  }
  public Interval join( Interval t ) {
    if( isBot() ) return t;
    if( t.isBot() ) return this;
    return make(Math.min(_lo,t._lo),Math.max(_hi,t._hi));
  }

  // --- Arithmetic ------------------------------------------------------------
  public Interval neg() { return isBot() ? BOT : make(negx(_hi),negx(_lo)); }
  public Interval add( Interval t ) {
    if( isBot() || t.isBot() ) return BOT;
    return make(add(_lo,t._lo,NINF),add(_hi,t._hi,PINF));
  }
  public Interval sub( Interval t ) { return add(t.neg()); }
  public Interval mul( Interval t ) {
    if( isBot() || t.isBot() ) return BOT;
    long a = mulx(_lo,t._lo), b = mulx(_lo,t._hi), c = mulx(_hi,t._lo), d = mulx(_hi,t._hi);
    long lo = Math.min(Math.min(a,b),Math.min(c,d)), hi = Math.max(Math.max(a,b),Math.max(c,d));
    // Saturated finite products are still inhabited
    return make(lo==PINF ? PINF-1 : lo, hi==NINF ? NINF+1 : hi);
  }

  /** Integer division hull: every integer {@code q} such that {@code q*d == n}
   *  for some {@code n} in this interval and non-zero {@code d} in the
   *  divisor.  The real-valued quotient hull is rounded inward, so an upper
   *  bound {@code x <= n/d} is also bounded by the result's {@code _hi} and a
   *  lower bound by its {@code _lo}.  A zero divisor contributes nothing. */
  public Interval div( Interval d ) {
    if( isBot() ) return BOT;
    return div_signed(d.meet(POSITIVES)).join(div_signed(d.meet(NEGATIVES)));
  }
  // Divisor is sign-definite or empty
  private Interval div_signed( Interval d ) {
    if( d.isBot() ) return BOT;
    long lo = PINF, hi = NINF;
    long[] ns = {_lo,_hi}, ds = {d._lo,d._hi};
    for( long n : ns )
      for( long dd : ds ) {
        if( (n==NINF || n==PINF) && (dd==NINF || dd==PINF) ) {
          // inf/inf: anything between zero and the signed infinity
          boolean pos = (n==PINF) == (dd==PINF);
          lo = Math.min(lo, pos ? 0 : NINF);
          hi = Math.max(hi, pos ? PINF : 0);
        } else {
          lo = Math.min(lo,ceilDiv (n,dd));
          hi = Math.max(hi,floorDiv(n,dd));
        }
      }
    return make(lo,hi);
  }

  // --- Extended integer helpers ----------------------------------------------
  private static boolean inf( long x ) { return x==NINF || x==PINF; }
  static long negx( long x ) { return x==NINF ? PINF : (x==PINF ? NINF : -x); }
  // Add two bounds; 'dflt' picks the infinity when they disagree
  static long add( long x, long y, long dflt ) {
    if( x==dflt || y==dflt ) return dflt;
    if( inf(x) ) return x;
    if( inf(y) ) return y;
    long r = x+y;
    // Overflow iff both have the same sign and the result differs
    // a lower bound stays below its infinity and an upper one above
    if( ((x^r)&(y^r)) < 0 )
      return x>0 ? (dflt==PINF ? PINF : PINF-1) : (dflt==NINF ? NINF : NINF+1);
    // Landed on the sentinel: round outward
    if( r==NINF ) return dflt==NINF ? NINF : NINF+1;
    return r;
  }
  static long mulx( long x, long y ) {
    if( x==0 || y==0 ) return 0;
    boolean neg = (x<0) != (y<0);
    if( inf(x) || inf(y) ) return neg ? NINF : PINF;
    long hi = Math.multiplyHigh(x,y), lo = x*y;
    if( (hi==0 && lo>=0) || (hi==-1 && lo<0) ) return lo;
    return neg ? NINF : PINF;
  }
  // n/d, d finite non-zero or infinite, not both infinite
  static long floorDiv( long n, long d ) {
    if( inf(d) ) return (n==0 || (n>0)==(d>0)) ? 0 : -1;
    if( inf(n) ) return (n>0)==(d>0) ? PINF : NINF;
    return Math.floorDiv(n,d);
  }
  static long ceilDiv( long n, long d ) {
    if( inf(d) ) return (n==0 || (n>0)!=(d>0)) ? 0 : 1;
    if( inf(n) ) return (n>0)==(d>0) ? PINF : NINF;
    return -Math.floorDiv(-n,d);
  }

  private static SB bound( SB sb, long x ) {
    return x==NINF ? sb.p("-inf") : (x==PINF ? sb.p("+inf") : sb.p(x));
  }
  public SB str( SB sb ) {
    if( isBot() ) return sb.p("[]");
    return bound(bound(sb.p('['),_lo).p(", "),_hi).p(']');
  }
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Interval) ) return false;
    Interval t = (Interval)o;
    return _lo==t._lo && _hi==t._hi;
  }
  @Override public int hashCode() { return Long.hashCode(_lo)*31+Long.hashCode(_hi); }
}
