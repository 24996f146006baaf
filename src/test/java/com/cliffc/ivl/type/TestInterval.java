package com.cliffc.ivl.type;

import org.junit.Test;

import static com.cliffc.ivl.type.Interval.*;
import static org.junit.Assert.*;

public class TestInterval {
  private static Interval I( long lo, long hi ) { return make(lo,hi); }

  @Test public void testLattice() {
    assertEquals(I(3,5) ,I(0,5).meet(I(3,10)));
    assertEquals(I(0,10),I(0,5).join(I(3,10)));
    assertSame(BOT,I(0,1).meet(I(3,4)));
    assertEquals(I(0,4),I(0,1).join(I(3,4)));   // Hull, not union
    assertEquals(I(2,7),BOT.join(I(2,7)));
    assertEquals(I(2,7),TOP.meet(I(2,7)));
    assertSame(BOT,I(2,7).meet(BOT));
    assertTrue(TOP.isTop());
    assertTrue(make(NINF,PINF).isTop());
    // Empty intervals are all the same bottom
    assertSame(BOT,I(5,4));
    assertSame(BOT,I(PINF,PINF));
    assertFalse(I(0,PINF).isFinite());
    assertTrue(I(-3,3).isFinite());
  }

  @Test public void testArith() {
    assertEquals(I(4,6)   ,I(1,2).add(I(3,4)));
    assertEquals(I(-3,-1) ,I(1,2).sub(I(3,4)));
    assertEquals(I(-10,15),I(-2,3).mul(I(4,5)));
    assertEquals(I(-3,2)  ,I(-2,3).neg());
    assertTrue(TOP.add(ONE).isTop());
    assertEquals(NONPOSITIVES,I(0,PINF).neg());
    assertEquals(NEGATIVES,POSITIVES.mul(con(-1)));
    // Zero times anything is zero, even unbounded
    assertEquals(ZERO,TOP.mul(ZERO));
    assertSame(BOT,BOT.add(ONE));
    // Overflow widens rather than wraps
    Interval big = con(Long.MAX_VALUE-1).add(con(10));
    assertFalse(big.isBot());
    assertEquals(PINF,big._hi);
    assertTrue(big.contains(Long.MAX_VALUE-1));
  }

  @Test public void testDiv() {
    // Only integers q with q*d == n count
    assertSame(BOT,con(6).div(con(4)));
    assertEquals(con(2),con(8).div(con(4)));
    assertEquals(I(1,3),I(1,10).div(con(3)));
    assertEquals(I(-6,6),con(6).div(I(-2,2)));
    assertSame(BOT,con(5).div(ZERO));
    assertTrue(TOP.div(ONE).isTop());
    assertEquals(I(1,5),con(5).div(POSITIVES));
    assertEquals(I(-5,-1),con(5).div(NEGATIVES));
    assertEquals(I(NINF,-3),I(3,PINF).neg().div(ONE));
  }
}
