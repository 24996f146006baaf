package com.cliffc.ivl.exe;

import com.cliffc.ivl.ast.Binary;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TestValue {
  private static Value I( long x ) { return Value.IntVal.make(x); }

  @Test public void testEuclid() {
    for( long a=-20; a<=20; a++ )
      for( long b=-7; b<=7; b++ ) {
        if( b==0 ) continue;
        long q = Binary.ediv(a,b), r = Binary.emod(a,b);
        assertTrue("mod "+a+" "+b,0 <= r && r < Math.abs(b));
        assertEquals("div "+a+" "+b,a,b*q+r);
      }
    assertEquals(-4,Binary.ediv(-7, 2));  assertEquals(1,Binary.emod(-7, 2));
    assertEquals(-3,Binary.ediv( 7,-2));  assertEquals(1,Binary.emod( 7,-2));
    assertEquals( 4,Binary.ediv(-7,-2));  assertEquals(1,Binary.emod(-7,-2));
  }

  @Test public void testOrder() {
    assertEquals(I(3),I(3));
    assertNotEquals(I(1),Value.BoolVal.TRUE);
    assertNotEquals(new Value.CustomVal(0),I(0));
    assertEquals(new Value.CustomVal(2),new Value.CustomVal(2));
    assertTrue(I(-1).compareTo(I(1)) < 0);
    assertTrue(Value.KEYS.compare(List.of(I(1),I(2)),List.of(I(1),I(3))) < 0);
    assertEquals("custom_4",new Value.CustomVal(4).toString());
    assertEquals("ref_2",new Value.RefVal(2).toString());
  }

  @Test public void testDeepDeref() {
    Heap heap = new Heap();
    int r0 = heap.alloc(Value.MapVal.empty().put(List.of(I(1)),I(5)));
    heap.incRefCount(r0);
    int r1 = heap.alloc(new Value.MapVal(r0,Value.MapVal.empty()._over).put(List.of(I(2)),I(7)));
    // A map holding a map
    int r2 = heap.alloc(Value.MapVal.empty().put(List.of(I(0)),new Value.RefVal(r1)));
    assertEquals("ref_0[2 -> 7]",heap.at(r1).toString());
    assertEquals("[1 -> 5, 2 -> 7]",Value.deepDeref(heap,new Value.RefVal(r1)).toString());
    Value d = Value.deepDeref(heap,new Value.RefVal(r2));
    assertEquals("[0 -> [1 -> 5, 2 -> 7]]",d.toString());
    assertEquals(I(9),Value.deepDeref(heap,I(9)));
    // An override shadows the base
    int r3 = heap.alloc(new Value.MapVal(r0,Value.MapVal.empty()._over).put(List.of(I(1)),I(6)));
    assertEquals("[1 -> 6]",Value.deepDeref(heap,new Value.RefVal(r3)).toString());
  }

  @Test public void testObjectEq() {
    Heap heap = new Heap();
    int r0 = heap.alloc(Value.MapVal.empty());
    heap.incRefCount(r0);
    Value m0 = new Value.RefVal(r0);
    Value a = new Value.RefVal(heap.alloc(new Value.MapVal(r0,Value.MapVal.empty()._over).put(List.of(I(1)),I(5))));
    Value b = new Value.RefVal(heap.alloc(new Value.MapVal(r0,Value.MapVal.empty()._over).put(List.of(I(1)),I(5))));
    Value c = new Value.RefVal(heap.alloc(new Value.MapVal(r0,Value.MapVal.empty()._over).put(List.of(I(1)),I(6))));
    Value d = new Value.RefVal(heap.alloc(new Value.MapVal(r0,Value.MapVal.empty()._over).put(List.of(I(2)),I(5))));
    assertEquals(Boolean.TRUE ,Value.objectEq(heap,a,a));
    assertEquals(Boolean.TRUE ,Value.objectEq(heap,a,b));
    assertEquals(Boolean.FALSE,Value.objectEq(heap,a,c));
    // Depends on a[2] and d[1], both still unknown
    assertNull(Value.objectEq(heap,a,d));
    assertNull(Value.objectEq(heap,m0,a));
    // Once the base knows element 1 the maps agree
    heap.update(r0,heap.at(r0).put(List.of(I(1)),I(5)));
    assertEquals(Boolean.TRUE,Value.objectEq(heap,m0,a));
    // Plain values
    assertEquals(Boolean.TRUE ,Value.objectEq(heap,I(3),I(3)));
    assertEquals(Boolean.FALSE,Value.objectEq(heap,Value.BoolVal.TRUE,Value.BoolVal.FALSE));
  }
}
