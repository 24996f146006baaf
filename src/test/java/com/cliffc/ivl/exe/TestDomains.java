package com.cliffc.ivl.exe;

import com.cliffc.ivl.ast.*;
import com.cliffc.ivl.type.Interval;
import com.cliffc.ivl.type.Type;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static com.cliffc.ivl.ast.Expr.*;
import static com.cliffc.ivl.exe.Fixtures.*;
import static org.junit.Assert.*;

public class TestDomains {
  private static final Expr X = var("x"), Y = var("y");
  private static final IdType[] XY = ids(id("x",Type.INT),id("y",Type.INT));

  private static Map<String,Interval> infer( Program p, Expr body, IdType[] vars ) {
    Environment env = env(p);
    try( Environment.Scope ignored = env.enterQuantified(env.tc().enterQuantified(new String[0],vars),vars) ) {
      return Domains.inferConstraints(env,body,vars);
    }
  }
  private static Map<String,Interval> infer( Expr body ) { return infer(new Program(),body,XY); }

  @Test public void testLinearBounds() {
    Map<String,Interval> cs = infer(and(and(eq(plus(X,Y),num(5)),leq(num(0),X)),leq(X,num(3))));
    assertEquals(Interval.make(0,3),cs.get("x"));
    assertEquals(Interval.make(2,5),cs.get("y"));
  }

  @Test public void testChainedBounds() {
    Map<String,Interval> cs = infer(and(and(geq(X,num(0)),leq(X,Y)),leq(Y,num(5))));
    assertEquals(Interval.make(0,5),cs.get("x"));
    assertEquals(Interval.make(0,5),cs.get("y"));
  }

  @Test public void testStrictAndScaled() {
    Map<String,Interval> cs = infer(and(gt(X,num(-2)),ls(times(num(3),X),num(10))));
    assertEquals(Interval.make(-1,3),cs.get("x"));
    assertTrue(cs.get("y").isTop());
    assertEquals(Interval.con(4),infer(eq(times(num(2),X),num(8))).get("x"));
  }

  @Test public void testUnsatisfiable() {
    // No integer solution: everything is empty
    Map<String,Interval> cs = infer(eq(times(num(2),X),num(7)));
    assertTrue(cs.get("x").isBot());
    assertTrue(cs.get("y").isBot());
    assertTrue(infer(ff()).get("x").isBot());
  }

  @Test public void testNoInformation() {
    assertTrue(infer(or(ls(X,num(10)),gt(X,num(20)))).get("x").isTop());
    // Non-linear terms contribute nothing; the rest still bounds x
    Map<String,Interval> cs = infer(and(and(eq(times(X,X),num(4)),geq(X,num(-3))),leq(X,num(3))));
    assertEquals(Interval.make(-3,3),cs.get("x"));
    assertTrue(infer(neq(X,num(3))).get("x").isTop());
  }

  @Test public void testClosedTermsAreEvaluated() {
    Program p = new Program()
      .add(new Decl.Const(id("c",Type.INT)))
      .add(new Decl.Axiom(eq(var("c"),num(4))));
    Map<String,Interval> cs = infer(p,eq(X,plus(var("c"),num(1))),ids(id("x",Type.INT)));
    assertEquals(Interval.con(5),cs.get("x"));
  }

  @Test public void testGuardedDivisionIsNotEvaluated() {
    Program p = new Program()
      .add(globals(id("g",Type.INT)))
      .add(new Decl.Fun("f",new String[0],ids(id("a",Type.INT)),Type.INT,div(num(10),var("a"))));
    IdType[] vars = ids(id("x",Type.INT));
    Expr range = and(leq(num(0),X),leq(X,num(3)));
    // g is 0: neither 10 div g nor f(g) may be evaluated
    assertEquals(Interval.make(0,3),infer(p,and(range,or(eq(var("g"),num(0)),eq(X,div(num(10),var("g"))))),vars).get("x"));
    assertEquals(Interval.make(0,3),infer(p,and(range,or(eq(var("g"),num(0)),eq(X,app("f",var("g"))))),vars).get("x"));
    assertEquals(Interval.make(0,3),infer(p,and(range,eq(mod(X,num(2)),num(1))),vars).get("x"));
  }

  // Every satisfying assignment in a small box lies inside the inferred intervals
  private static void assertSound( Expr body ) {
    Environment env = env(new Program());
    try( Environment.Scope ignored = env.enterQuantified(env.tc().enterQuantified(new String[0],XY),XY) ) {
      Map<String,Interval> cs = Domains.inferConstraints(env,body,XY);
      for( long x=-8; x<=8; x++ )
        for( long y=-8; y<=8; y++ ) {
          env.setLocal("x",Value.IntVal.make(x));
          env.setLocal("y",Value.IntVal.make(y));
          if( !body.eval(env).as_bool() ) continue;
          assertTrue(body+": x = "+x+" outside "+cs.get("x"),cs.get("x").contains(x));
          assertTrue(body+": y = "+y+" outside "+cs.get("y"),cs.get("y").contains(y));
        }
    }
  }

  @Test public void testSoundness() {
    assertSound(and(eq(plus(X,Y),num(5)),leq(num(0),X)));
    assertSound(and(and(geq(X,num(-4)),leq(X,Y)),ls(Y,num(3))));
    assertSound(or(and(leq(num(1),X),leq(X,num(2))),eq(X,minus(Y,num(3)))));
    assertSound(and(ls(times(num(2),X),Y),gt(Y,num(-1))));
    assertSound(and(geq(times(num(-3),X),num(-7)),neq(X,Y)));
    assertSound(and(and(eq(mod(X,num(3)),num(1)),leq(X,num(4))),geq(minus(num(0),X),Y)));
    assertSound(and(eq(times(X,Y),num(6)),leq(neg(Y),num(2))));
  }

  @Test public void testDomains() {
    IdType[] vars = ids(id("b",Type.BOOL),id("x",Type.INT));
    Environment env = env(new Program());
    Expr body = and(and(var("b"),leq(num(0),X)),ls(X,num(2)));
    try( Environment.Scope ignored = env.enterQuantified(env.tc().enterQuantified(new String[0],vars),vars) ) {
      List<List<Value>> doms = Domains.domains(env,body,vars,Pos.NONE);
      assertEquals(List.of(Value.BoolVal.TRUE,Value.BoolVal.FALSE),doms.get(0));
      assertEquals(List.of(Value.IntVal.make(0),Value.IntVal.make(1)),doms.get(1));
    }
  }

  @Test public void testInfiniteDomain() {
    IdType[] vars = ids(id("x",Type.INT));
    Environment env = env(new Program());
    try( Environment.Scope ignored = env.enterQuantified(env.tc().enterQuantified(new String[0],vars),vars) ) {
      Domains.domains(env,geq(X,num(1)),vars,Pos.at(9));
      fail();
    } catch( RuntimeFailure f ) {
      FailureSource.InfiniteDomain src = (FailureSource.InfiniteDomain)f._src;
      assertEquals("x",src._var);
      assertEquals(Interval.POSITIVES,src._range);
      assertEquals(9,f._pos._line);
    }
  }
}
