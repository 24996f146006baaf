package com.cliffc.ivl.exe;

import com.cliffc.ivl.Context;
import com.cliffc.ivl.IVL;
import com.cliffc.ivl.ast.*;
import com.cliffc.ivl.type.Type;
import com.cliffc.ivl.type.TypeId;
import com.cliffc.ivl.type.TypeMap;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.contrib.java.lang.system.SystemErrRule;

import java.util.ArrayList;
import java.util.List;

import static com.cliffc.ivl.ast.Expr.*;
import static com.cliffc.ivl.ast.Stmt.*;
import static com.cliffc.ivl.exe.Fixtures.*;
import static org.junit.Assert.*;

public class TestInterp {
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();
  @After public void reset() { IVL.DEBUG = false; }

  private static Value I( long x ) { return Value.IntVal.make(x); }
  private static final SpecClause[] NO_SPEC = new SpecClause[0];
  private static final String[] NONE = new String[0];

  private static List<Outcome> first( Program p, int n ) {
    List<Outcome> os = new ArrayList<>();
    for( Outcome o : Interp.executeProgram(p,Context.collect(p),"main") ) {
      os.add(o);
      if( os.size()==n ) break;
    }
    return os;
  }

  @Test public void testAssertDivisionByZero() {
    Program p = new Program().add(main(assertion(eq(div(num(1),num(0)).at(Pos.at(2)),num(0)))));
    Outcome o = run(p);
    assertTrue(o.isFail());
    assertTrue(o._fail._src instanceof FailureSource.DivisionByZero);
    assertEquals(2,o._fail._pos._line);
    assertEquals(1,o._fail.trace().size());
    assertEquals("main",o._fail.trace().get(0)._name);
    assertTrue(o._fail.trace().get(0)._pos.isNone());
  }

  @Test public void testAssertionMessage() {
    Program p = new Program()
      .add(globals(id("x",Type.INT),id("z",Type.INT)))
      .add(main(assign("z",num(9)),assertion(eq(var("x"),num(1))).at(3)));
    Outcome o = run(p);
    assertTrue(o.isFail());
    assertEquals(FailureSource.Kind.ERROR,o._fail.kind());
    // Only the variables of the violated clause are reported
    assertEquals("Failed: Assertion (x == 1) violated at line 3 with x = 0\n  in call to main from the environment",o.toString());
    assertEquals(I(9),o._fail._store.get("z"));
  }

  @Test public void testNoImplementation() {
    Program p = new Program()
      .add(new Decl.Proc("foo",none(),none(),null))
      .add(main(call("foo").at(4)));
    Outcome o = run(p);
    assertTrue(o.isInvalid());
    assertEquals("foo",((FailureSource.NoImplementation)o._fail._src)._proc);
    assertEquals(4,o._fail._pos._line);
    assertEquals(1,o._fail.trace().size());
  }

  @Test public void testAssignAndHavoc() {
    Program p = new Program()
      .add(globals(id("x",Type.INT),id("y",Type.INT)))
      .add(main(assign("x",num(3)),havoc("y"),
                new Assign(new Lhs[]{new Lhs("x"),new Lhs("y")},new Expr[]{var("y"),var("x")})));
    Outcome o = run(p);
    assertTrue(o.isPass());
    // Simultaneous: both right-hand sides read before either write
    assertEquals(I(0),o.value("x"));
    assertEquals(I(3),o.value("y"));
    assertEquals("Passed: x = 0 y = 3",o.toString());
  }

  @Test public void testLocals() {
    IdType k = new IdType("k",Type.INT,eq(var("k"),num(3)));
    Program p = new Program().add(main(body(ids(k),assertion(eq(var("k"),num(3))))));
    // The default value violates the where-clause
    Outcome o = run(p);
    assertTrue(o.isInvalid());
    assertEquals(SpecClause.Kind.WHERE,((FailureSource.SpecViolation)o._fail._src)._clause._kind);
  }

  @Test public void testMapAssignment() {
    Program p = new Program()
      .add(globals(id("m",new TypeMap(Type.INT,Type.INT))))
      .add(main(assign(new Lhs("m",new Expr[]{num(1)}),num(5)),
                assign(new Lhs("m",new Expr[]{num(2)}),plus(sel(var("m"),num(1)),num(1))),
                assertion(eq(sel(var("m"),num(2)),num(6)))));
    Outcome o = run(p);
    assertTrue(o.isPass());
    assertEquals("[1 -> 5, 2 -> 6]",o.value("m").toString());
    // The intermediate map was collected
    assertEquals(2,o.heap().size());
  }

  @Test public void testNestedMapAssignment() {
    TypeMap inner = new TypeMap(Type.INT,Type.INT);
    Program p = new Program()
      .add(globals(id("mm",new TypeMap(inner,Type.INT))))
      .add(main(assign(new Lhs("mm",new Expr[]{num(1)},new Expr[]{num(2)}),num(7)),
                assertion(eq(sel(sel(var("mm"),num(1)),num(2)),num(7))),
                assertion(eq(sel(sel(var("mm"),num(1)),num(3)),num(0)))));
    Outcome o = run(p);
    assertTrue(o.toString(),o.isPass());
    assertEquals("[1 -> [2 -> 7, 3 -> 0]]",o.value("mm").toString());
  }

  // --- Procedures --------------------------------------------------------------
  private static Decl.Proc inc( Body b ) {
    return new Decl.Proc("inc",NONE,ids(id("a",Type.INT)),ids(id("r",Type.INT)),
                         new SpecClause[]{SpecClause.requires(false,geq(var("a"),num(0)))},
                         new SpecClause[]{SpecClause.ensures (false,eq(var("r"),plus(var("a"),num(1))))},
                         b);
  }

  @Test public void testCall() {
    Program p = new Program()
      .add(globals(id("y",Type.INT)))
      .add(inc(body(assign("r",plus(var("a"),num(1))))))
      .add(main(call(new String[]{"y"},"inc",num(4)),assertion(eq(var("y"),num(5)))));
    Outcome o = run(p);
    assertTrue(o.isPass());
    assertEquals(I(5),o.value("y"));
    // Callee locals do not leak
    assertNull(o.value("a"));
  }

  @Test public void testPrecondition() {
    Program p = new Program()
      .add(globals(id("y",Type.INT)))
      .add(inc(body(assign("r",plus(var("a"),num(1))))))
      .add(main(call(new String[]{"y"},"inc",num(-1)).at(6)));
    Outcome o = run(p);
    assertTrue(o.isFail());
    assertEquals(SpecClause.Kind.PRECONDITION,((FailureSource.SpecViolation)o._fail._src)._clause._kind);
    List<RuntimeFailure.Frame> trace = o._fail.trace();
    assertEquals(2,trace.size());
    assertEquals("main",trace.get(0)._name);
    assertEquals("inc",trace.get(1)._name);
    assertEquals(6,trace.get(1)._pos._line);
  }

  @Test public void testPostcondition() {
    Program p = new Program()
      .add(globals(id("y",Type.INT)))
      .add(inc(body(assign("r",var("a")),ret().at(7))))
      .add(main(call(new String[]{"y"},"inc",num(2))));
    Outcome o = run(p);
    assertTrue(o.isFail());
    assertEquals(SpecClause.Kind.POSTCONDITION,((FailureSource.SpecViolation)o._fail._src)._clause._kind);
    assertEquals(7,o._fail._pos._line);
  }

  @Test public void testImplementationRenamesParameters() {
    Program p = new Program()
      .add(globals(id("r",Type.INT)))
      .add(new Decl.Proc("dbl",NONE,ids(id("a",Type.INT)),ids(id("b",Type.INT)),NO_SPEC,
                         new SpecClause[]{SpecClause.ensures(false,eq(var("b"),times(var("a"),num(2))))},null))
      .add(new Decl.Impl("dbl",NONE,new String[]{"x"},new String[]{"y"},body(assign("y",times(var("x"),num(2))))))
      .add(main(call(new String[]{"r"},"dbl",num(3)),assertion(eq(var("r"),num(6)))));
    Outcome o = run(p);
    assertTrue(o.toString(),o.isPass());
    assertEquals(I(6),o.value("r"));
  }

  @Test public void testOld() {
    Program p = new Program()
      .add(globals(id("g",Type.INT)))
      .add(new Decl.Proc("bump",NONE,none(),none(),NO_SPEC,
                         new SpecClause[]{SpecClause.ensures(false,eq(var("g"),plus(old(var("g")),num(1))))},
                         body(assertion(eq(old(var("g")),num(10))),assign("g",plus(var("g"),num(1))))))
      .add(main(assign("g",num(10)),call("bump"),assertion(eq(var("g"),num(11)))));
    Outcome o = run(p);
    assertTrue(o.toString(),o.isPass());
    assertEquals(I(11),o.value("g"));
  }

  @Test public void testLazyOld() {
    // h is never assigned, so old and current agree on whatever it is
    Program p = new Program()
      .add(globals(id("h",Type.INT)))
      .add(main(assertion(eq(old(var("h")),var("h")))));
    for( Outcome o : first(p,5) )
      assertTrue(o.toString(),o.isPass());
  }

  @Test public void testCallForall() {
    Program p = new Program()
      .add(new Decl.Proc("lemma",NONE,ids(id("a",Type.INT)),none(),NO_SPEC,
                         new SpecClause[]{SpecClause.ensures(false,ff())},null))
      .add(main(new CallForall("lemma",(Expr)null)));
    assertTrue(run(p).isPass());
  }

  @Test public void testFunctionTrace() {
    Program p = new Program()
      .add(globals(id("y",Type.INT)))
      .add(new Decl.Fun("f",NONE,ids(id("x",Type.INT)),Type.INT,div(num(10),var("x"))))
      .add(main(assign("y",app("f",num(0)).at(Pos.at(2)))));
    Outcome o = run(p);
    assertTrue(o.isFail());
    assertEquals(2,o._fail.trace().size());
    assertEquals("f",o._fail.trace().get(1)._name);
  }

  @Test public void testQuantifiedAssertion() {
    Program p = new Program()
      .add(globals(id("a",new TypeMap(Type.INT,Type.INT))))
      .add(main(assign(new Lhs("a",new Expr[]{num(0)}),num(1)),
                assign(new Lhs("a",new Expr[]{num(1)}),num(2)),
                assertion(forall("i",Type.INT,implies(and(leq(num(0),var("i")),ls(var("i"),num(2))),
                                                      gt(sel(var("a"),var("i")),num(0)))))));
    assertTrue(run(p).isPass());
  }

  // --- Gotos ---------------------------------------------------------------------
  private static Program branches( Stmt[] l1, Stmt[] l2 ) {
    Body b = new Body()
      .block(Body.START,jump("L1","L2"))
      .block("L1",l1)
      .block("L2",l2);
    return new Program().add(globals(id("x",Type.INT))).add(main(b));
  }

  @Test public void testInfeasibleBranchIsRolledBack() {
    Program p = branches(new Stmt[]{assign("x",num(5)),assume(ff()),ret()},
                         new Stmt[]{assertion(eq(var("x"),num(0))),assign("x",num(1)),ret()});
    Outcome o = run(p);
    assertTrue(o.toString(),o.isPass());
    assertEquals(I(1),o.value("x"));
  }

  @Test public void testFirstFeasibleBranchWins() {
    Program p = branches(new Stmt[]{assign("x",num(5)),ret()},
                         new Stmt[]{assign("x",num(1)),ret()});
    assertEquals(I(5),run(p).value("x"));
  }

  @Test public void testAllBranchesInfeasible() {
    Program p = branches(new Stmt[]{assume(ff()),ret()},new Stmt[]{assume(ff()).at(9),ret()});
    Outcome o = run(p);
    assertTrue(o.isInvalid());
    assertEquals(9,o._fail._pos._line);
  }

  @Test public void testErrorIsNotRetried() {
    Program p = branches(new Stmt[]{assertion(ff()),ret()},new Stmt[]{ret()});
    assertTrue(run(p).isFail());
  }

  @Test public void testLoop() {
    // x := 0; while (x < 5) x := x + 1; assert x == 5
    Body b = new Body()
      .block(Body.START,assign("x",num(0)),jump("head"))
      .block("head",jump("body","done"))
      .block("body",assume(ls(var("x"),num(5))),assign("x",plus(var("x"),num(1))),jump("head"))
      .block("done",assume(geq(var("x"),num(5))),assertion(eq(var("x"),num(5))),ret());
    Program p = new Program().add(globals(id("x",Type.INT))).add(main(b));
    Outcome o = run(p);
    assertTrue(o.toString(),o.isPass());
    assertEquals(I(5),o.value("x"));
  }

  // while (x < n) x := x + 1, in block form
  private static Body countTo( long n, Stmt... extra ) {
    Stmt[] body = new Stmt[extra.length+3];
    body[0] = assume(ls(var("x"),num(n)));
    System.arraycopy(extra,0,body,1,extra.length);
    body[extra.length+1] = assign("x",plus(var("x"),num(1)));
    body[extra.length+2] = jump("head");
    return new Body()
      .block(Body.START,assign("x",num(0)),jump("head"))
      .block("head",jump("body","done"))
      .block("body",body)
      .block("done",assume(geq(var("x"),num(n))),assertion(eq(var("x"),num(n))),ret());
  }

  @Test public void testLongLoop() {
    Program p = new Program().add(globals(id("x",Type.INT))).add(main(countTo(20000)));
    Outcome o = run(p);
    assertTrue(o.toString(),o.isPass());
    assertEquals(I(20000),o.value("x"));
  }

  @Test public void testLongLoopOverMap() {
    // m[x] := x on every iteration
    Program p = new Program()
      .add(globals(id("x",Type.INT),id("m",new TypeMap(Type.INT,Type.INT))))
      .add(main(countTo(1000,assign(new Lhs("m",new Expr[]{var("x")}),var("x")))));
    Outcome o = run(p);
    assertTrue(o.toString(),o.isPass());
    assertEquals(I(1000),o.value("x"));
    assertEquals(1000,((Value.MapVal)o.value("m"))._over.size());
  }

  @Test public void testPrunedBranchIsLogged() {
    IVL.DEBUG = true;
    Program p = branches(new Stmt[]{assume(ff()),ret()},new Stmt[]{ret()});
    assertTrue(run(p).isPass());
    assertTrue(sysErr.getLog().contains("pruned L1: Assumption false violated"));
  }

  @Test public void testPrunedBranchIsQuietByDefault() {
    Program p = branches(new Stmt[]{assume(ff()),ret()},new Stmt[]{ret()});
    assertTrue(run(p).isPass());
    assertEquals("",sysErr.getLog());
  }

  private static Program pairOfT( Stmt... stmts ) {
    Type t = new TypeId("T");
    return new Program().add(new Decl.TypeDecl("T")).add(globals(id("a",t),id("b",t))).add(main(stmts));
  }

  @Test public void testUserDefinedType() {
    Outcome o = run(pairOfT(assertion(eq(var("a"),var("b")))));
    assertTrue(o.toString(),o.isPass());
    assertEquals(o.value("a"),o.value("b"));
    assertTrue(run(pairOfT(assume(neq(var("a"),var("b"))))).isInvalid());
  }

  // --- Exhaustive search ---------------------------------------------------------
  @Test public void testExhaustiveHavoc() {
    Program p = new Program()
      .add(globals(new IdType("x",Type.INT,geq(var("x"),num(0)))))
      .add(main(havoc("x"),assertion(geq(var("x"),num(0)))));
    int pass = 0, invalid = 0;
    for( Outcome o : first(p,6) ) {
      assertFalse(o.isFail());
      if( o.isPass() ) pass++;
      if( o.isInvalid() ) invalid++;
    }
    assertEquals(4,pass);
    assertEquals(2,invalid);
  }

  @Test public void testExhaustiveFindsBug() {
    Program p = new Program()
      .add(globals(id("x",Type.INT)))
      .add(main(assertion(neq(var("x"),num(2)))));
    List<Outcome> os = first(p,10);
    // Integers are tried 0, 1, -1, 2, ...
    assertTrue(os.get(0).isPass());
    assertTrue(os.get(3).isFail());
    assertEquals(I(2),os.get(3)._fail.relevantStore().get("x"));
    assertEquals(1,os.stream().filter(Outcome::isFail).count());
  }

  @Test public void testExhaustiveBools() {
    Program p = new Program()
      .add(globals(id("b",Type.BOOL),id("c",Type.BOOL)))
      .add(main(assertion(or(var("b"),var("c")))));
    List<Outcome> os = first(p,10);
    // c is only chosen when b is false
    assertEquals(3,os.size());
    assertEquals(1,os.stream().filter(Outcome::isFail).count());
  }
}
