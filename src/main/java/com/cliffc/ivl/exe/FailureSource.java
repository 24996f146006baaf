package com.cliffc.ivl.exe;

import com.cliffc.ivl.ast.SpecClause;
import com.cliffc.ivl.type.Interval;
import com.cliffc.ivl.util.SB;

/** What went wrong in a {@link RuntimeFailure}. */
public abstract class FailureSource {
  /** Classification of a failure */
  public enum Kind {
    UNREACHABLE,     // An assumption does not hold: the path is infeasible
    ERROR,           // A genuine error in the program
    NONEXECUTABLE    // The executor cannot run this program
  }

  public abstract Kind kind();
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  /** A contract clause evaluated to false */
  public static final class SpecViolation extends FailureSource {
    public final SpecClause _clause;
    public SpecViolation( SpecClause clause ) { _clause = clause; }
    @Override public Kind kind() { return _clause._free ? Kind.UNREACHABLE : Kind.ERROR; }
    @Override public SB str( SB sb ) { return _clause.str(sb).p(" violated"); }
  }

  public static final class DivisionByZero extends FailureSource {
    @Override public Kind kind() { return Kind.ERROR; }
    @Override public SB str( SB sb ) { return sb.p("Division by zero"); }
  }

  public static final class Unsupported extends FailureSource {
    public final String _what;
    public Unsupported( String what ) { _what = what; }
    @Override public Kind kind() { return Kind.NONEXECUTABLE; }
    @Override public SB str( SB sb ) { return sb.p("Unsupported construct: ").p(_what); }
  }

  /** No finite bound could be inferred for a quantified variable */
  public static final class InfiniteDomain extends FailureSource {
    public final String _var;
    public final Interval _range;
    public InfiniteDomain( String var, Interval range ) { _var = var; _range = range; }
    @Override public Kind kind() { return Kind.NONEXECUTABLE; }
    @Override public SB str( SB sb ) { return _range.str(sb.p("Variable ").p(_var).p(" quantified over an infinite domain ")); }
  }

  /** Equality of two maps depends on elements not yet chosen */
  public static final class MapEquality extends FailureSource {
    public final Value _v1, _v2;
    public MapEquality( Value v1, Value v2 ) { _v1 = v1; _v2 = v2; }
    @Override public Kind kind() { return Kind.NONEXECUTABLE; }
    @Override public SB str( SB sb ) { return _v2.str(_v1.str(sb.p("Cannot decide equality of maps ")).p(" and ")); }
  }

  public static final class NoImplementation extends FailureSource {
    public final String _proc;
    public NoImplementation( String proc ) { _proc = proc; }
    @Override public Kind kind() { return Kind.NONEXECUTABLE; }
    @Override public SB str( SB sb ) { return sb.p("Procedure ").p(_proc).p(" with no implementation called"); }
  }

  /** Internal signals; never escape the executor */
  public static final class Internal extends FailureSource {
    public enum Code { NOT_LINEAR }
    public final Code _code;
    public Internal( Code code ) { _code = code; }
    @Override public Kind kind() { return Kind.NONEXECUTABLE; }
    @Override public SB str( SB sb ) { return sb.p("Internal: ").p(_code.name()); }
  }
}
