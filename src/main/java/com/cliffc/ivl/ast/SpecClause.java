package com.cliffc.ivl.ast;

import com.cliffc.ivl.util.SB;

/** A boolean condition the executor checks.  Free clauses are assumed: a
 *  violation means the path is infeasible.  Others are asserted: a
 *  violation is an error. */
public final class SpecClause {
  public enum Kind {
    INLINE, PRECONDITION, POSTCONDITION, LOOP_INVARIANT, WHERE, AXIOM;
  }
  public final Kind _kind;
  public final boolean _free;
  public final Expr _e;
  public SpecClause( Kind kind, boolean free, Expr e ) { _kind = kind; _free = free; _e = e; }

  public static SpecClause assertion ( Expr e ) { return new SpecClause(Kind.INLINE,false,e); }
  public static SpecClause assumption( Expr e ) { return new SpecClause(Kind.INLINE,true ,e); }
  public static SpecClause requires( boolean free, Expr e ) { return new SpecClause(Kind.PRECONDITION ,free,e); }
  public static SpecClause ensures ( boolean free, Expr e ) { return new SpecClause(Kind.POSTCONDITION,free,e); }

  public SpecClause with( Expr e ) { return new SpecClause(_kind,_free,e); }

  public String name() {
    switch( _kind ) {
    case INLINE:         return _free ? "Assumption" : "Assertion";
    case PRECONDITION:   return _free ? "Free precondition"  : "Precondition";
    case POSTCONDITION:  return _free ? "Free postcondition" : "Postcondition";
    case LOOP_INVARIANT: return "Loop invariant";
    case WHERE:          return "Where clause";
    default:             return "Axiom";
    }
  }
  public SB str( SB sb ) { return _e.str(sb.p(name()).p(' ')); }
  @Override public String toString() { return str(new SB()).toString(); }
}
