package com.cliffc.ivl.exe;

import com.cliffc.ivl.ast.Expr;

/** One definition of a function: when {@code guard} holds for the formals,
 *  the result is {@code body}. */
public final class FDef {
  public final String[] _formals;
  public final Expr _guard, _body;
  public FDef( String[] formals, Expr guard, Expr body ) { _formals = formals; _guard = guard; _body = body; }
  @Override public String toString() {
    return "("+String.join(", ",_formals)+") "+_guard+" -> "+_body;
  }
}
