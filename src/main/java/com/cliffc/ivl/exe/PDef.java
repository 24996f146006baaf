package com.cliffc.ivl.exe;

import com.cliffc.ivl.ast.Body;
import com.cliffc.ivl.ast.Expr;
import com.cliffc.ivl.ast.Pos;
import com.cliffc.ivl.Context;

import java.util.HashMap;
import java.util.Map;

/** One executable definition of a procedure. */
public final class PDef {
  public final String[] _ins, _outs;
  public final boolean _renamed;  // Parameter names differ from the signature's
  public final Body _body;
  public final Pos _pos;
  public PDef( String[] ins, String[] outs, boolean renamed, Body body, Pos pos ) {
    _ins = ins; _outs = outs; _renamed = renamed; _body = body; _pos = pos;
  }

  /** Rewrite a contract expression from signature names to this
   *  definition's parameter names */
  public Expr paramSubst( Context.PSig sig, Expr e ) {
    if( !_renamed ) return e;
    Map<String,Expr> sub = new HashMap<>();
    for( int i=0; i<_ins .length; i++ ) sub.put(sig._ins [i]._name,Expr.var(_ins [i]));
    for( int i=0; i<_outs.length; i++ ) sub.put(sig._outs[i]._name,Expr.var(_outs[i]));
    return e.subst(sub);
  }
}
