package com.cliffc.ivl.ast;

import com.cliffc.ivl.util.SB;

import java.util.LinkedHashMap;

/** A procedure body: local variables and labelled basic blocks.  Control
 *  enters at {@link #START}; a body that falls off its end has an explicit
 *  {@code return} with no position. */
public final class Body {
  public static final String START = "$start";
  public final IdType[] _locals;
  public final LinkedHashMap<String,Stmt[]> _blocks = new LinkedHashMap<>();

  public Body( IdType... locals ) { _locals = locals; }

  /** Add a block; the first one added must be {@link #START}. */
  public Body block( String label, Stmt... stmts ) {
    assert !_blocks.isEmpty() || label.equals(START);
    assert stmts.length>0 && isTerminator(stmts[stmts.length-1]);
    _blocks.put(label,stmts);
    return this;
  }

  public Stmt[] at( String label ) {
    Stmt[] ss = _blocks.get(label);
    if( ss==null ) throw new IllegalStateException("no block labelled "+label);
    return ss;
  }

  public static boolean isTerminator( Stmt s ) { return s instanceof Stmt.Goto || s instanceof Stmt.Return; }

  public SB str( SB sb ) {
    sb.p('{').nl().ii(1);
    for( IdType l : _locals ) l.str(sb.ip("var ")).p(';').nl();
    for( String label : _blocks.keySet() ) {
      sb.p(label).p(':').nl();
      for( Stmt s : _blocks.get(label) ) s.str(sb.i()).nl();
    }
    return sb.di(1).p('}');
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
