package com.cliffc.ivl.ast;

import com.cliffc.ivl.util.Ary;

import java.util.Iterator;

/** A typed program: a list of declarations in source order. */
public final class Program implements Iterable<Decl> {
  public final Ary<Decl> _decls = new Ary<>(Decl.class);
  public Program add( Decl d ) { _decls.add(d); return this; }
  @Override public Iterator<Decl> iterator() { return _decls.iterator(); }
}
