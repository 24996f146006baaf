package com.cliffc.ivl.ast;

import com.cliffc.ivl.type.Type;

/** Top-level declarations. */
public abstract class Decl {
  public Pos _pos = Pos.NONE;
  public Decl at( Pos pos ) { _pos = pos; return this; }

  /** {@code type T;} */
  public static final class TypeDecl extends Decl {
    public final String _name;
    public final String[] _args;
    public TypeDecl( String name, String... args ) { _name = name; _args = args; }
  }

  /** {@code const c: t;} */
  public static final class Const extends Decl {
    public final IdType[] _ids;
    public Const( IdType... ids ) { _ids = ids; }
  }

  /** {@code var x: t where w;} */
  public static final class Vars extends Decl {
    public final IdType[] _ids;
    public Vars( IdType... ids ) { _ids = ids; }
  }

  /** {@code function f<tvs>(args) returns (t) [{ body }]}.  Formal names
   *  may be null when there is no body. */
  public static final class Fun extends Decl {
    public final String _name;
    public final String[] _tvs;
    public final IdType[] _args;
    public final Type _ret;
    public final Expr _body;   // null if uninterpreted
    public Fun( String name, String[] tvs, IdType[] args, Type ret, Expr body ) {
      _name = name; _tvs = tvs; _args = args; _ret = ret; _body = body;
    }
  }

  /** {@code axiom e;} */
  public static final class Axiom extends Decl {
    public final Expr _e;
    public Axiom( Expr e ) { _e = e; }
  }

  /** {@code procedure P<tvs>(ins) returns (outs) contract [body]} */
  public static final class Proc extends Decl {
    public final String _name;
    public final String[] _tvs;
    public final IdType[] _ins, _outs;
    public final SpecClause[] _requires, _ensures;
    public final Body _body;   // null if declared only
    public Proc( String name, String[] tvs, IdType[] ins, IdType[] outs,
                 SpecClause[] requires, SpecClause[] ensures, Body body ) {
      _name = name; _tvs = tvs; _ins = ins; _outs = outs;
      _requires = requires; _ensures = ensures; _body = body;
    }
    public Proc( String name, IdType[] ins, IdType[] outs, Body body ) {
      this(name,new String[0],ins,outs,new SpecClause[0],new SpecClause[0],body);
    }
  }

  /** {@code implementation P(ins) returns (outs) body}; parameter names may
   *  differ from the procedure's. */
  public static final class Impl extends Decl {
    public final String _name;
    public final String[] _tvs;
    public final String[] _ins, _outs;
    public final Body[] _bodies;
    public Impl( String name, String[] tvs, String[] ins, String[] outs, Body... bodies ) {
      _name = name; _tvs = tvs; _ins = ins; _outs = outs; _bodies = bodies;
    }
  }
}
