package com.cliffc.ivl.exe;

import com.cliffc.ivl.Context;
import com.cliffc.ivl.ast.*;
import com.cliffc.ivl.type.Type;

import java.util.Arrays;

/** Small builders for test programs */
final class Fixtures {
  static IdType id( String n, Type t ) { return new IdType(n,t); }
  static IdType[] ids( IdType... ids ) { return ids; }
  static IdType[] none() { return new IdType[0]; }

  static Decl.Vars globals( IdType... ids ) { return new Decl.Vars(ids); }

  /** A body of one block; a final {@code return} is added when missing */
  static Body body( IdType[] locals, Stmt... stmts ) {
    if( stmts.length==0 || !Body.isTerminator(stmts[stmts.length-1]) ) {
      stmts = Arrays.copyOf(stmts,stmts.length+1);
      stmts[stmts.length-1] = Stmt.ret();
    }
    return new Body(locals).block(Body.START,stmts);
  }
  static Body body( Stmt... stmts ) { return body(none(),stmts); }

  static Decl.Proc proc( String name, IdType[] ins, IdType[] outs, Body b ) {
    return new Decl.Proc(name,ins,outs,b);
  }
  static Decl.Proc main( Body b ) { return proc("main",none(),none(),b); }
  static Decl.Proc main( Stmt... stmts ) { return main(body(stmts)); }

  /** An environment with the program's definitions, choosing defaults */
  static Environment env( Program p ) {
    Environment env = new Environment(Context.collect(p),Generator.DEFAULT,Choice.FIRST);
    Interp.collectDefinitions(env,p);
    return env;
  }

  static Outcome run( Program p ) { return Interp.executeProgramDet(p,Context.collect(p),"main"); }
}
