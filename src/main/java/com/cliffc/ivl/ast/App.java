package com.cliffc.ivl.ast;

import com.cliffc.ivl.Context;
import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.FDef;
import com.cliffc.ivl.exe.RuntimeFailure;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.Ary;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Function application.  Definitions are tried in registration order; the
 *  first whose guard holds supplies the result.  With no applicable
 *  definition the function is uninterpreted at these arguments. */
public final class App extends Expr {
  public final String _fun;
  public final Expr[] _args;
  public App( Pos pos, String fun, Expr[] args ) { super(pos); _fun = fun; _args = args; }

  @Override public Value eval( Environment env ) {
    Value[] args = eval(_args,env);
    Ary<FDef> defs = env.functions(_fun);
    if( defs != null )
      for( FDef def : defs )
        if( evalLocally(env,def,args,def._guard).as_bool() )
          return evalLocally(env,def,args,def._body);
    return env.uninterpreted(this,args);
  }

  // Evaluate a guard or body with the formals bound to the actuals
  private Value evalLocally( Environment env, FDef def, Value[] args, Expr e ) {
    Context fc = env.tc().enterFunction(_fun,def._formals);
    try( Environment.Scope ignored = env.enterLocal(fc,def._formals,args) ) {
      return e.eval(env);
    } catch( RuntimeFailure f ) {
      throw f.addFrame(_pos,_fun);
    }
  }

  @Override public SB str( SB sb ) { return str(sb.p(_fun).p('('),_args).p(')'); }
  @Override void free( LinkedHashSet<String> acc, Set<String> bound ) { free(_args,acc,bound); }
  @Override public Expr subst( Map<String,Expr> sub ) { return new App(_pos,_fun,subst(_args,sub)); }
}
