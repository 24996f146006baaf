package com.cliffc.ivl.ast;

import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.type.Type;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Typed expressions.  Each node evaluates itself against an
 *  {@link Environment}; evaluation is strict and left-to-right except for
 *  the short-circuiting boolean connectives. */
public abstract class Expr {
  public Pos _pos;
  Expr( Pos pos ) { _pos = pos; }

  /** Evaluate to a value; failures are thrown as {@code RuntimeFailure}. */
  public abstract Value eval( Environment env );

  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  /** Set the position; used while building trees */
  public Expr at( Pos pos ) { _pos = pos; return this; }

  /** @return free variable names, in order of first occurrence */
  public final LinkedHashSet<String> freeVars() {
    LinkedHashSet<String> acc = new LinkedHashSet<>();
    free(acc,new HashSet<>());
    return acc;
  }
  abstract void free( LinkedHashSet<String> acc, Set<String> bound );

  /** Replace free variables.  Binders drop their own names from the
   *  substitution. */
  public abstract Expr subst( Map<String,Expr> sub );

  static void free( Expr[] es, LinkedHashSet<String> acc, Set<String> bound ) {
    for( Expr e : es ) e.free(acc,bound);
  }
  static Expr[] subst( Expr[] es, Map<String,Expr> sub ) {
    Expr[] rs = new Expr[es.length];
    for( int i=0; i<es.length; i++ ) rs[i] = es[i].subst(sub);
    return rs;
  }
  static SB str( SB sb, Expr[] es ) {
    for( int i=0; i<es.length; i++ ) {
      if( i>0 ) sb.p(", ");
      es[i].str(sb);
    }
    return sb;
  }
  static Value[] eval( Expr[] es, Environment env ) {
    Value[] vs = new Value[es.length];
    for( int i=0; i<es.length; i++ ) vs[i] = es[i].eval(env);
    return vs;
  }

  // --- Factories -------------------------------------------------------------
  public static BoolLit tt() { return new BoolLit(Pos.NONE,true ); }
  public static BoolLit ff() { return new BoolLit(Pos.NONE,false); }
  public static BoolLit bool( boolean b ) { return new BoolLit(Pos.NONE,b); }
  public static Num num( long n ) { return new Num(Pos.NONE,n); }
  public static Var var( String id ) { return new Var(Pos.NONE,id); }
  public static App app( String fun, Expr... args ) { return new App(Pos.NONE,fun,args); }
  public static MapSel sel( Expr m, Expr... args ) { return new MapSel(Pos.NONE,m,args); }
  public static MapUpd upd( Expr m, Expr[] args, Expr v ) { return new MapUpd(Pos.NONE,m,args,v); }
  public static MapUpd upd( Expr m, Expr arg, Expr v ) { return upd(m,new Expr[]{arg},v); }
  public static Old old( Expr e ) { return new Old(Pos.NONE,e); }
  public static Ite ite( Expr c, Expr t, Expr f ) { return new Ite(Pos.NONE,c,t,f); }
  public static Coerce coerce( Expr e, Type t ) { return new Coerce(Pos.NONE,e,t); }

  public static Unary neg( Expr e ) { return new Unary(Pos.NONE,Unary.Op.NEG,e); }
  public static Unary not( Expr e ) { return new Unary(Pos.NONE,Unary.Op.NOT,e); }

  public static Binary bin( Binary.Op op, Expr a, Expr b ) { return new Binary(Pos.NONE,op,a,b); }
  public static Binary plus ( Expr a, Expr b ) { return bin(Binary.Op.PLUS   ,a,b); }
  public static Binary minus( Expr a, Expr b ) { return bin(Binary.Op.MINUS  ,a,b); }
  public static Binary times( Expr a, Expr b ) { return bin(Binary.Op.TIMES  ,a,b); }
  public static Binary div  ( Expr a, Expr b ) { return bin(Binary.Op.DIV    ,a,b); }
  public static Binary mod  ( Expr a, Expr b ) { return bin(Binary.Op.MOD    ,a,b); }
  public static Binary and  ( Expr a, Expr b ) { return bin(Binary.Op.AND    ,a,b); }
  public static Binary or   ( Expr a, Expr b ) { return bin(Binary.Op.OR     ,a,b); }
  public static Binary implies( Expr a, Expr b ) { return bin(Binary.Op.IMPLIES,a,b); }
  public static Binary equiv( Expr a, Expr b ) { return bin(Binary.Op.EQUIV  ,a,b); }
  public static Binary eq   ( Expr a, Expr b ) { return bin(Binary.Op.EQ     ,a,b); }
  public static Binary neq  ( Expr a, Expr b ) { return bin(Binary.Op.NEQ    ,a,b); }
  public static Binary ls   ( Expr a, Expr b ) { return bin(Binary.Op.LS     ,a,b); }
  public static Binary leq  ( Expr a, Expr b ) { return bin(Binary.Op.LEQ    ,a,b); }
  public static Binary gt   ( Expr a, Expr b ) { return bin(Binary.Op.GT     ,a,b); }
  public static Binary geq  ( Expr a, Expr b ) { return bin(Binary.Op.GEQ    ,a,b); }

  /** Left-nested conjunction; {@code true} when empty */
  public static Expr conj( List<Expr> es ) {
    if( es.isEmpty() ) return tt();
    Expr e = es.get(0);
    for( int i=1; i<es.size(); i++ ) e = and(e,es.get(i));
    return e;
  }

  public static Quant forall( IdType[] vars, Expr body ) { return new Quant(Pos.NONE,Quant.QOp.FORALL,new String[0],vars,body); }
  public static Quant exists( IdType[] vars, Expr body ) { return new Quant(Pos.NONE,Quant.QOp.EXISTS,new String[0],vars,body); }
  public static Quant forall( String x, Type t, Expr body ) { return forall(new IdType[]{new IdType(x,t)},body); }
  public static Quant exists( String x, Type t, Expr body ) { return exists(new IdType[]{new IdType(x,t)},body); }
}
