package com.cliffc.ivl.ast;

import com.cliffc.ivl.IVL;
import com.cliffc.ivl.exe.Environment;
import com.cliffc.ivl.exe.Interp;
import com.cliffc.ivl.exe.Value;
import com.cliffc.ivl.util.SB;

/** Basic statements and block terminators.  A block is a sequence of basic
 *  statements ending in exactly one {@link Goto} or {@link Return}. */
public abstract class Stmt {
  public Pos _pos = Pos.NONE;
  public Stmt at( Pos pos ) { _pos = pos; return this; }
  public Stmt at( int line ) { return at(Pos.at(line)); }

  /** Execute a basic statement; terminators are handled by the block walk. */
  public abstract void exec( Environment env );
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  // --- assert / assume / contract checks ------------------------------------
  public static final class Predicate extends Stmt {
    public final SpecClause _clause;
    public Predicate( SpecClause clause ) { _clause = clause; }
    @Override public void exec( Environment env ) { env.execPredicate(_clause,_pos); }
    @Override public SB str( SB sb ) { return _clause._e.str(sb.p(_clause._free ? "assume " : "assert ")).p(';'); }
  }

  // --- havoc x, y ------------------------------------------------------------
  public static final class Havoc extends Stmt {
    public final String[] _ids;
    public Havoc( String... ids ) { _ids = ids; }
    @Override public void exec( Environment env ) {
      for( String id : _ids ) {
        env.setAnyVar(id,env.generateValue(env.tc().lookupVar(id),_pos));
        env.checkWhere(id,_pos);
      }
    }
    @Override public SB str( SB sb ) { return sb.p("havoc ").p(String.join(", ",_ids)).p(';'); }
  }

  // --- x[i][j], y := e1, e2 --------------------------------------------------
  /** Assignment target: a variable with zero or more map selections. */
  public static final class Lhs {
    public final String _id;
    public final Expr[][] _sels;
    public Lhs( String id, Expr[]... sels ) { _id = id; _sels = sels; }
    SB str( SB sb ) {
      sb.p(_id);
      for( Expr[] s : _sels ) Expr.str(sb.p('['),s).p(']');
      return sb;
    }
  }
  /** Simultaneous assignment: every right-hand side is evaluated before any
   *  variable is written. */
  public static final class Assign extends Stmt {
    public final Lhs[] _lhss;
    public final Expr[] _rhss;
    public Assign( Lhs[] lhss, Expr[] rhss ) { assert lhss.length==rhss.length; _lhss = lhss; _rhss = rhss; }
    @Override public void exec( Environment env ) {
      Value[] vs = new Value[_rhss.length];
      for( int i=0; i<_rhss.length; i++ )
        vs[i] = desugar(new Var(_pos,_lhss[i]._id),_lhss[i]._sels,0,_rhss[i]).eval(env);
      for( int i=0; i<_lhss.length; i++ )
        env.setAnyVar(_lhss[i]._id,vs[i]);
    }
    // x[a][b] := rhs  ==>  x := x[a := x[a][b := rhs]]
    private Expr desugar( Expr m, Expr[][] sels, int i, Expr rhs ) {
      if( i==sels.length ) return rhs;
      return new MapUpd(_pos,m,sels[i],desugar(new MapSel(_pos,m,sels[i]),sels,i+1,rhs));
    }
    @Override public SB str( SB sb ) {
      for( int i=0; i<_lhss.length; i++ ) { if( i>0 ) sb.p(", "); _lhss[i].str(sb); }
      sb.p(" := ");
      return Expr.str(sb,_rhss).p(';');
    }
  }

  // --- call x, y := P(args) ---------------------------------------------------
  public static final class Call extends Stmt {
    public final String[] _lhss;
    public final String _proc;
    public final Expr[] _args;
    public Call( String[] lhss, String proc, Expr... args ) { _lhss = lhss; _proc = proc; _args = args; }
    @Override public void exec( Environment env ) { Interp.execCall(env,_lhss,_proc,_args,_pos); }
    @Override public SB str( SB sb ) {
      sb.p("call ");
      if( _lhss.length>0 ) sb.p(String.join(", ",_lhss)).p(" := ");
      return Expr.str(sb.p(_proc).p('('),_args).p(");");
    }
  }

  // --- call forall P(args) ----------------------------------------------------
  /** Instantiates a lemma procedure for all arguments; has no effect on
   *  concrete executions. */
  public static final class CallForall extends Stmt {
    public final String _proc;
    public final Expr[] _args;   // null entries stand for wildcards
    public CallForall( String proc, Expr... args ) { _proc = proc; _args = args; }
    @Override public void exec( Environment env ) { }
    @Override public SB str( SB sb ) {
      sb.p("call forall ").p(_proc).p('(');
      for( int i=0; i<_args.length; i++ ) {
        if( i>0 ) sb.p(", ");
        if( _args[i]==null ) sb.p('*'); else _args[i].str(sb);
      }
      return sb.p(");");
    }
  }

  // --- Terminators ------------------------------------------------------------
  public static final class Goto extends Stmt {
    public final String[] _labels;
    public Goto( String... labels ) { assert labels.length>0; _labels = labels; }
    @Override public void exec( Environment env ) { throw IVL.unimpl(this); }
    @Override public SB str( SB sb ) { return sb.p("goto ").p(String.join(", ",_labels)).p(';'); }
  }
  public static final class Return extends Stmt {
    @Override public void exec( Environment env ) { throw IVL.unimpl(this); }
    @Override public SB str( SB sb ) { return sb.p("return;"); }
  }

  // --- Factories -------------------------------------------------------------
  public static Predicate assertion ( Expr e ) { return new Predicate(SpecClause.assertion (e)); }
  public static Predicate assume( Expr e ) { return new Predicate(SpecClause.assumption(e)); }
  public static Havoc havoc( String... ids ) { return new Havoc(ids); }
  public static Assign assign( String id, Expr rhs ) { return new Assign(new Lhs[]{new Lhs(id)},new Expr[]{rhs}); }
  public static Assign assign( Lhs lhs, Expr rhs ) { return new Assign(new Lhs[]{lhs},new Expr[]{rhs}); }
  public static Call call( String[] lhss, String proc, Expr... args ) { return new Call(lhss,proc,args); }
  public static Call call( String proc, Expr... args ) { return new Call(new String[0],proc,args); }
  public static Goto jump( String... labels ) { return new Goto(labels); }
  public static Return ret() { return new Return(); }
}
