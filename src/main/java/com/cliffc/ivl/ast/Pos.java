package com.cliffc.ivl.ast;

import com.cliffc.ivl.util.SB;

/** Source position; {@link #NONE} marks synthesized code and the environment. */
public final class Pos {
  public static final Pos NONE = new Pos(null,0,0);
  public final String _file;
  public final int _line, _col;
  public Pos( String file, int line, int col ) { _file=file; _line=line; _col=col; }
  public static Pos at( int line ) { return new Pos("",line,0); }
  public boolean isNone() { return this==NONE; }
  public SB str( SB sb ) {
    if( isNone() ) return sb.p("from the environment");
    sb.p("at ");
    if( _file!=null && !_file.isEmpty() ) sb.p(_file).s();
    return sb.p("line ").p(_line);
  }
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Pos) || isNone() || ((Pos)o).isNone() ) return false;
    Pos p = (Pos)o;
    return _line==p._line && _col==p._col && java.util.Objects.equals(_file,p._file);
  }
  @Override public int hashCode() { return _line*31+_col; }
}
