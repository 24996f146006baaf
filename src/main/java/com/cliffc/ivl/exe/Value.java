package com.cliffc.ivl.exe;

import com.cliffc.ivl.IVL;
import com.cliffc.ivl.util.SB;

import java.util.*;

/** Run-time values.  Integers, booleans and values of user-defined types are
 *  plain data; maps live in the {@link Heap} and are passed around by
 *  {@link RefVal}.  A {@link MapVal} appears only inside heap cells and in
 *  deep-dereferenced results.
 *  <p>
 *  Values are totally ordered (kind first, then contents) so argument tuples
 *  can key sorted maps.
 */
public abstract class Value implements Comparable<Value> {
  abstract int kind();
  abstract int compare0( Value v ); // Same kind
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  public long    as_int () { throw IVL.unimpl(this); }
  public boolean as_bool() { throw IVL.unimpl(this); }
  public int     as_ref () { throw IVL.unimpl(this); }
  public boolean is_ref () { return false; }

  @Override public final int compareTo( Value v ) {
    int k = kind() - v.kind();
    return k!=0 ? k : compare0(v);
  }
  @Override public final boolean equals( Object o ) {
    return this==o || (o instanceof Value && compareTo((Value)o)==0);
  }

  /** Lexicographic order on argument tuples */
  public static final Comparator<List<Value>> KEYS = (a,b) -> {
    int n = Math.min(a.size(),b.size());
    for( int i=0; i<n; i++ ) {
      int c = a.get(i).compareTo(b.get(i));
      if( c!=0 ) return c;
    }
    return a.size()-b.size();
  };

  // --- Integers ----------------------------------------------------------------
  public static final class IntVal extends Value {
    public final long _con;
    private IntVal( long con ) { _con = con; }
    public static IntVal make( long con ) { return new IntVal(con); }
    @Override int kind() { return 0; }
    @Override int compare0( Value v ) { return Long.compare(_con,((IntVal)v)._con); }
    @Override public long as_int() { return _con; }
    @Override public SB str( SB sb ) { return sb.p(_con); }
    @Override public int hashCode() { return Long.hashCode(_con); }
  }

  // --- Booleans ----------------------------------------------------------------
  public static final class BoolVal extends Value {
    public static final BoolVal FALSE = new BoolVal(false), TRUE = new BoolVal(true);
    public final boolean _b;
    private BoolVal( boolean b ) { _b = b; }
    public static BoolVal make( boolean b ) { return b ? TRUE : FALSE; }
    @Override int kind() { return 1; }
    @Override int compare0( Value v ) { return Boolean.compare(_b,((BoolVal)v)._b); }
    @Override public boolean as_bool() { return _b; }
    @Override public SB str( SB sb ) { return sb.p(_b); }
    @Override public int hashCode() { return _b ? 1 : 0; }
  }

  // --- Values of user-defined types ------------------------------------------
  /** Distinct tags; two custom values are equal iff their tags are. */
  public static final class CustomVal extends Value {
    public final long _tag;
    public CustomVal( long tag ) { _tag = tag; }
    @Override int kind() { return 2; }
    @Override int compare0( Value v ) { return Long.compare(_tag,((CustomVal)v)._tag); }
    @Override public SB str( SB sb ) { return sb.p("custom_").p(_tag); }
    @Override public int hashCode() { return Long.hashCode(_tag)+7; }
  }

  // --- Map references ----------------------------------------------------------
  public static final class RefVal extends Value {
    public final int _ref;
    public RefVal( int ref ) { _ref = ref; }
    @Override int kind() { return 3; }
    @Override int compare0( Value v ) { return Integer.compare(_ref,((RefVal)v)._ref); }
    @Override public int as_ref() { return _ref; }
    @Override public boolean is_ref() { return true; }
    @Override public SB str( SB sb ) { return sb.p("ref_").p(_ref); }
    @Override public int hashCode() { return _ref*31+3; }
  }

  // --- Map contents ------------------------------------------------------------
  /** A heap cell: an optional base map plus the explicitly set elements.
   *  Immutable; {@link #put} copies. */
  public static final class MapVal extends Value {
    public static final int NO_BASE = -1;
    public final int _base;
    public final TreeMap<List<Value>,Value> _over;
    public MapVal( int base, TreeMap<List<Value>,Value> over ) { _base = base; _over = over; }
    public static MapVal empty() { return new MapVal(NO_BASE,new TreeMap<>(KEYS)); }
    public boolean has_base() { return _base != NO_BASE; }
    public MapVal put( List<Value> key, Value v ) {
      TreeMap<List<Value>,Value> over = new TreeMap<>(_over);
      over.put(key,v);
      return new MapVal(_base,over);
    }
    @Override int kind() { return 4; }
    @Override int compare0( Value v ) {
      MapVal m = (MapVal)v;
      if( _base != m._base ) return Integer.compare(_base,m._base);
      if( _over.size() != m._over.size() ) return _over.size()-m._over.size();
      Iterator<Map.Entry<List<Value>,Value>> i = m._over.entrySet().iterator();
      for( Map.Entry<List<Value>,Value> e : _over.entrySet() ) {
        Map.Entry<List<Value>,Value> f = i.next();
        int c = KEYS.compare(e.getKey(),f.getKey());
        if( c==0 ) c = e.getValue().compareTo(f.getValue());
        if( c!=0 ) return c;
      }
      return 0;
    }
    @Override public SB str( SB sb ) {
      if( has_base() ) sb.p("ref_").p(_base);
      sb.p('[');
      boolean first = true;
      for( Map.Entry<List<Value>,Value> e : _over.entrySet() ) {
        if( !first ) sb.p(", ");
        first = false;
        List<Value> k = e.getKey();
        for( int i=0; i<k.size(); i++ ) { if( i>0 ) sb.p(", "); k.get(i).str(sb); }
        e.getValue().str(sb.p(" -> "));
      }
      return sb.p(']');
    }
    @Override public int hashCode() { return _base*31+_over.hashCode(); }
  }

  // --- Dereferencing -----------------------------------------------------------
  /** Replace every reference, transitively, by a base-free {@link MapVal} in
   *  which overridden elements win over base elements. */
  public static Value deepDeref( Heap heap, Value v ) {
    if( v instanceof RefVal ) return deepDeref(heap,heap.at(v.as_ref()));
    if( !(v instanceof MapVal) ) return v;
    MapVal m = (MapVal)v;
    TreeMap<List<Value>,Value> all = new TreeMap<>(KEYS);
    if( m.has_base() ) all.putAll(((MapVal)deepDeref(heap,heap.at(m._base)))._over);
    for( Map.Entry<List<Value>,Value> e : m._over.entrySet() ) {
      List<Value> k = e.getKey();
      Value[] dk = new Value[k.size()];
      for( int i=0; i<dk.length; i++ ) dk[i] = deepDeref(heap,k.get(i));
      all.put(List.of(dk),deepDeref(heap,e.getValue()));
    }
    return new MapVal(MapVal.NO_BASE,all);
  }

  // --- Equality ----------------------------------------------------------------
  /** Three-valued equality: {@link Boolean#TRUE} if the values must be equal,
   *  {@link Boolean#FALSE} if they must differ, null if it depends on map
   *  elements not yet chosen. */
  public static Boolean objectEq( Heap heap, Value v1, Value v2 ) {
    if( !(v1 instanceof RefVal) || !(v2 instanceof RefVal) ) return v1.equals(v2);
    int r1 = v1.as_ref(), r2 = v2.as_ref();
    if( r1==r2 ) return Boolean.TRUE;
    MapVal c1 = heap.at(r1), c2 = heap.at(r2);
    int b1 = c1.has_base() ? c1._base : r1;
    int b2 = c2.has_base() ? c2._base : r2;
    Map<List<Value>,Value> o1 = c1.has_base() ? c1._over : Collections.emptyMap();
    Map<List<Value>,Value> o2 = c2.has_base() ? c2._over : Collections.emptyMap();
    // Elements either side knows, read through the base chains
    TreeSet<List<Value>> keys = new TreeSet<>(KEYS);
    keys.addAll(o1.keySet());
    keys.addAll(o2.keySet());
    boolean agree = b1==b2;
    for( List<Value> k : keys ) {
      Value x = heap.lookup(r1,k), y = heap.lookup(r2,k);
      Boolean eq = x==null || y==null ? null : objectEq(heap,x,y);
      if( eq==Boolean.FALSE ) return Boolean.FALSE;
      if( eq==null ) agree = false;
    }
    return agree ? Boolean.TRUE : null;
  }
}
