package com.galois.symbolicSemantics;

import java.math.BigInteger;

/** A bit vector of fixed width whose contents is an expression tree.
 *  The value is "known" when the root of its tree is a constant leaf.
 */
public final class SymbolicValue {
    private final int nbits;
    private final TreeNode expr;

    public SymbolicValue( TreeNode expr ) {
        if( expr == null ) throw new NullPointerException( "expr" );
        this.nbits = expr.getNbits();
        this.expr = expr;
    }

    public static SymbolicValue number( int nbits, long n ) {
        return new SymbolicValue( new ConstantNode( nbits, n ) );
    }

    public static SymbolicValue number( int nbits, BigInteger n ) {
        return new SymbolicValue( new ConstantNode( nbits, n ) );
    }

    /** A new, unconstrained value distinct from every other value built so far. */
    public static SymbolicValue fresh( NameGenerator names, int nbits ) {
        return new SymbolicValue( new VariableNode( nbits, names.next() ) );
    }

    public int getNbits() {
        return nbits;
    }

    public TreeNode getExpression() {
        return expr;
    }

    public boolean isKnown() {
        return expr.isKnown();
    }

    public BigInteger getValue() {
        return expr.getValue();
    }

    // Known values of up to 64 bits; wider ones keep their low 64 bits.
    public long longValue() {
        return expr.getValue().longValue();
    }

    public boolean equalTo( SymbolicValue other ) {
        return other != null && expr.equalTo( other.expr );
    }

    public void print( StringBuilder sb, RenameMap rmap ) {
        expr.print( sb, rmap );
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        print( sb, null );
        sb.append( ":[" ).append( nbits ).append( ']' );
        return sb.toString();
    }
}
