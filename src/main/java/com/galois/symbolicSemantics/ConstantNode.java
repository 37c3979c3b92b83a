package com.galois.symbolicSemantics;

import java.math.BigInteger;

// A leaf with a known value.  Bits above nbits are always zero.
public final class ConstantNode extends TreeNode {
    private final BigInteger value;

    public ConstantNode( int nbits, BigInteger value ) {
        super( nbits );
        if( value == null ) throw new NullPointerException( "value" );
        this.value = value.and( mask( nbits ) );
    }

    public ConstantNode( int nbits, long value ) {
        this( nbits, unsigned( value ) );
    }

    public static BigInteger mask( int nbits ) {
        return BigInteger.ONE.shiftLeft( nbits ).subtract( BigInteger.ONE );
    }

    // the two's complement bit pattern of a long, read as unsigned
    static BigInteger unsigned( long value ) {
        BigInteger v = BigInteger.valueOf( value );
        return value < 0 ? v.add( BigInteger.ONE.shiftLeft( 64 ) ) : v;
    }

    public <T> T accept( Visitor<T> v ) {
        return v.visitConstant( this );
    }

    public boolean isKnown() {
        return true;
    }

    public BigInteger getValue() {
        return value;
    }

    public boolean equalTo( TreeNode other ) {
        if( other == this ) return true;
        return other != null && other.accept( new Matcher() {
                public Boolean visitConstant( ConstantNode c ) {
                    return nbits == c.nbits && value.equals( c.value );
                }
            });
    }

    public void print( StringBuilder sb, RenameMap rmap ) {
        sb.append( "0x" ).append( value.toString( 16 ) );
    }
}
