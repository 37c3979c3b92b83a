package com.galois.symbolicSemantics;

import java.math.BigInteger;

/** Builders for symbolic values.
 *
 *  Most operations simply wrap their operands in a new internal node.  Only
 *  addition and the width-changing operations fold constants, since those are
 *  what stack-pointer and address arithmetic is made of.
 */
public final class ValueOps {

    private ValueOps() {}

    // Result of addWithCarries
    public static final class AddResult {
        public final SymbolicValue sum;

        // bit i is the carry out of bit i of the addition
        public final SymbolicValue carries;

        AddResult( SymbolicValue sum, SymbolicValue carries ) {
            this.sum = sum;
            this.carries = carries;
        }
    }

    public static SymbolicValue add( SymbolicValue a, SymbolicValue b ) {
        int n = sameWidth( "add", a, b );
        if( a.isKnown() ) {
            if( b.isKnown() ) {
                return SymbolicValue.number( n, a.getValue().add( b.getValue() ) );
            } else if( a.getValue().signum() == 0 ) {
                return b;
            }
        } else if( b.isKnown() && b.getValue().signum() == 0 ) {
            return a;
        }
        return node( n, Operator.ADD, a, b );
    }

    /** Adds two values and a carry bit, also returning the carry out of
     *  every bit position, the tick marks one writes above the addends when
     *  adding by hand:
     *  <pre>
     *    '''..'..         ' = carry, . = no carry
     *     00110110
     *   + 11100100
     *   ----------
     *    100011010        carries = 11100100
     *  </pre>
     */
    public static AddResult addWithCarries( SymbolicValue a, SymbolicValue b, SymbolicValue c ) {
        int n = sameWidth( "addWithCarries", a, b );
        requireWidth( "carry-in", c, 1 );

        SymbolicValue aa = unsignedExtend( a, n + 1 );
        SymbolicValue bb = unsignedExtend( b, n + 1 );
        SymbolicValue cc = unsignedExtend( c, n + 1 );
        SymbolicValue sumco = add( aa, add( bb, cc ) );
        SymbolicValue carries = extract( xor( aa, xor( bb, sumco ) ), 1, n + 1 );

        SymbolicValue sum = add( a, add( b, unsignedExtend( c, n ) ) );
        return new AddResult( sum, carries );
    }

    public static SymbolicValue and( SymbolicValue a, SymbolicValue b ) {
        return node( sameWidth( "and", a, b ), Operator.BV_AND, a, b );
    }

    public static SymbolicValue or( SymbolicValue a, SymbolicValue b ) {
        return node( sameWidth( "or", a, b ), Operator.BV_OR, a, b );
    }

    public static SymbolicValue xor( SymbolicValue a, SymbolicValue b ) {
        return node( sameWidth( "xor", a, b ), Operator.BV_XOR, a, b );
    }

    // One's complement
    public static SymbolicValue invert( SymbolicValue a ) {
        return node( a.getNbits(), Operator.INVERT, a );
    }

    // Two's complement
    public static SymbolicValue negate( SymbolicValue a ) {
        return node( a.getNbits(), Operator.NEGATE, a );
    }

    public static SymbolicValue ite( SymbolicValue sel, SymbolicValue ifTrue, SymbolicValue ifFalse ) {
        requireWidth( "ite selector", sel, 1 );
        return node( sameWidth( "ite", ifTrue, ifFalse ), Operator.ITE, sel, ifTrue, ifFalse );
    }

    /** Concatenates two values; {@code hi} ends up in the high-order bits of
     *  the result and {@code lo} in the low-order bits. */
    public static SymbolicValue concat( SymbolicValue lo, SymbolicValue hi ) {
        return node( lo.getNbits() + hi.getNbits(), Operator.CONCAT, hi, lo );
    }

    /** Bits [begin, end) of {@code a}, shifted down to bit zero. */
    public static SymbolicValue extract( SymbolicValue a, int begin, int end ) {
        if( begin < 0 || begin >= end || end > a.getNbits() ) {
            throw new IllegalArgumentException( "invalid extract [" + begin + ", " + end + ") from " + a.getNbits() + " bits" );
        }
        if( begin == 0 ) {
            return unsignedExtend( a, end );
        }
        int n = end - begin;
        if( a.isKnown() ) {
            return SymbolicValue.number( n, a.getValue().shiftRight( begin ) );
        }
        return new SymbolicValue( new InternalNode( n, Operator.EXTRACT, size( begin ), size( end ), a.getExpression() ) );
    }

    /** Widens with zeros, or truncates, {@code a} to {@code to} bits. */
    public static SymbolicValue unsignedExtend( SymbolicValue a, int to ) {
        int from = a.getNbits();
        if( from == to ) {
            return a;
        }
        if( a.isKnown() ) {
            return SymbolicValue.number( to, a.getValue() );
        }
        if( from > to ) {
            return truncate( a, to );
        }
        return new SymbolicValue( new InternalNode( to, Operator.UEXTEND, size( to ), a.getExpression() ) );
    }

    /** Widens {@code a} to {@code to} bits replicating its sign bit, or truncates it. */
    public static SymbolicValue signedExtend( SymbolicValue a, int to ) {
        int from = a.getNbits();
        if( from == to ) {
            return a;
        }
        if( a.isKnown() ) {
            BigInteger v = a.getValue();
            if( to > from && v.testBit( from - 1 ) ) {
                v = v.or( ConstantNode.mask( to ).xor( ConstantNode.mask( from ) ) );
            }
            return SymbolicValue.number( to, v );
        }
        if( from > to ) {
            return truncate( a, to );
        }
        return new SymbolicValue( new InternalNode( to, Operator.SEXTEND, size( to ), a.getExpression() ) );
    }

    public static SymbolicValue rotateLeft( SymbolicValue a, SymbolicValue sa ) {
        return shiftLike( Operator.ROL, a, sa );
    }

    public static SymbolicValue rotateRight( SymbolicValue a, SymbolicValue sa ) {
        return shiftLike( Operator.ROR, a, sa );
    }

    public static SymbolicValue shiftLeft( SymbolicValue a, SymbolicValue sa ) {
        return shiftLike( Operator.SHL0, a, sa );
    }

    // logical, zeros shifted in at the msb
    public static SymbolicValue shiftRight( SymbolicValue a, SymbolicValue sa ) {
        return shiftLike( Operator.SHR0, a, sa );
    }

    public static SymbolicValue shiftRightArithmetic( SymbolicValue a, SymbolicValue sa ) {
        return shiftLike( Operator.ASR, a, sa );
    }

    public static SymbolicValue signedDivide( SymbolicValue a, SymbolicValue b ) {
        return node( a.getNbits(), Operator.SDIV, a, b );
    }

    public static SymbolicValue signedModulo( SymbolicValue a, SymbolicValue b ) {
        return node( b.getNbits(), Operator.SMOD, a, b );
    }

    public static SymbolicValue signedMultiply( SymbolicValue a, SymbolicValue b ) {
        return node( a.getNbits() + b.getNbits(), Operator.SMUL, a, b );
    }

    public static SymbolicValue unsignedDivide( SymbolicValue a, SymbolicValue b ) {
        return node( a.getNbits(), Operator.UDIV, a, b );
    }

    public static SymbolicValue unsignedModulo( SymbolicValue a, SymbolicValue b ) {
        return node( b.getNbits(), Operator.UMOD, a, b );
    }

    public static SymbolicValue unsignedMultiply( SymbolicValue a, SymbolicValue b ) {
        return node( a.getNbits() + b.getNbits(), Operator.UMUL, a, b );
    }

    public static SymbolicValue equalToZero( SymbolicValue a ) {
        return node( 1, Operator.ZEROP, a );
    }

    public static SymbolicValue leastSignificantSetBit( SymbolicValue a ) {
        return node( a.getNbits(), Operator.LSSB, a );
    }

    public static SymbolicValue mostSignificantSetBit( SymbolicValue a ) {
        return node( a.getNbits(), Operator.MSSB, a );
    }

    public static SymbolicValue equal( SymbolicValue a, SymbolicValue b ) {
        sameWidth( "equal", a, b );
        return node( 1, Operator.EQ, a, b );
    }

    public static SymbolicValue notEqual( SymbolicValue a, SymbolicValue b ) {
        sameWidth( "notEqual", a, b );
        return node( 1, Operator.NE, a, b );
    }

    public static SymbolicValue boolAnd( SymbolicValue a, SymbolicValue b ) {
        requireWidth( "boolAnd", a, 1 );
        requireWidth( "boolAnd", b, 1 );
        return node( 1, Operator.AND, a, b );
    }

    public static SymbolicValue boolOr( SymbolicValue a, SymbolicValue b ) {
        requireWidth( "boolOr", a, 1 );
        requireWidth( "boolOr", b, 1 );
        return node( 1, Operator.OR, a, b );
    }

    private static SymbolicValue truncate( SymbolicValue a, int to ) {
        return new SymbolicValue( new InternalNode( to, Operator.EXTRACT, size( 0 ), size( to ), a.getExpression() ) );
    }

    private static SymbolicValue shiftLike( Operator op, SymbolicValue a, SymbolicValue sa ) {
        return node( a.getNbits(), op, sa, a );
    }

    // size and position operands are 32-bit constants
    private static TreeNode size( int n ) {
        return new ConstantNode( 32, n );
    }

    private static SymbolicValue node( int nbits, Operator op, SymbolicValue... operands ) {
        TreeNode[] kids = new TreeNode[operands.length];
        for( int i = 0; i < operands.length; i++ ) {
            kids[i] = operands[i].getExpression();
        }
        return new SymbolicValue( new InternalNode( nbits, op, kids ) );
    }

    private static int sameWidth( String what, SymbolicValue a, SymbolicValue b ) {
        if( a.getNbits() != b.getNbits() ) {
            throw new IllegalArgumentException( what + ": operand widths differ: " + a.getNbits() + " vs " + b.getNbits() );
        }
        return a.getNbits();
    }

    private static void requireWidth( String what, SymbolicValue a, int nbits ) {
        if( a.getNbits() != nbits ) {
            throw new IllegalArgumentException( what + ": expected " + nbits + " bits, got " + a.getNbits() );
        }
    }
}
