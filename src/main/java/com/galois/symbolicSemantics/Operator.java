package com.galois.symbolicSemantics;

// Operators for internal nodes of the expression tree.  Shifting, rotating,
// extending and extracting take the amount/size operands before the bit vector
// they operate on, so the constant operands print first.
public enum Operator {
    ADD      ( "add",    1, 3 ), // one or more operands, all the same width
    AND      ( "and",    1, 3 ), // Boolean AND over 1-bit operands
    ASR      ( "asr",    2, 2 ), // B shifted right arithmetically by A bits
    BV_AND   ( "bv-and", 1, 3 ),
    BV_OR    ( "bv-or",  1, 3 ),
    BV_XOR   ( "bv-xor", 1, 3 ),
    CONCAT   ( "concat", 1, 3 ), // first operand becomes the high-order bits
    EQ       ( "eq",     2, 2 ),
    EXTRACT  ( "extract", 3, 3 ), // bits [A..B) of C, 0 <= A < B <= width(C)
    INVERT   ( "invert", 1, 1 ),
    ITE      ( "ite",    3, 3 ), // A is one bit; B if A is set, C otherwise
    LSSB     ( "lssb",   1, 1 ), // least significant set bit or zero
    MSSB     ( "mssb",   1, 1 ), // most significant set bit or zero
    NE       ( "ne",     2, 2 ),
    NEGATE   ( "negate", 1, 1 ),
    NOOP     ( "noop",   1, 3 ),
    OR       ( "or",     1, 3 ), // Boolean OR over 1-bit operands
    ROL      ( "rol",    2, 2 ), // rotate B left by A bits
    ROR      ( "ror",    2, 2 ), // rotate B right by A bits
    SDIV     ( "sdiv",   2, 2 ), // A/B, width(A)
    SEXTEND  ( "sext",   2, 2 ), // extend B to A bits replicating its msb
    SHL0     ( "shl0",   2, 2 ),
    SHL1     ( "shl1",   2, 2 ),
    SHR0     ( "shr0",   2, 2 ),
    SHR1     ( "shr1",   2, 2 ),
    SMOD     ( "smod",   2, 2 ), // A%B, width(B)
    SMUL     ( "smul",   2, 2 ), // A*B, width(A)+width(B)
    UDIV     ( "udiv",   2, 2 ),
    UEXTEND  ( "uext",   2, 2 ), // extend B to A bits introducing zeros at the msb
    UMOD     ( "umod",   2, 2 ),
    UMUL     ( "umul",   2, 2 ),
    ZEROP    ( "zerop",  1, 1 ); // single bit, set iff A is zero

    private final String mnemonic;
    private final int minArgs;
    private final int maxArgs;

    Operator( String mnemonic, int minArgs, int maxArgs ) {
        this.mnemonic = mnemonic;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public boolean acceptsArity( int n ) {
        return n >= minArgs && n <= maxArgs;
    }

    public String toString() {
        return mnemonic;
    }
}
