package com.galois.symbolicSemantics;

import java.math.BigInteger;

/** One location in memory: an address, the data stored there (always kept
 *  zero-extended to 32 bits) and the number of bytes the access covered.
 *
 *  Every address implicitly holds its own named value.  Cells exist only for
 *  addresses that have actually been read or written:
 *  <pre>
 *  1: mov eax, ds:[edx]    // first read returns V1
 *  2: mov eax, ds:[edx]    // later reads from the same address also return V1
 *  3: mov ds:[ecx], eax    // write to an unknown address clobbers all memory
 *  4: mov eax, ds:[edx]    // read from the same address now returns V2
 *  5: mov eax, ds:[edx]    // and keeps returning V2
 *  </pre>
 */
public class MemoryCell {
    public static final int ADDR_BITS = 32;
    public static final int DATA_BITS = 32;

    private static final BigInteger ADDR_SPACE = BigInteger.ONE.shiftLeft( ADDR_BITS );

    SymbolicValue address;
    SymbolicValue data;
    int nbytes;
    boolean clobbered; // a possibly-aliasing write has invalidated the data
    boolean written;   // produced by a write rather than a lazily materialized read

    public MemoryCell( SymbolicValue address, SymbolicValue data, int nbytes ) {
        if( address.getNbits() != ADDR_BITS ) {
            throw new IllegalArgumentException( "memory address must be " + ADDR_BITS + " bits: " + address );
        }
        if( data.getNbits() != DATA_BITS ) {
            throw new IllegalArgumentException( "memory data must be " + DATA_BITS + " bits: " + data );
        }
        if( nbytes <= 0 || nbytes > DATA_BITS / 8 ) {
            throw new IllegalArgumentException( "invalid memory cell size " + nbytes );
        }
        this.address = address;
        this.data = data;
        this.nbytes = nbytes;
    }

    public MemoryCell( MemoryCell other ) {
        this.address = other.address;
        this.data = other.data;
        this.nbytes = other.nbytes;
        this.clobbered = other.clobbered;
        this.written = other.written;
    }

    public SymbolicValue getAddress() {
        return address;
    }

    public SymbolicValue getData() {
        return data;
    }

    public int getNbytes() {
        return nbytes;
    }

    public boolean isClobbered() {
        return clobbered;
    }

    public void setClobbered() {
        clobbered = true;
    }

    public boolean isWritten() {
        return written;
    }

    public void setWritten() {
        written = true;
    }

    /** False only if this cell provably cannot overlap the other.  That is
     *  provable when both addresses are constants whose byte ranges are
     *  disjoint; a symbolic address may alias anything. */
    public boolean mayAlias( MemoryCell other ) {
        if( mustAlias( other ) ) {
            return true;
        }
        if( address.isKnown() && other.address.isKnown() ) {
            BigInteger a = address.getValue();
            BigInteger b = other.address.getValue();
            // distance from a up to b, and from b up to a, modulo the address space
            BigInteger ab = b.subtract( a ).mod( ADDR_SPACE );
            BigInteger ba = a.subtract( b ).mod( ADDR_SPACE );
            return ab.compareTo( BigInteger.valueOf( nbytes ) ) < 0
                || ba.compareTo( BigInteger.valueOf( other.nbytes ) ) < 0;
        }
        return true;
    }

    /** True if both cells provably denote the same location: structurally
     *  equal addresses covering the same number of bytes. */
    public boolean mustAlias( MemoryCell other ) {
        return nbytes == other.nbytes && address.equalTo( other.address );
    }

    public void print( StringBuilder sb, RenameMap rmap ) {
        sb.append( "addr=" );
        address.print( sb, rmap );
        sb.append( " data=" );
        data.print( sb, rmap );
        sb.append( " size=" ).append( nbytes );
        if( clobbered ) sb.append( " clobbered" );
        if( written ) sb.append( " written" );
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        print( sb, null );
        return sb.toString();
    }
}
