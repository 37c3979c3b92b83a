package com.galois.symbolicSemantics;

import org.junit.*;
import static org.junit.Assert.*;

public class TestMemoryCell {
    NameGenerator names;

    @Before
    public void initialize() {
        names = new NameGenerator();
    }

    MemoryCell cell( SymbolicValue addr, int nbytes ) {
        return new MemoryCell( addr, SymbolicValue.fresh( names, 32 ), nbytes );
    }

    MemoryCell cell( long addr, int nbytes ) {
        return cell( SymbolicValue.number( 32, addr ), nbytes );
    }

    @Test
    public void testSelfAlias() {
        MemoryCell a = cell( SymbolicValue.fresh( names, 32 ), 4 );
        assertTrue( a.mustAlias( a ) );
        assertTrue( a.mayAlias( a ) );

        MemoryCell k = cell( 0x1000, 2 );
        assertTrue( k.mustAlias( k ) );
        assertTrue( k.mayAlias( k ) );
    }

    @Test
    public void testKnownAddresses() {
        assertFalse( "adjacent words", cell( 0x1000, 4 ).mayAlias( cell( 0x1004, 4 ) ) );
        assertFalse( "adjacent words, reversed", cell( 0x1004, 4 ).mayAlias( cell( 0x1000, 4 ) ) );
        assertTrue( "overlapping words", cell( 0x1002, 4 ).mayAlias( cell( 0x1000, 4 ) ) );
        assertTrue( "overlapping words, reversed", cell( 0x1000, 4 ).mayAlias( cell( 0x1002, 4 ) ) );
        assertTrue( "byte inside word", cell( 0x1000, 4 ).mayAlias( cell( 0x1003, 1 ) ) );
        assertFalse( "byte after word", cell( 0x1000, 4 ).mayAlias( cell( 0x1004, 1 ) ) );
        assertFalse( "same address, different sizes", cell( 0x1000, 4 ).mustAlias( cell( 0x1000, 2 ) ) );
        assertTrue( cell( 0x1000, 4 ).mustAlias( cell( 0x1000, 4 ) ) );
    }

    @Test
    public void testWraparound() {
        assertTrue( "range wraps past the top of memory", cell( 0xfffffffeL, 4 ).mayAlias( cell( 0, 1 ) ) );
        assertTrue( cell( 0, 1 ).mayAlias( cell( 0xfffffffeL, 4 ) ) );
        assertFalse( cell( 0xfffffffeL, 2 ).mayAlias( cell( 0, 1 ) ) );
    }

    @Test
    public void testSymbolicAddresses() {
        SymbolicValue edx = SymbolicValue.fresh( names, 32 );
        SymbolicValue ecx = SymbolicValue.fresh( names, 32 );
        MemoryCell a = cell( edx, 4 );
        MemoryCell b = cell( ecx, 4 );
        assertFalse( a.mustAlias( b ) );
        assertTrue( "unknown addresses may alias", a.mayAlias( b ) );
        assertTrue( "symbolic vs known", a.mayAlias( cell( 0x1000, 4 ) ) );

        // same address expression, different access sizes
        MemoryCell c = cell( edx, 2 );
        assertFalse( a.mustAlias( c ) );
        assertTrue( a.mayAlias( c ) );

        // structurally equal address computed twice
        SymbolicValue p1 = ValueOps.add( edx, SymbolicValue.number( 32, 8 ) );
        SymbolicValue p2 = ValueOps.add( edx, SymbolicValue.number( 32, 8 ) );
        assertTrue( cell( p1, 4 ).mustAlias( cell( p2, 4 ) ) );
    }

    @Test
    public void testMustImpliesMay() {
        SymbolicValue v = SymbolicValue.fresh( names, 32 );
        MemoryCell[] cells = {
            cell( 0, 1 ), cell( 0, 4 ), cell( 3, 1 ), cell( 4, 4 ), cell( 0xffffffffL, 1 ),
            cell( v, 1 ), cell( v, 4 ), cell( ValueOps.add( v, SymbolicValue.number( 32, 4 ) ), 4 )
        };
        for( MemoryCell a : cells ) {
            for( MemoryCell b : cells ) {
                assertEquals( "symmetric may-alias " + a + " / " + b, a.mayAlias( b ), b.mayAlias( a ) );
                if( a.mustAlias( b ) ) {
                    assertTrue( "must implies may " + a + " / " + b, a.mayAlias( b ) );
                }
            }
        }
    }

    @Test
    public void testCopyIsIndependent() {
        MemoryCell a = cell( 0x2000, 4 );
        MemoryCell b = new MemoryCell( a );
        b.setClobbered();
        b.setWritten();
        assertFalse( a.isClobbered() );
        assertFalse( a.isWritten() );
        assertTrue( b.mustAlias( a ) );
        assertTrue( b.getData().equalTo( a.getData() ) );
    }

    @Test
    public void testPrint() {
        MemoryCell a = new MemoryCell( SymbolicValue.number( 32, 0x10 ), SymbolicValue.number( 32, 0xff ), 1 );
        a.setWritten();
        assertEquals( "addr=0x10 data=0xff size=1 written", a.toString() );
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroSize() {
        cell( 0x1000, 0 );
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNarrowData() {
        new MemoryCell( SymbolicValue.number( 32, 0 ), SymbolicValue.number( 8, 0 ), 1 );
    }
}
