package com.galois.symbolicSemantics;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.*;
import static org.junit.Assert.*;

public class TestMachineState {
    NameGenerator names;
    MachineState state;

    @Before
    public void initialize() {
        names = new NameGenerator();
        state = new MachineState( names );
    }

    @Test
    public void testBlankState() {
        for( X86.Register r : X86.Register.values() ) {
            SymbolicValue v = state.readReg( r );
            assertEquals( r.name(), X86.GPR_BITS, v.getNbits() );
            assertFalse( r.name() + " is unknown", v.isKnown() );
            for( X86.Register s : X86.Register.values() ) {
                if( s != r ) {
                    assertFalse( r + " vs " + s, v.equalTo( state.readReg( s ) ) );
                }
            }
        }
        for( X86.SegmentRegister sr : X86.SegmentRegister.values() ) {
            assertEquals( sr.name(), X86.SEGREG_BITS, state.readSegreg( sr ).getNbits() );
        }
        for( X86.Flag f : X86.Flag.values() ) {
            assertEquals( f.name(), X86.FLAG_BITS, state.readFlag( f ).getNbits() );
            assertFalse( state.readFlag( f ).isKnown() );
        }
        assertEquals( X86.GPR_BITS, state.getIP().getNbits() );
        assertTrue( state.getMemory().isEmpty() );

        assertFalse( "two blank states share nothing", state.equalRegisters( new MachineState( names ) ) );
    }

    @Test
    public void testRegisterFileLayout() {
        assertEquals( 8, X86.N_GPRS );
        assertEquals( 6, X86.N_SEGREGS );
        assertEquals( 16, X86.N_FLAGS );
        assertEquals( 6, X86.Flag.ZF.ordinal() );
        assertEquals( 11, X86.Flag.OF.ordinal() );
        assertEquals( 4, X86.Register.ESP.ordinal() );
    }

    @Test
    public void testWriteRead() {
        SymbolicValue v = SymbolicValue.number( 32, 0x1234 );
        state.writeReg( X86.Register.EBX, v );
        assertSame( v, state.readReg( X86.Register.EBX ) );

        SymbolicValue ds = SymbolicValue.number( 16, 0x2b );
        state.writeSegreg( X86.SegmentRegister.DS, ds );
        assertSame( ds, state.readSegreg( X86.SegmentRegister.DS ) );

        state.writeFlag( X86.Flag.ZF, SymbolicValue.number( 1, 1 ) );
        assertEquals( 1L, state.readFlag( X86.Flag.ZF ).longValue() );
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRegisterWidth() {
        state.writeReg( X86.Register.EAX, SymbolicValue.number( 16, 1 ) );
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFlagWidth() {
        state.writeFlag( X86.Flag.CF, SymbolicValue.number( 32, 1 ) );
    }

    @Test
    public void testCopy() {
        state.getMemory().add( new MemoryCell( SymbolicValue.number( 32, 0x1000 ), SymbolicValue.fresh( names, 32 ), 4 ) );
        MachineState copy = new MachineState( state );

        assertTrue( copy.equalRegisters( state ) );
        assertTrue( copy.getIP().equalTo( state.getIP() ) );
        assertEquals( 1, copy.getMemory().size() );

        copy.writeReg( X86.Register.EAX, SymbolicValue.number( 32, 0 ) );
        assertFalse( "register files are independent", state.readReg( X86.Register.EAX ).isKnown() );

        copy.getMemory().get( 0 ).setClobbered();
        copy.getMemory().add( new MemoryCell( SymbolicValue.number( 32, 0x2000 ), SymbolicValue.fresh( names, 32 ), 4 ) );
        assertFalse( "cells are copied", state.getMemory().get( 0 ).isClobbered() );
        assertEquals( "cell lists are copied", 1, state.getMemory().size() );
    }

    @Test
    public void testEqualRegistersIgnoresIP() {
        MachineState copy = new MachineState( state );
        copy.setIP( SymbolicValue.number( 32, 0x8048000 ) );
        assertTrue( copy.equalRegisters( state ) );

        copy.writeFlag( X86.Flag.CF, SymbolicValue.number( 1, 0 ) );
        assertFalse( copy.equalRegisters( state ) );
    }

    @Test
    public void testPrint() {
        state.writeReg( X86.Register.EAX, SymbolicValue.number( 32, 0x10 ) );
        String text = state.toString();
        assertTrue( text, text.contains( "    eax = 0x10\n" ) );
        assertTrue( text, text.contains( "    zf = v" ) );
        assertTrue( text, text.contains( "memory:\n" ) );

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream( bytes );
        RenameMap rmap = new RenameMap();
        state.print( out, rmap );
        out.flush();
        assertTrue( "renamed from one", bytes.toString().contains( "    ip = v1\n" ) );
    }

    @Test
    public void testPrintDiff() {
        MachineState copy = new MachineState( state );
        copy.writeReg( X86.Register.ECX, SymbolicValue.number( 32, 7 ) );

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream( bytes );
        state.printDiffRegisters( out, copy, null );
        out.flush();
        String text = bytes.toString();
        assertTrue( text, text.contains( "    ecx: v" ) );
        assertTrue( text, text.endsWith( " -> 0x7\n" ) );
        assertFalse( text, text.contains( "eax" ) );
    }
}
