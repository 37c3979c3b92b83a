package com.galois.symbolicSemantics;

import java.io.PrintStream;

// Machine state for symbolic execution of one basic block: instruction
// pointer, register file, flags and the memory cells touched so far.
public class MachineState {
    SymbolicValue ip;
    SymbolicValue[] gpr;
    SymbolicValue[] segreg;
    SymbolicValue[] flag;
    Memory mem;

    // A blank state: every register, flag and the instruction pointer holds a
    // fresh, unconstrained value, and no memory has been touched.
    public MachineState( NameGenerator names ) {
        ip = SymbolicValue.fresh( names, X86.GPR_BITS );
        gpr = new SymbolicValue[X86.N_GPRS];
        for( int i = 0; i < gpr.length; i++ ) {
            gpr[i] = SymbolicValue.fresh( names, X86.GPR_BITS );
        }
        segreg = new SymbolicValue[X86.N_SEGREGS];
        for( int i = 0; i < segreg.length; i++ ) {
            segreg[i] = SymbolicValue.fresh( names, X86.SEGREG_BITS );
        }
        flag = new SymbolicValue[X86.N_FLAGS];
        for( int i = 0; i < flag.length; i++ ) {
            flag[i] = SymbolicValue.fresh( names, X86.FLAG_BITS );
        }
        mem = new Memory();
    }

    // Values are immutable and shared; memory cells are copied.
    public MachineState( MachineState other ) {
        ip = other.ip;
        gpr = other.gpr.clone();
        segreg = other.segreg.clone();
        flag = other.flag.clone();
        mem = new Memory( other.mem );
    }

    public SymbolicValue getIP() {
        return ip;
    }

    public void setIP( SymbolicValue value ) {
        ip = checkWidth( "instruction pointer", value, X86.GPR_BITS );
    }

    public SymbolicValue readReg( X86.Register r ) {
        return gpr[r.ordinal()];
    }

    public void writeReg( X86.Register r, SymbolicValue value ) {
        gpr[r.ordinal()] = checkWidth( r.name(), value, X86.GPR_BITS );
    }

    public SymbolicValue readSegreg( X86.SegmentRegister sr ) {
        return segreg[sr.ordinal()];
    }

    public void writeSegreg( X86.SegmentRegister sr, SymbolicValue value ) {
        segreg[sr.ordinal()] = checkWidth( sr.name(), value, X86.SEGREG_BITS );
    }

    public SymbolicValue readFlag( X86.Flag f ) {
        return flag[f.ordinal()];
    }

    public void writeFlag( X86.Flag f, SymbolicValue value ) {
        flag[f.ordinal()] = checkWidth( f.name(), value, X86.FLAG_BITS );
    }

    public Memory getMemory() {
        return mem;
    }

    /** Compares general-purpose registers, segment registers and flags.
     *  The instruction pointer is not part of the comparison. */
    public boolean equalRegisters( MachineState other ) {
        return allEqual( gpr, other.gpr )
            && allEqual( segreg, other.segreg )
            && allEqual( flag, other.flag );
    }

    /** Removes memory below the stack pointer.
     *  Not implemented: memory is left untouched. */
    public void discardPoppedMemory() {
    }

    public void print( PrintStream out, RenameMap rmap ) {
        StringBuilder sb = new StringBuilder();
        print( sb, rmap );
        out.print( sb );
    }

    public void print( StringBuilder sb, RenameMap rmap ) {
        line( sb, "ip", ip, rmap );
        for( X86.Register r : X86.Register.values() ) {
            line( sb, r.name().toLowerCase(), gpr[r.ordinal()], rmap );
        }
        for( X86.SegmentRegister sr : X86.SegmentRegister.values() ) {
            line( sb, sr.name().toLowerCase(), segreg[sr.ordinal()], rmap );
        }
        for( X86.Flag f : X86.Flag.values() ) {
            line( sb, f.name().toLowerCase(), flag[f.ordinal()], rmap );
        }
        sb.append( "memory:\n" );
        mem.print( sb, rmap );
    }

    // Prints the registers whose values differ between this state and the other.
    public void printDiffRegisters( PrintStream out, MachineState other, RenameMap rmap ) {
        StringBuilder sb = new StringBuilder();
        for( X86.Register r : X86.Register.values() ) {
            diffLine( sb, r.name().toLowerCase(), gpr[r.ordinal()], other.gpr[r.ordinal()], rmap );
        }
        for( X86.SegmentRegister sr : X86.SegmentRegister.values() ) {
            diffLine( sb, sr.name().toLowerCase(), segreg[sr.ordinal()], other.segreg[sr.ordinal()], rmap );
        }
        for( X86.Flag f : X86.Flag.values() ) {
            diffLine( sb, f.name().toLowerCase(), flag[f.ordinal()], other.flag[f.ordinal()], rmap );
        }
        out.print( sb );
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        print( sb, null );
        return sb.toString();
    }

    private static boolean allEqual( SymbolicValue[] a, SymbolicValue[] b ) {
        for( int i = 0; i < a.length; i++ ) {
            if( !a[i].equalTo( b[i] ) ) {
                return false;
            }
        }
        return true;
    }

    private static void line( StringBuilder sb, String name, SymbolicValue v, RenameMap rmap ) {
        sb.append( "    " ).append( name ).append( " = " );
        v.print( sb, rmap );
        sb.append( '\n' );
    }

    private static void diffLine( StringBuilder sb, String name, SymbolicValue v1, SymbolicValue v2, RenameMap rmap ) {
        if( v1.equalTo( v2 ) ) {
            return;
        }
        sb.append( "    " ).append( name ).append( ": " );
        v1.print( sb, rmap );
        sb.append( " -> " );
        v2.print( sb, rmap );
        sb.append( '\n' );
    }

    private static SymbolicValue checkWidth( String what, SymbolicValue value, int nbits ) {
        if( value.getNbits() != nbits ) {
            throw new IllegalArgumentException( what + " is " + nbits + " bits wide, got " + value );
        }
        return value;
    }
}
