package com.galois.symbolicSemantics;

import java.io.PrintStream;

/** Symbolic semantics for x86 instructions.
 *
 *  An instruction dispatcher calls {@link #startInstruction}, then any number
 *  of the accessors and value builders below, then {@link #finishInstruction},
 *  once per instruction of a basic block.  The policy keeps two states: the
 *  current state, updated by every instruction, and the original state, the
 *  lazily populated picture of the machine before the block ran.
 *
 *  Reading memory extends the state being read, so even "queries" that reach
 *  memory mutate the policy.  A policy is not safe for concurrent use; tree
 *  nodes it produces are immutable and may be shared.
 */
public class Policy {

    // How an address relates to the stack and frame pointers; see memoryReferenceType().
    public enum MemRefType { STACK_PTR, FRAME_PTR, OTHER_PTR }

    final NameGenerator names;
    MachineState origState;
    MachineState curState;
    Instruction curInsn;           // only set between startInstruction() and finishInstruction()
    boolean discardPoppedMemory;
    long ninsns;
    PrintStream out;               // trace output, may be null

    public Policy() {
        this( new NameGenerator(), null );
    }

    public Policy( PrintStream out ) {
        this( new NameGenerator(), out );
    }

    public Policy( NameGenerator names, PrintStream out ) {
        this.names = names;
        this.out = out;
        curState = new MachineState( names );
        // so that named values match; taken again at the first instruction
        origState = new MachineState( curState );
    }

    public MachineState getState() {
        return curState;
    }

    /** The original state is made equal to the current state by the
     *  constructor and again when the first instruction starts.  Values
     *  written through the accessors before that point therefore become
     *  part of the original state; memory written that way is what the
     *  block finds there, and memory clobbered that way is forgotten. */
    public MachineState getOrigState() {
        return origState;
    }

    public SymbolicValue getIP() {
        return curState.ip;
    }

    public SymbolicValue getOrigIP() {
        return origState.ip;
    }

    public long getInstructionCount() {
        return ninsns;
    }

    public Instruction getCurrentInstruction() {
        return curInsn;
    }

    /** When set, memory written via the stack pointer is assumed not to alias
     *  memory written via the frame pointer, and neither aliases other memory;
     *  popped stack memory is also dropped after each instruction.  Address
     *  classification and the dropping are not implemented yet, so for now the
     *  setting has no observable effect.  Off by default. */
    public void setDiscardPoppedMemory( boolean b ) {
        discardPoppedMemory = b;
    }

    public boolean getDiscardPoppedMemory() {
        return discardPoppedMemory;
    }

    /*************************************************************************
     * Instruction protocol
     *************************************************************************/

    public void startInstruction( Instruction insn ) {
        if( insn == null ) throw new NullPointerException( "insn" );
        curState.ip = number( X86.GPR_BITS, insn.getAddress() );
        if( 0 == ninsns++ ) {
            origState = new MachineState( curState );
            settleMemory( origState );
        }
        curInsn = insn;
        if( out != null ) {
            out.println( "0x" + Long.toHexString( insn.getAddress() ) + ": " + insn );
        }
    }

    public void finishInstruction( Instruction insn ) {
        if( discardPoppedMemory ) {
            curState.discardPoppedMemory();
        }
        curInsn = null;
    }

    /*************************************************************************
     * Memory
     *************************************************************************/

    /** Reads {@code nbits} bits from {@code addr} in the given state.
     *
     *  Repeated reads of an address return the same value unless a write
     *  that may alias it intervenes.  The first read of an address that no
     *  write in the state may alias is also recorded in the original state,
     *  turning that address's implicit value into an explicit one.  Passing
     *  the original state itself is allowed.
     */
    public SymbolicValue memRead( MachineState state, SymbolicValue addr, int nbits ) {
        int nbytes = accessBytes( nbits );
        MemoryCell newCell = new MemoryCell( addr, SymbolicValue.fresh( names, MemoryCell.DATA_BITS ), nbytes );
        boolean aliased = false; // is newCell aliased by any existing write?

        for( MemoryCell cell : state.mem ) {
            if( newCell.mustAlias( cell ) ) {
                if( cell.clobbered ) {
                    cell.clobbered = false;
                    cell.data = newCell.data;
                    return ValueOps.unsignedExtend( newCell.data, nbits );
                }
                return ValueOps.unsignedExtend( cell.data, nbits );
            } else if( newCell.mayAlias( cell ) && cell.written ) {
                aliased = true;
            }
        }

        if( !aliased && state != origState ) {
            // Not in this state and no write here may alias it, so the value is
            // whatever the original state holds there, created if need be.
            MemoryCell orig = origState.mem.findMustAlias( newCell );
            if( orig != null ) {
                if( orig.clobbered || orig.written ) {
                    throw new IllegalStateException( "original state holds a modified cell: " + orig );
                }
                state.mem.add( new MemoryCell( orig ) );
                return ValueOps.unsignedExtend( orig.data, nbits );
            }
            origState.mem.add( new MemoryCell( newCell ) );
        }

        state.mem.add( newCell );
        return ValueOps.unsignedExtend( newCell.data, nbits );
    }

    /** Writes {@code data} to {@code addr}.  Cells at the same address are
     *  replaced; cells that may alias it are clobbered, so later reads of them
     *  return new values.  Never allowed on the original state. */
    public void memWrite( MachineState state, SymbolicValue addr, SymbolicValue data ) {
        if( state == origState ) {
            throw new IllegalStateException( "memory writes to the original state are not allowed" );
        }
        int nbytes = accessBytes( data.getNbits() );
        MemoryCell newCell = new MemoryCell( addr, ValueOps.unsignedExtend( data, MemoryCell.DATA_BITS ), nbytes );
        newCell.setWritten();
        boolean saved = false; // has newCell been stored?

        MemRefType newMrt = memoryReferenceType( state, addr );

        Memory mem = state.mem;
        for( int i = 0; i < mem.size(); i++ ) {
            MemoryCell cell = mem.get( i );
            if( newCell.mustAlias( cell ) ) {
                mem.set( i, newCell );
                saved = true;
            } else if( discardPoppedMemory && newMrt != memoryReferenceType( state, cell.address ) ) {
                // stack, frame and other references are assumed not to alias
            } else if( newCell.mayAlias( cell ) ) {
                cell.setClobbered();
            }
        }
        if( !saved ) {
            mem.add( newCell );
        }
    }

    /** Classifies an address as relative to the stack pointer, the frame
     *  pointer, or neither.  Not implemented yet: every address is OTHER_PTR. */
    public MemRefType memoryReferenceType( MachineState state, SymbolicValue addr ) {
        return MemRefType.OTHER_PTR;
    }

    /** Memory relevant to comparing {@code state}: cells that were written,
     *  are not clobbered, and hold something other than what the original
     *  state holds at the same address.  The original state is not extended. */
    public Memory memoryForEquality( MachineState state ) {
        Memory retval = new Memory();
        for( MemoryCell cell : state.mem ) {
            if( !cell.written || cell.clobbered ) {
                continue;
            }
            MemoryCell orig = origState.mem.findMustAlias( cell );
            if( orig != null && orig.data.equalTo( cell.data ) ) {
                continue;
            }
            retval.add( cell );
        }
        return retval;
    }

    public Memory memoryForEquality() {
        return memoryForEquality( curState );
    }

    /** True if both states have equal registers and flags and the same
     *  modified memory.  Memory that was only read is not compared. */
    public boolean equalStates( MachineState s1, MachineState s2 ) {
        if( !s1.equalRegisters( s2 ) ) {
            return false;
        }
        Memory m1 = memoryForEquality( s1 );
        Memory m2 = memoryForEquality( s2 );
        return coveredBy( m1, m2 ) && coveredBy( m2, m1 );
    }

    /** True if {@code value} is stored as a 32-bit word in the current state
     *  at an address provably at or above the stack pointer. */
    public boolean onStack( SymbolicValue value ) {
        SymbolicValue sp = curState.readReg( X86.Register.ESP );
        for( MemoryCell cell : curState.mem ) {
            if( cell.nbytes != 4 || !cell.data.equalTo( value ) ) {
                continue;
            }
            if( cell.address.equalTo( sp ) ) {
                return true;
            }
            if( cell.address.isKnown() && sp.isKnown() && cell.address.getValue().compareTo( sp.getValue() ) >= 0 ) {
                return true;
            }
        }
        return false;
    }

    /*************************************************************************
     * Printing
     *************************************************************************/

    public void print( PrintStream o, RenameMap rmap ) {
        o.println( "instructions processed: " + ninsns );
        o.println( "original state:" );
        origState.print( o, rmap );
        o.println( "current state:" );
        curState.print( o, rmap );
    }

    // Registers that differ, then the modified memory of s2 that s1 lacks.
    public void printDiff( PrintStream o, MachineState s1, MachineState s2, RenameMap rmap ) {
        s1.printDiffRegisters( o, s2, rmap );
        Memory m1 = memoryForEquality( s1 );
        StringBuilder sb = new StringBuilder();
        for( MemoryCell cell : memoryForEquality( s2 ) ) {
            if( !hasCounterpart( cell, m1 ) ) {
                sb.append( "    " );
                cell.print( sb, rmap );
                sb.append( '\n' );
            }
        }
        o.print( sb );
    }

    public void printDiff( PrintStream o, MachineState state, RenameMap rmap ) {
        printDiff( o, origState, state, rmap );
    }

    public void printDiff( PrintStream o, RenameMap rmap ) {
        printDiff( o, origState, curState, rmap );
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append( "instructions processed: " ).append( ninsns ).append( '\n' );
        sb.append( "current state:\n" );
        curState.print( sb, null );
        return sb.toString();
    }

    /*************************************************************************
     * Value constructors
     *************************************************************************/

    public SymbolicValue true_() {
        return number( 1, 1 );
    }

    public SymbolicValue false_() {
        return number( 1, 0 );
    }

    public SymbolicValue undefined_() {
        return undefined( 1 );
    }

    public SymbolicValue undefined( int nbits ) {
        return SymbolicValue.fresh( names, nbits );
    }

    public SymbolicValue number( int nbits, long n ) {
        return SymbolicValue.number( nbits, n );
    }

    /*************************************************************************
     * Instruction specific hooks
     *************************************************************************/

    // Called only for CALL instructions before assigning the new IP.
    public SymbolicValue filterCallTarget( SymbolicValue a ) {
        return a;
    }

    // Called only for RET instructions before adjusting the IP.
    public SymbolicValue filterReturnTarget( SymbolicValue a ) {
        return a;
    }

    // Called only for indirect JMP instructions before adjusting the IP.
    public SymbolicValue filterIndirectJumpTarget( SymbolicValue a ) {
        return a;
    }

    public void hlt() {
        if( out != null ) {
            out.println( "hlt at " + curState.ip );
        }
    }

    public SymbolicValue rdtsc() {
        return number( 64, 0 );
    }

    // The interrupt may do anything, so the whole machine state is forgotten.
    public void interrupt( int num ) {
        if( out != null ) {
            out.println( "int 0x" + Integer.toHexString( num & 0xff ) + ": resetting machine state" );
        }
        curState = new MachineState( names );
    }

    /*************************************************************************
     * Data access
     *************************************************************************/

    public SymbolicValue readGPR( X86.Register r ) {
        return curState.readReg( r );
    }

    public void writeGPR( X86.Register r, SymbolicValue value ) {
        curState.writeReg( r, value );
    }

    public SymbolicValue readSegreg( X86.SegmentRegister sr ) {
        return curState.readSegreg( sr );
    }

    public void writeSegreg( X86.SegmentRegister sr, SymbolicValue value ) {
        curState.writeSegreg( sr, value );
    }

    // Points past the end of the current instruction while it executes.
    public SymbolicValue readIP() {
        return curState.ip;
    }

    public void writeIP( SymbolicValue value ) {
        curState.setIP( value );
    }

    public SymbolicValue readFlag( X86.Flag f ) {
        return curState.readFlag( f );
    }

    public void writeFlag( X86.Flag f, SymbolicValue value ) {
        curState.writeFlag( f, value );
    }

    // The segment register and condition are accepted for the dispatcher's sake and ignored.
    public SymbolicValue readMemory( X86.SegmentRegister segreg, SymbolicValue addr, SymbolicValue cond, int nbits ) {
        return memRead( curState, addr, nbits );
    }

    public void writeMemory( X86.SegmentRegister segreg, SymbolicValue addr, SymbolicValue data, SymbolicValue cond ) {
        memWrite( curState, addr, data );
    }

    /*************************************************************************
     * Arithmetic and logic
     *************************************************************************/

    public SymbolicValue add( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.add( a, b );
    }

    public ValueOps.AddResult addWithCarries( SymbolicValue a, SymbolicValue b, SymbolicValue c ) {
        return ValueOps.addWithCarries( a, b, c );
    }

    public SymbolicValue and_( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.and( a, b );
    }

    public SymbolicValue or_( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.or( a, b );
    }

    public SymbolicValue xor_( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.xor( a, b );
    }

    public SymbolicValue equalToZero( SymbolicValue a ) {
        return ValueOps.equalToZero( a );
    }

    public SymbolicValue invert( SymbolicValue a ) {
        return ValueOps.invert( a );
    }

    public SymbolicValue negate( SymbolicValue a ) {
        return ValueOps.negate( a );
    }

    public SymbolicValue concat( SymbolicValue lo, SymbolicValue hi ) {
        return ValueOps.concat( lo, hi );
    }

    public SymbolicValue ite( SymbolicValue sel, SymbolicValue ifTrue, SymbolicValue ifFalse ) {
        return ValueOps.ite( sel, ifTrue, ifFalse );
    }

    public SymbolicValue leastSignificantSetBit( SymbolicValue a ) {
        return ValueOps.leastSignificantSetBit( a );
    }

    public SymbolicValue mostSignificantSetBit( SymbolicValue a ) {
        return ValueOps.mostSignificantSetBit( a );
    }

    public SymbolicValue rotateLeft( SymbolicValue a, SymbolicValue sa ) {
        return ValueOps.rotateLeft( a, sa );
    }

    public SymbolicValue rotateRight( SymbolicValue a, SymbolicValue sa ) {
        return ValueOps.rotateRight( a, sa );
    }

    public SymbolicValue shiftLeft( SymbolicValue a, SymbolicValue sa ) {
        return ValueOps.shiftLeft( a, sa );
    }

    public SymbolicValue shiftRight( SymbolicValue a, SymbolicValue sa ) {
        return ValueOps.shiftRight( a, sa );
    }

    public SymbolicValue shiftRightArithmetic( SymbolicValue a, SymbolicValue sa ) {
        return ValueOps.shiftRightArithmetic( a, sa );
    }

    public SymbolicValue signExtend( SymbolicValue a, int to ) {
        return ValueOps.signedExtend( a, to );
    }

    public SymbolicValue unsignedExtend( SymbolicValue a, int to ) {
        return ValueOps.unsignedExtend( a, to );
    }

    public SymbolicValue extract( SymbolicValue a, int begin, int end ) {
        return ValueOps.extract( a, begin, end );
    }

    public SymbolicValue signedDivide( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.signedDivide( a, b );
    }

    public SymbolicValue signedModulo( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.signedModulo( a, b );
    }

    public SymbolicValue signedMultiply( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.signedMultiply( a, b );
    }

    public SymbolicValue unsignedDivide( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.unsignedDivide( a, b );
    }

    public SymbolicValue unsignedModulo( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.unsignedModulo( a, b );
    }

    public SymbolicValue unsignedMultiply( SymbolicValue a, SymbolicValue b ) {
        return ValueOps.unsignedMultiply( a, b );
    }

    // Setup writes describe memory as it was before the block ran.
    private static void settleMemory( MachineState state ) {
        Memory settled = new Memory();
        for( MemoryCell cell : state.mem ) {
            if( !cell.clobbered ) {
                cell.written = false;
                settled.add( cell );
            }
        }
        state.mem = settled;
    }

    private static int accessBytes( int nbits ) {
        if( nbits != 8 && nbits != 16 && nbits != 32 ) {
            throw new UnsupportedOperationException( "invalid memory access size " + nbits + " bits" );
        }
        return nbits / 8;
    }

    private static boolean coveredBy( Memory m1, Memory m2 ) {
        for( MemoryCell cell : m1 ) {
            if( !hasCounterpart( cell, m2 ) ) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasCounterpart( MemoryCell cell, Memory mem ) {
        for( MemoryCell other : mem ) {
            if( cell.mustAlias( other ) && cell.data.equalTo( other.data ) ) {
                return true;
            }
        }
        return false;
    }
}
