package com.galois.symbolicSemantics;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

// Partial knowledge of memory: the cells touched so far, scanned linearly.
// Order carries no meaning for lookups.
public class Memory implements Iterable<MemoryCell> {
    private final List<MemoryCell> cells;

    public Memory() {
        cells = new ArrayList<MemoryCell>();
    }

    // Deep copy; cells are mutable and belong to one state.
    public Memory( Memory other ) {
        cells = new ArrayList<MemoryCell>( other.cells.size() );
        for( MemoryCell c : other.cells ) {
            cells.add( new MemoryCell( c ) );
        }
    }

    public void add( MemoryCell cell ) {
        cells.add( cell );
    }

    public MemoryCell get( int i ) {
        return cells.get( i );
    }

    public void set( int i, MemoryCell cell ) {
        cells.set( i, cell );
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public Iterator<MemoryCell> iterator() {
        return cells.iterator();
    }

    /** The first cell that must-alias {@code cell}, or null. */
    public MemoryCell findMustAlias( MemoryCell cell ) {
        for( MemoryCell c : cells ) {
            if( cell.mustAlias( c ) ) {
                return c;
            }
        }
        return null;
    }

    public void print( StringBuilder sb, RenameMap rmap ) {
        for( MemoryCell c : cells ) {
            sb.append( "    " );
            c.print( sb, rmap );
            sb.append( '\n' );
        }
    }
}
