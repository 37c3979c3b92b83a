package com.galois.symbolicSemantics;

// Hands out identities for fresh variables.  Each analysis run owns one, so
// runs do not share names and the numbering is reproducible.
public final class NameGenerator {
    private long next;

    public NameGenerator() {
        this( 1 );
    }

    public NameGenerator( long first ) {
        this.next = first;
    }

    public long next() {
        return next++;
    }
}
