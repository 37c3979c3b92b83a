package com.galois.symbolicSemantics;

import java.util.HashMap;
import java.util.Map;

/** Renames variable identities to short sequential numbers for printing.
 *  The first variable printed through the map becomes v1, the next v2, and
 *  so on.  Sharing one map across several prints keeps the names consistent.
 */
public class RenameMap {
    private final Map<Long, Long> names = new HashMap<Long, Long>();

    public long rename( long name ) {
        Long n = names.get( name );
        if( n == null ) {
            n = Long.valueOf( names.size() + 1 );
            names.put( name, n );
        }
        return n.longValue();
    }

    public int size() {
        return names.size();
    }
}
