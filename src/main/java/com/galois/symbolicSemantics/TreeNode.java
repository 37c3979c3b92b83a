package com.galois.symbolicSemantics;

import java.math.BigInteger;

/** A node of a symbolic expression tree.  Nodes are immutable once built
 *  and may be shared freely between values, memory cells and states.
 *
 *  There are exactly three kinds of node: constant leaves, variable leaves
 *  and operator-tagged internal nodes.  Callers that need to take a node
 *  apart do so through a {@link Visitor} rather than by downcasting.
 */
public abstract class TreeNode {
    protected final int nbits;

    public interface Visitor<T> {
        T visitConstant( ConstantNode node );
        T visitVariable( VariableNode node );
        T visitInternal( InternalNode node );
    }

    protected TreeNode( int nbits ) {
        if( nbits <= 0 ) {
            throw new IllegalArgumentException( "expression width must be positive: " + nbits );
        }
        this.nbits = nbits;
    }

    public int getNbits() {
        return nbits;
    }

    // A visitor answering false for every kind of node; equalTo() overrides
    // the one case that can match.
    static class Matcher implements Visitor<Boolean> {
        public Boolean visitConstant( ConstantNode node ) { return false; }
        public Boolean visitVariable( VariableNode node ) { return false; }
        public Boolean visitInternal( InternalNode node ) { return false; }
    }

    public abstract <T> T accept( Visitor<T> v );

    /** True if this node is provably equal to the other.  A false answer
     *  proves nothing; two terms equal after simplification may compare unequal. */
    public abstract boolean equalTo( TreeNode other );

    public abstract boolean isKnown();

    /** Returns the value of a constant leaf. */
    public BigInteger getValue() {
        throw new IllegalStateException( "not a constant value: " + this );
    }

    public abstract void print( StringBuilder sb, RenameMap rmap );

    public String toString() {
        StringBuilder sb = new StringBuilder();
        print( sb, null );
        return sb.toString();
    }
}
