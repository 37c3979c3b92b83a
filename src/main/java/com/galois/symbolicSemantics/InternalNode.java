package com.galois.symbolicSemantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** An operator applied to one to three child expressions.  Child widths are
 *  operator specific and need not equal the width of this node.
 *
 *  Internal nodes are never "known": anything computable from constants is
 *  folded into a leaf when the value is built, not here.
 */
public final class InternalNode extends TreeNode {
    private final Operator op;
    private final List<TreeNode> children;

    public InternalNode( int nbits, Operator op, TreeNode... children ) {
        super( nbits );
        if( op == null ) throw new NullPointerException( "op" );
        if( !op.acceptsArity( children.length ) ) {
            throw new IllegalArgumentException( "operator " + op + " does not take " + children.length + " operands" );
        }
        List<TreeNode> kids = new ArrayList<TreeNode>( children.length );
        for( TreeNode child : children ) {
            if( child == null ) {
                throw new IllegalArgumentException( "null operand to " + op );
            }
            kids.add( child );
        }
        this.op = op;
        this.children = Collections.unmodifiableList( kids );
    }

    public Operator getOperator() {
        return op;
    }

    public int size() {
        return children.size();
    }

    public TreeNode child( int idx ) {
        return children.get( idx );
    }

    public List<TreeNode> getChildren() {
        return children;
    }

    public <T> T accept( Visitor<T> v ) {
        return v.visitInternal( this );
    }

    public boolean isKnown() {
        return false;
    }

    public boolean equalTo( TreeNode other ) {
        if( other == this ) return true;
        return other != null && other.accept( new Matcher() {
                public Boolean visitInternal( InternalNode n ) {
                    return sameNode( n );
                }
            });
    }

    private boolean sameNode( InternalNode n ) {
        if( nbits != n.nbits || op != n.op || children.size() != n.children.size() ) {
            return false;
        }
        for( int i = 0; i < children.size(); i++ ) {
            if( !children.get( i ).equalTo( n.children.get( i ) ) ) {
                return false;
            }
        }
        return true;
    }

    public void print( StringBuilder sb, RenameMap rmap ) {
        sb.append( '(' ).append( op ).append( '[' ).append( nbits ).append( ']' );
        for( TreeNode child : children ) {
            sb.append( ' ' );
            child.print( sb, rmap );
        }
        sb.append( ')' );
    }
}
