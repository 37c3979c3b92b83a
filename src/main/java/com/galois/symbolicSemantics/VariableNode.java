package com.galois.symbolicSemantics;

// A free variable.  It has no numeric value, only an identity handed out by
// a NameGenerator; two variables are equal only if their identities match.
public final class VariableNode extends TreeNode {
    private final long name;

    public VariableNode( int nbits, long name ) {
        super( nbits );
        this.name = name;
    }

    public long getName() {
        return name;
    }

    public <T> T accept( Visitor<T> v ) {
        return v.visitVariable( this );
    }

    public boolean isKnown() {
        return false;
    }

    public boolean equalTo( TreeNode other ) {
        if( other == this ) return true;
        return other != null && other.accept( new Matcher() {
                public Boolean visitVariable( VariableNode v ) {
                    return nbits == v.nbits && name == v.name;
                }
            });
    }

    public void print( StringBuilder sb, RenameMap rmap ) {
        long n = rmap == null ? name : rmap.rename( name );
        sb.append( 'v' ).append( n );
    }
}
