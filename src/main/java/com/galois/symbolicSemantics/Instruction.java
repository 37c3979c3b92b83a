package com.galois.symbolicSemantics;

// The decoded instruction a dispatcher hands to the policy.  The policy only
// needs its address; toString() is used for tracing.
public interface Instruction {
    long getAddress();
}
