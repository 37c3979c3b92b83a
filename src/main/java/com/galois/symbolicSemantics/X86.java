package com.galois.symbolicSemantics;

// === Definitions for the 32-bit x86 register file ===
// Enum order is the hardware encoding order, so ordinal() indexes the
// machine state's register arrays.
public final class X86 {

    private X86() {}

    public static final int GPR_BITS = 32;
    public static final int SEGREG_BITS = 16;
    public static final int FLAG_BITS = 1;

    public enum Register {
        EAX, ECX, EDX, EBX, ESP, EBP, ESI, EDI
    }

    public enum SegmentRegister {
        ES, CS, SS, DS, FS, GS
    }

    // One entry per bit of the low 16 bits of EFLAGS.  The reserved
    // positions still get a slot so ordinal() equals the bit number.
    public enum Flag {
        CF,     // carry
        F1,     // reserved, reads as one
        PF,     // parity
        F3,     // reserved
        AF,     // adjust
        F5,     // reserved
        ZF,     // zero
        SF,     // sign
        TF,     // trap
        IF,     // interrupt enable
        DF,     // direction
        OF,     // overflow
        IOPL0,  // I/O privilege level, low bit
        IOPL1,  // I/O privilege level, high bit
        NT,     // nested task
        F15     // reserved
    }

    public static final int N_GPRS = Register.values().length;
    public static final int N_SEGREGS = SegmentRegister.values().length;
    public static final int N_FLAGS = Flag.values().length;
}
