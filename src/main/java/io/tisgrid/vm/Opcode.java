package io.tisgrid.vm;

import java.util.Locale;

public enum Opcode {
    MOV, NOP, SWP, SWT, SAV, ADD, SUB, NEG, JMP, JEZ, JNZ, JGZ, JLZ, JRO, HCF;

    /** Lowercase source spelling, as written in programs. */
    public String mnemonic() {
        return name().toLowerCase(Locale.ROOT);
    }
}
