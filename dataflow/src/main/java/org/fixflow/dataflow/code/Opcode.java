package org.fixflow.dataflow.code;

import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The closed set of instruction kinds of the stack machine.
 *
 * <p>Each opcode knows its textual mnemonic, the shape of its operands, and how it affects
 * control flow. The semantics of an opcode on abstract values is defined by the transfer
 * functions of each analysis, never here.
 */
public enum Opcode {
    /** Pseudo-instruction marking a jump target. Labels are the merge points of the code. */
    LABEL("label", Operands.LABEL, Flow.LABEL),
    NOP("nop", Operands.NONE, Flow.PLAIN),
    /** Pushes an integer constant. */
    PUSH("push", Operands.INT, Flow.PLAIN),
    /** Pushes the value of a variable. */
    LDVAR("ldvar", Operands.NAME, Flow.PLAIN),
    /** Pops a value and binds a variable to it. */
    STVAR("stvar", Operands.NAME, Flow.PLAIN),
    POP("pop", Operands.NONE, Flow.PLAIN),
    DUP("dup", Operands.NONE, Flow.PLAIN),
    SWAP("swap", Operands.NONE, Flow.PLAIN),
    ADD("add", Operands.NONE, Flow.PLAIN),
    SUB("sub", Operands.NONE, Flow.PLAIN),
    MUL("mul", Operands.NONE, Flow.PLAIN),
    LT("lt", Operands.NONE, Flow.PLAIN),
    EQ("eq", Operands.NONE, Flow.PLAIN),
    NOT("not", Operands.NONE, Flow.PLAIN),
    /** Calls a named function with the given number of arguments taken from the stack. */
    CALL("call", Operands.NAME_INT, Flow.PLAIN),
    /** Unconditional jump. */
    BR("br", Operands.LABEL, Flow.UNCONDITIONAL_JUMP),
    /** Pops a value and jumps if it is non-zero. */
    BRTRUE("brtrue", Operands.LABEL, Flow.JUMP),
    /** Pops a value and jumps if it is zero. */
    BRFALSE("brfalse", Operands.LABEL, Flow.JUMP),
    /** Pops a value and jumps to the label at that index, falling through if there is none. */
    SWITCH("switch", Operands.LABELS, Flow.JUMP),
    /** Returns from the function, leaving the result on the stack. */
    RET("ret", Operands.NONE, Flow.EXIT);

    /** The shape of the operands of an opcode. */
    public enum Operands {
        /** No operands. */
        NONE,
        /** One integer. */
        INT,
        /** One name. */
        NAME,
        /** One name and one integer. */
        NAME_INT,
        /** One label name. */
        LABEL,
        /** One or more label names. */
        LABELS
    }

    /** The control-flow class of an opcode. */
    public enum Flow {
        /** Falls through to the next instruction. */
        PLAIN,
        /** A label, falls through to the next instruction. */
        LABEL,
        /** A jump that may also fall through to the next instruction. */
        JUMP,
        /** A jump that never falls through. */
        UNCONDITIONAL_JUMP,
        /** Leaves the code. */
        EXIT
    }

    private static final Map<String, Opcode> BY_MNEMONIC = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            BY_MNEMONIC.put(opcode.mnemonic, opcode);
        }
    }

    private final String mnemonic;
    private final Operands operands;
    private final Flow flow;

    Opcode(String mnemonic, Operands operands, Flow flow) {
        this.mnemonic = mnemonic;
        this.operands = operands;
        this.flow = flow;
    }

    /** @return the name of the opcode in listings */
    public String getMnemonic() {
        return mnemonic;
    }

    /** @return the shape of the operands */
    public Operands getOperands() {
        return operands;
    }

    /** @return the control-flow class */
    public Flow getFlow() {
        return flow;
    }

    /** @return true for jumps, conditional or not */
    public boolean isJump() {
        return flow == Flow.JUMP || flow == Flow.UNCONDITIONAL_JUMP;
    }

    /**
     * @param mnemonic a mnemonic as written in listings
     * @return the opcode with this mnemonic, or {@code null}
     */
    public static @Nullable Opcode fromMnemonic(String mnemonic) {
        return BY_MNEMONIC.get(mnemonic);
    }
}
