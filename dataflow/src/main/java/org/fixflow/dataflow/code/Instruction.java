package org.fixflow.dataflow.code;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * A single, immutable instruction: an {@link Opcode} and its operands. Jumps refer to their
 * targets by label name; a {@link CodeSequence} resolves the names to positions.
 */
public final class Instruction {

    private final Opcode opcode;

    /** The integer operand of {@code push} and the argument count of {@code call}, else 0. */
    private final int intOperand;

    /** The label, variable or callee name, or {@code null} if the opcode takes none. */
    private final @Nullable String name;

    /** The target labels of a jump, empty otherwise. */
    private final List<String> targets;

    private Instruction(
            Opcode opcode, int intOperand, @Nullable String name, List<String> targets) {
        this.opcode = opcode;
        this.intOperand = intOperand;
        this.name = name;
        this.targets = targets;
    }

    /**
     * Creates an instruction that takes no operands.
     *
     * @param opcode an opcode with {@link Opcode.Operands#NONE}
     * @return the instruction
     */
    public static Instruction of(Opcode opcode) {
        checkOperands(opcode, Opcode.Operands.NONE);
        return new Instruction(opcode, 0, null, Collections.emptyList());
    }

    public static Instruction label(String name) {
        return new Instruction(Opcode.LABEL, 0, name, Collections.emptyList());
    }

    public static Instruction push(int constant) {
        return new Instruction(Opcode.PUSH, constant, null, Collections.emptyList());
    }

    public static Instruction ldvar(String variable) {
        return new Instruction(Opcode.LDVAR, 0, variable, Collections.emptyList());
    }

    public static Instruction stvar(String variable) {
        return new Instruction(Opcode.STVAR, 0, variable, Collections.emptyList());
    }

    public static Instruction call(String callee, int argumentCount) {
        if (argumentCount < 0) {
            throw new BugInDataflow("negative argument count for call %s", callee);
        }
        return new Instruction(Opcode.CALL, argumentCount, callee, Collections.emptyList());
    }

    /**
     * Creates a jump.
     *
     * @param opcode one of the jump opcodes
     * @param targets the target label names, exactly one unless {@code opcode} is {@link
     *     Opcode#SWITCH}
     * @return the instruction
     */
    public static Instruction jump(Opcode opcode, String... targets) {
        if (!opcode.isJump()) {
            throw new BugInDataflow("Instruction::jump() %s is not a jump", opcode);
        }
        if (targets.length == 0
                || (opcode.getOperands() == Opcode.Operands.LABEL && targets.length != 1)) {
            throw new BugInDataflow(
                    "Instruction::jump() wrong number of targets for %s: %d",
                    opcode, targets.length);
        }
        List<String> labels = Collections.unmodifiableList(Arrays.asList(targets.clone()));
        return new Instruction(opcode, 0, null, labels);
    }

    public static Instruction br(String target) {
        return jump(Opcode.BR, target);
    }

    public static Instruction brtrue(String target) {
        return jump(Opcode.BRTRUE, target);
    }

    public static Instruction brfalse(String target) {
        return jump(Opcode.BRFALSE, target);
    }

    public static Instruction ret() {
        return of(Opcode.RET);
    }

    private static void checkOperands(Opcode opcode, Opcode.Operands expected) {
        if (opcode.getOperands() != expected) {
            throw new BugInDataflow(
                    "Instruction: %s takes %s operands, not %s",
                    opcode, opcode.getOperands(), expected);
        }
    }

    public Opcode getOpcode() {
        return opcode;
    }

    /** @return the constant of a {@code push} */
    public int getConstant() {
        checkOperands(opcode, Opcode.Operands.INT);
        return intOperand;
    }

    /** @return the number of arguments of a {@code call} */
    public int getArgumentCount() {
        checkOperands(opcode, Opcode.Operands.NAME_INT);
        return intOperand;
    }

    /**
     * Returns the name operand: the label name of a label, the variable of {@code ldvar} and
     * {@code stvar}, or the callee of {@code call}.
     *
     * @return the name operand
     */
    public String getName() {
        if (name == null) {
            throw new BugInDataflow("Instruction::getName() %s has no name operand", opcode);
        }
        return name;
    }

    /** @return the target label names of a jump, empty for other instructions */
    public List<String> getTargets() {
        return targets;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Instruction)) {
            return false;
        }
        Instruction other = (Instruction) obj;
        return opcode == other.opcode
                && intOperand == other.intOperand
                && Objects.equals(name, other.name)
                && targets.equals(other.targets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, intOperand, name, targets);
    }

    /** Prints the instruction in the syntax read by {@link InstructionParser}. */
    @Override
    public String toString() {
        switch (opcode.getOperands()) {
            case NONE:
                return opcode.getMnemonic();
            case INT:
                return opcode.getMnemonic() + " " + intOperand;
            case NAME:
                return opcode.getMnemonic() + " " + name;
            case NAME_INT:
                return opcode.getMnemonic() + " " + name + " " + intOperand;
            case LABEL:
                if (opcode == Opcode.LABEL) {
                    return name + ":";
                }
                return opcode.getMnemonic() + " " + targets.get(0);
            case LABELS:
                return opcode.getMnemonic() + " " + String.join(" ", targets);
            default:
                throw new BugInDataflow(
                        "Instruction::toString() unexpected operands: " + opcode.getOperands());
        }
    }
}
