package org.fixflow.dataflow.dispatch;

import org.fixflow.dataflow.code.Instruction;

/**
 * An instruction visitor where every method defaults to {@link #visitInstruction}, which
 * accepts the instruction and does nothing. {@link #visitLabel} defaults to it as well.
 * Subclasses override the instructions they care about.
 */
public abstract class AbstractInstructionVisitor implements InstructionVisitor {

    /**
     * The catch-all for every instruction whose method is not overridden.
     *
     * @param insn the instruction
     * @param position its position
     * @return true if the instruction was handled
     */
    public boolean visitInstruction(Instruction insn, int position) {
        return true;
    }

    @Override
    public boolean visitLabel(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitNop(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitPush(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitLdvar(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitStvar(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitPop(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitDup(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitSwap(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitAdd(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitSub(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitMul(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitLt(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitEq(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitNot(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitCall(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitBr(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitBrtrue(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitBrfalse(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitSwitch(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }

    @Override
    public boolean visitRet(Instruction insn, int position) {
        return visitInstruction(insn, position);
    }
}
