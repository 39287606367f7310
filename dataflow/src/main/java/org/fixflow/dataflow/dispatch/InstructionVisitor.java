package org.fixflow.dataflow.dispatch;

import org.fixflow.dataflow.code.Instruction;

/**
 * A visitor with one method per {@link org.fixflow.dataflow.code.Opcode}, used as the receiver of
 * an {@link InstructionDispatcher}.
 *
 * <p>Every method returns true if it handled the instruction and false to decline it, which makes
 * the dispatch fail. {@link AbstractInstructionVisitor} routes every method to a single default.
 */
public interface InstructionVisitor {

    boolean visitLabel(Instruction insn, int position);

    boolean visitNop(Instruction insn, int position);

    boolean visitPush(Instruction insn, int position);

    boolean visitLdvar(Instruction insn, int position);

    boolean visitStvar(Instruction insn, int position);

    boolean visitPop(Instruction insn, int position);

    boolean visitDup(Instruction insn, int position);

    boolean visitSwap(Instruction insn, int position);

    boolean visitAdd(Instruction insn, int position);

    boolean visitSub(Instruction insn, int position);

    boolean visitMul(Instruction insn, int position);

    boolean visitLt(Instruction insn, int position);

    boolean visitEq(Instruction insn, int position);

    boolean visitNot(Instruction insn, int position);

    boolean visitCall(Instruction insn, int position);

    boolean visitBr(Instruction insn, int position);

    boolean visitBrtrue(Instruction insn, int position);

    boolean visitBrfalse(Instruction insn, int position);

    boolean visitSwitch(Instruction insn, int position);

    boolean visitRet(Instruction insn, int position);
}
