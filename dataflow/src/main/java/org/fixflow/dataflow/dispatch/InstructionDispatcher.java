package org.fixflow.dataflow.dispatch;

import org.fixflow.dataflow.code.CodeSequence;
import org.fixflow.dataflow.code.Instruction;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * A dispatcher that decodes the opcode of the instruction and calls the matching method of an
 * {@link InstructionVisitor}.
 *
 * <p>The visitor must understand every opcode, so an opcode without a case here is a {@link
 * BugInDataflow}. The dispatch fails only when the visitor method declines the instruction.
 */
public class InstructionDispatcher extends Dispatcher {

    /** The visitor receiving the instructions. */
    private final InstructionVisitor receiver;

    /**
     * Creates a dispatcher sending instructions to {@code receiver}.
     *
     * @param receiver the visitor
     */
    public InstructionDispatcher(InstructionVisitor receiver) {
        this.receiver = receiver;
    }

    /** @return the visitor receiving the instructions */
    public InstructionVisitor getReceiver() {
        return receiver;
    }

    @Override
    protected void doDispatch(CodeSequence code, int position) {
        Instruction insn = code.get(position);
        boolean handled;
        switch (insn.getOpcode()) {
            case LABEL:
                handled = receiver.visitLabel(insn, position);
                break;
            case NOP:
                handled = receiver.visitNop(insn, position);
                break;
            case PUSH:
                handled = receiver.visitPush(insn, position);
                break;
            case LDVAR:
                handled = receiver.visitLdvar(insn, position);
                break;
            case STVAR:
                handled = receiver.visitStvar(insn, position);
                break;
            case POP:
                handled = receiver.visitPop(insn, position);
                break;
            case DUP:
                handled = receiver.visitDup(insn, position);
                break;
            case SWAP:
                handled = receiver.visitSwap(insn, position);
                break;
            case ADD:
                handled = receiver.visitAdd(insn, position);
                break;
            case SUB:
                handled = receiver.visitSub(insn, position);
                break;
            case MUL:
                handled = receiver.visitMul(insn, position);
                break;
            case LT:
                handled = receiver.visitLt(insn, position);
                break;
            case EQ:
                handled = receiver.visitEq(insn, position);
                break;
            case NOT:
                handled = receiver.visitNot(insn, position);
                break;
            case CALL:
                handled = receiver.visitCall(insn, position);
                break;
            case BR:
                handled = receiver.visitBr(insn, position);
                break;
            case BRTRUE:
                handled = receiver.visitBrtrue(insn, position);
                break;
            case BRFALSE:
                handled = receiver.visitBrfalse(insn, position);
                break;
            case SWITCH:
                handled = receiver.visitSwitch(insn, position);
                break;
            case RET:
                handled = receiver.visitRet(insn, position);
                break;
            default:
                throw new BugInDataflow(
                        "InstructionDispatcher::doDispatch() unexpected opcode: "
                                + insn.getOpcode());
        }
        if (!handled) {
            fail();
        }
    }
}
