package org.fixflow.dataflow.constantpropagation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntBinaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.analysis.ForwardInstructionAnalysis;
import org.fixflow.dataflow.code.Instruction;
import org.fixflow.dataflow.dispatch.AbstractInstructionVisitor;
import org.fixflow.dataflow.dispatch.Dispatcher;
import org.fixflow.dataflow.dispatch.InstructionDispatcher;
import org.fixflow.dataflow.state.AbstractState;
import org.fixflow.dataflow.state.NoGlobal;

/**
 * Constant propagation over the operand stack and the variables. Arithmetic and comparisons on
 * constants are folded; everything else produces {@link ConstantValue#TOP}.
 *
 * <p>A {@code call} consumes its arguments, pushes an unknown result, and is assumed to possibly
 * write every variable.
 */
public class ConstantPropagation
        extends ForwardInstructionAnalysis<AbstractState<String, ConstantValue, NoGlobal>> {

    /** The constants bound to variables at the entry. */
    private final Map<String, Integer> arguments;

    /** Creates a constant propagation that knows nothing at the entry. */
    public ConstantPropagation() {
        this(Collections.emptyMap());
    }

    /**
     * Creates a constant propagation where some variables hold known constants at the entry.
     *
     * @param arguments variable names and their values at the entry
     */
    public ConstantPropagation(Map<String, Integer> arguments) {
        super(() -> AbstractState.<String, ConstantValue>create(ConstantValue.DOMAIN));
        this.arguments = new LinkedHashMap<>(arguments);
    }

    @Override
    protected AbstractState<String, ConstantValue, NoGlobal> initialState() {
        AbstractState<String, ConstantValue, NoGlobal> state = super.initialState();
        for (Map.Entry<String, Integer> argument : arguments.entrySet()) {
            state.put(argument.getKey(), ConstantValue.of(argument.getValue()));
        }
        return state;
    }

    @Override
    protected Dispatcher createDispatcher() {
        return new InstructionDispatcher(new ConstantTransfer());
    }

    /**
     * Returns the value of a variable right after an instruction.
     *
     * @param position a position in the code
     * @param variable a variable name
     * @return the value, or {@code null} if the position is unreachable
     */
    public @Nullable ConstantValue valueAfter(int position, String variable) {
        AbstractState<String, ConstantValue, NoGlobal> state = getStateAfter(position);
        return state == null ? null : state.find(variable);
    }

    /** The transfer functions. */
    private class ConstantTransfer extends AbstractInstructionVisitor {

        @Override
        public boolean visitPush(Instruction insn, int position) {
            current().push(ConstantValue.of(insn.getConstant()));
            return true;
        }

        @Override
        public boolean visitLdvar(Instruction insn, int position) {
            ConstantValue value = current().find(insn.getName());
            // unassigned on some path
            if (value.getKind() == ConstantValue.Kind.ABSENT) {
                value = ConstantValue.TOP;
            }
            current().push(value);
            return true;
        }

        @Override
        public boolean visitStvar(Instruction insn, int position) {
            ConstantValue value = current().pop();
            current().put(insn.getName(), value);
            return true;
        }

        @Override
        public boolean visitPop(Instruction insn, int position) {
            current().pop();
            return true;
        }

        @Override
        public boolean visitDup(Instruction insn, int position) {
            current().push(current().top());
            return true;
        }

        @Override
        public boolean visitSwap(Instruction insn, int position) {
            ConstantValue first = current().pop();
            ConstantValue second = current().pop();
            current().push(first);
            current().push(second);
            return true;
        }

        @Override
        public boolean visitAdd(Instruction insn, int position) {
            return fold((a, b) -> a + b);
        }

        @Override
        public boolean visitSub(Instruction insn, int position) {
            return fold((a, b) -> a - b);
        }

        @Override
        public boolean visitMul(Instruction insn, int position) {
            return fold((a, b) -> a * b);
        }

        @Override
        public boolean visitLt(Instruction insn, int position) {
            return fold((a, b) -> a < b ? 1 : 0);
        }

        @Override
        public boolean visitEq(Instruction insn, int position) {
            return fold((a, b) -> a == b ? 1 : 0);
        }

        @Override
        public boolean visitNot(Instruction insn, int position) {
            ConstantValue operand = current().pop();
            current().push(
                    operand.isConstant()
                            ? ConstantValue.of(operand.getValue() == 0)
                            : ConstantValue.TOP);
            return true;
        }

        @Override
        public boolean visitCall(Instruction insn, int position) {
            current().pop(insn.getArgumentCount());
            current().mergeAllEnv(ConstantValue.TOP);
            current().push(ConstantValue.TOP);
            return true;
        }

        @Override
        public boolean visitBrtrue(Instruction insn, int position) {
            current().pop();
            return true;
        }

        @Override
        public boolean visitBrfalse(Instruction insn, int position) {
            current().pop();
            return true;
        }

        @Override
        public boolean visitSwitch(Instruction insn, int position) {
            current().pop();
            return true;
        }

        /** Pops two operands, the right one on top, and pushes the folded result. */
        private boolean fold(IntBinaryOperator op) {
            ConstantValue right = current().pop();
            ConstantValue left = current().pop();
            if (left.isConstant() && right.isConstant()) {
                current().push(
                        ConstantValue.of(op.applyAsInt(left.getValue(), right.getValue())));
            } else {
                current().push(ConstantValue.TOP);
            }
            return true;
        }
    }
}
