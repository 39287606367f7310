package org.fixflow.dataflow.livevariable;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.analysis.BackwardInstructionAnalysis;
import org.fixflow.dataflow.code.Instruction;
import org.fixflow.dataflow.dispatch.AbstractInstructionVisitor;
import org.fixflow.dataflow.dispatch.Dispatcher;
import org.fixflow.dataflow.dispatch.InstructionDispatcher;
import org.fixflow.dataflow.state.AbstractState;
import org.fixflow.dataflow.state.NoGlobal;

/**
 * Live variable analysis: a variable is live before an instruction if some path from there reads
 * it before writing it. Only the environment is used; the stack stays empty.
 */
public class LiveVariableAnalysis
        extends BackwardInstructionAnalysis<AbstractState<String, Liveness, NoGlobal>> {

    public LiveVariableAnalysis() {
        super(() -> AbstractState.<String, Liveness>create(Liveness.DOMAIN));
    }

    @Override
    protected Dispatcher createDispatcher() {
        return new InstructionDispatcher(new LivenessTransfer());
    }

    /**
     * Returns the variables live right before an instruction.
     *
     * @param position a position in the code
     * @return the live variables in name order, or {@code null} if the position is unreachable
     *     backward from an exit
     */
    public @Nullable Set<String> liveVariablesBefore(int position) {
        AbstractState<String, Liveness, NoGlobal> state = getStateBefore(position);
        return state == null ? null : liveVariables(state);
    }

    /**
     * Returns the variables live at the entry of the code.
     *
     * @return the live variables in name order, or {@code null} if no exit reaches the entry
     */
    public @Nullable Set<String> liveVariablesAtEntry() {
        AbstractState<String, Liveness, NoGlobal> state = getFinalState();
        return state == null ? null : liveVariables(state);
    }

    private static Set<String> liveVariables(AbstractState<String, Liveness, NoGlobal> state) {
        Set<String> result = new TreeSet<>();
        for (Map.Entry<String, Liveness> entry : state.env().entrySet()) {
            if (entry.getValue() == Liveness.LIVE) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    /** The backward transfer functions: a read makes a variable live, a write kills it. */
    private class LivenessTransfer extends AbstractInstructionVisitor {

        @Override
        public boolean visitLdvar(Instruction insn, int position) {
            current().put(insn.getName(), Liveness.LIVE);
            return true;
        }

        @Override
        public boolean visitStvar(Instruction insn, int position) {
            current().put(insn.getName(), Liveness.DEAD);
            return true;
        }
    }
}
