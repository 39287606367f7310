package org.fixflow.dataflow.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.fixflow.dataflow.code.CodeSequence;
import org.fixflow.dataflow.state.State;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * An implementation of a backward analysis to solve a dataflow problem over a piece of code, given
 * the dispatcher of its transfer functions.
 *
 * <p>Jumps are the merge points: the state after a conditional jump combines what flows back from
 * the next instruction and from its targets. Every exit point starts a walk with a copy of the
 * initial state. A walk steps back through the code until it reaches the entry, a jump where
 * merging brings no new information, or a position that nothing falls through to. Crossing a
 * label schedules a walk from every jump to it whose stored state changed. The states at the
 * entry are merged into the final state.
 *
 * @param <S> the state type used in the analysis
 */
public abstract class BackwardAnalysisImpl<S extends State<S>> extends AbstractAnalysis<S> {

    /** For every label position, the positions of the jumps to it. */
    protected final Map<Integer, List<Integer>> jumpOrigins;

    /**
     * Construct an object that can perform a backward analysis over a piece of code.
     *
     * @param emptyState creates the default initial state
     */
    protected BackwardAnalysisImpl(Supplier<S> emptyState) {
        super(Direction.BACKWARD, emptyState);
        this.jumpOrigins = new HashMap<>();
    }

    @Override
    public void invalidate() {
        super.invalidate();
        jumpOrigins.clear();
    }

    @Override
    protected void doAnalyze() {
        CodeSequence code = code();
        initialState = initialState();
        for (int position = code.begin(); position < code.end(); position++) {
            if (code.isJump(position)) {
                for (int target : code.targets(position)) {
                    List<Integer> origins =
                            jumpOrigins.computeIfAbsent(target, t -> new ArrayList<>());
                    if (!origins.contains(position)) {
                        origins.add(position);
                    }
                }
            }
            if (code.isExitPoint(position)) {
                worklist.add(position);
            }
        }

        while (!worklist.isEmpty()) {
            walk(nextWalk());
        }
    }

    /**
     * Walks backward from {@code start} until the branch ends.
     *
     * @param start an exit point, or a jump taken from the worklist
     */
    private void walk(int start) {
        CodeSequence code = code();
        int position = start;
        while (true) {
            if (code.isExitPoint(position)) {
                if (currentState != null) {
                    throw new BugInDataflow(
                            "BackwardAnalysisImpl::walk() exit point %d reached with a state",
                            position);
                }
                S initial = initialState;
                if (initial == null) {
                    throw new BugInDataflow("BackwardAnalysisImpl::walk() no initial state");
                }
                currentState = initial.copy();
            } else if (code.isJump(position) && !mergeAt(position)) {
                return;
            }

            dispatch(position);
            reached.set(position);

            if (code.isLabel(position)) {
                for (int origin : origins(position)) {
                    if (shouldFollow(origin)) {
                        worklist.add(origin);
                    }
                }
            }

            if (code.isEntryPoint(position)) {
                mergeIntoFinal();
                return;
            }

            int previous = position - 1;
            if (code.isExitPoint(previous) || !code.successors(previous).contains(position)) {
                abandon("no fall-through predecessor");
                return;
            }
            position = previous;
        }
    }

    private List<Integer> origins(int label) {
        List<Integer> origins = jumpOrigins.get(label);
        return origins == null ? Collections.emptyList() : origins;
    }
}
