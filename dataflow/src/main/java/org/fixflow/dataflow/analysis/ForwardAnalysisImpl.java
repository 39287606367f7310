package org.fixflow.dataflow.analysis;

import java.util.function.Supplier;
import org.fixflow.dataflow.code.CodeSequence;
import org.fixflow.dataflow.state.State;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * An implementation of a forward analysis to solve a dataflow problem over a piece of code, given
 * the dispatcher of its transfer functions.
 *
 * <p>Labels are the merge points. The walk starts at the entry of the code with a copy of the
 * initial state and follows the code until it reaches an exit point, an unconditional jump, or a
 * label where merging brings no new information. Every jump schedules a walk from each target
 * whose stored state changed. The states at exit points are merged into the final state.
 *
 * @param <S> the state type used in the analysis
 */
public abstract class ForwardAnalysisImpl<S extends State<S>> extends AbstractAnalysis<S> {

    /**
     * Construct an object that can perform a forward analysis over a piece of code.
     *
     * @param emptyState creates the default initial state
     */
    protected ForwardAnalysisImpl(Supplier<S> emptyState) {
        super(Direction.FORWARD, emptyState);
    }

    @Override
    protected void doAnalyze() {
        CodeSequence code = code();
        S initial = initialState();
        initialState = initial;
        if (code.size() == 0) {
            return;
        }
        currentState = initial.copy();
        worklist.add(code.begin());
        while (!worklist.isEmpty()) {
            walk(nextWalk());
        }
    }

    /**
     * Walks forward from {@code start} until the branch ends.
     *
     * @param start the position to start from: the entry, or a label taken from the worklist
     */
    private void walk(int start) {
        CodeSequence code = code();
        int position = start;
        while (true) {
            if (code.isLabel(position) && !mergeAt(position)) {
                return;
            }

            dispatch(position);
            reached.set(position);

            if (code.isJump(position)) {
                for (int target : code.targets(position)) {
                    if (shouldFollow(target)) {
                        worklist.add(target);
                    }
                }
                if (code.isUnconditionalJump(position)) {
                    abandon("unconditional jump");
                    return;
                }
            }

            if (code.isExitPoint(position)) {
                mergeIntoFinal();
                return;
            }

            if (position + 1 == code.end()) {
                throw new BugInDataflow(
                        "ForwardAnalysisImpl::walk() control falls off the end of the code after"
                                + " %s at %d",
                        code.get(position),
                        position);
            }
            position++;
        }
    }
}
