package org.fixflow.dataflow.analysis;

import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.code.CodeEditor;
import org.fixflow.dataflow.code.CodeSequence;
import org.fixflow.dataflow.state.State;
import org.fixflow.dataflow.util.BugInDataflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A backward analysis that, once the fixpoint is computed, answers the state right before any
 * instruction, i.e. the information flowing back from the exits to that point.
 *
 * <p>States are rebuilt by replaying the transfer functions backward from the nearest exit point
 * or jump after the requested position. Walking through the code from the end to the start is
 * cheap.
 *
 * @param <S> the state type used in the analysis
 */
public abstract class BackwardInstructionAnalysis<S extends State<S>>
        extends BackwardFinalAnalysis<S> {

    private static final Logger logger =
            LoggerFactory.getLogger(BackwardInstructionAnalysis.class);

    /** The position whose "before" state is {@link #currentState}, or -1 if there is none. */
    private int replayPosition = -1;

    protected BackwardInstructionAnalysis(Supplier<S> emptyState) {
        super(emptyState);
    }

    @Override
    public void invalidate() {
        super.invalidate();
        replayPosition = -1;
    }

    /**
     * Returns the state right before the instruction at {@code position}. The returned state
     * belongs to the analysis: it must not be modified, and it changes with the next lookup.
     *
     * @param position a position in the code
     * @return the state before {@code position}, or {@code null} if the fixpoint never reached it
     */
    public @Nullable S getStateBefore(int position) {
        checkPosition(position);
        if (!isReached(position)) {
            return null;
        }
        if (currentState == null || replayPosition != position) {
            seek(position);
        }
        return currentState;
    }

    /**
     * Returns the state right before the instruction under a cursor.
     *
     * @param cursor a cursor into the analyzed code
     * @return the state before the instruction, or {@code null} if the fixpoint never reached it
     * @see #getStateBefore(int)
     */
    public @Nullable S getStateBefore(CodeEditor.Cursor cursor) {
        if (cursor.editor() != code()) {
            throw new BugInDataflow(
                    "BackwardInstructionAnalysis::getStateBefore() cursor into other code");
        }
        return getStateBefore(cursor.position());
    }

    private void seek(int target) {
        int restart = restartPosition(target);
        if (currentState == null || replayPosition < target || replayPosition > restart) {
            logger.trace("replay restarts at {} for {}", restart, target);
            enter(restart);
        }
        while (replayPosition > target) {
            enter(replayPosition - 1);
        }
    }

    /** The nearest exit point or jump holding a fixpoint at or after {@code target}. */
    private int restartPosition(int target) {
        CodeSequence code = code();
        for (int position = target; position < code.end(); position++) {
            if (code.isExitPoint(position)
                    || (code.isJump(position) && mergePoints.containsKey(position))) {
                return position;
            }
        }
        throw new BugInDataflow(
                "BackwardInstructionAnalysis::seek() no exit point or jump after %d", target);
    }

    /** Moves the replay to {@code position} and applies its instruction. */
    private void enter(int position) {
        CodeSequence code = code();
        if (code.isExitPoint(position)) {
            S initial = initialState;
            if (initial == null) {
                throw new BugInDataflow("BackwardInstructionAnalysis::enter() no initial state");
            }
            currentState = initial.copy();
        } else if (code.isJump(position)) {
            S stored = mergePoints.get(position);
            if (stored != null) {
                currentState = stored.copy();
            }
        }
        replayPosition = position;
        if (isReached(position)) {
            dispatch(position);
        }
    }
}
