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
 * A forward analysis that, once the fixpoint is computed, answers the state right after any
 * instruction.
 *
 * <p>Only the states at labels are kept by the fixpoint. Other states are rebuilt by replaying
 * the transfer functions from the nearest label before the requested position. The analysis keeps
 * the last replayed state, so asking for the same position again, or walking through the code in
 * order, is cheap. Random access costs at most one replay through the code.
 *
 * @param <S> the state type used in the analysis
 */
public abstract class ForwardInstructionAnalysis<S extends State<S>>
        extends ForwardFinalAnalysis<S> {

    private static final Logger logger = LoggerFactory.getLogger(ForwardInstructionAnalysis.class);

    /** The position whose "after" state is {@link #currentState}, or -1 if there is none. */
    private int replayPosition = -1;

    protected ForwardInstructionAnalysis(Supplier<S> emptyState) {
        super(emptyState);
    }

    @Override
    public void invalidate() {
        super.invalidate();
        replayPosition = -1;
    }

    /**
     * Returns the state right after the instruction at {@code position}. The returned state
     * belongs to the analysis: it must not be modified, and it changes with the next lookup.
     *
     * @param position a position in the code
     * @return the state after {@code position}, or {@code null} if the fixpoint never reached it
     */
    public @Nullable S getStateAfter(int position) {
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
     * Returns the state right after the instruction under a cursor.
     *
     * @param cursor a cursor into the analyzed code
     * @return the state after the instruction, or {@code null} if the fixpoint never reached it
     * @see #getStateAfter(int)
     */
    public @Nullable S getStateAfter(CodeEditor.Cursor cursor) {
        if (cursor.editor() != code()) {
            throw new BugInDataflow(
                    "ForwardInstructionAnalysis::getStateAfter() cursor into other code");
        }
        return getStateAfter(cursor.position());
    }

    private void seek(int target) {
        int restart = restartPosition(target);
        if (currentState == null || replayPosition > target || replayPosition < restart) {
            logger.trace("replay restarts at {} for {}", restart, target);
            S initial = initialState;
            if (initial == null) {
                throw new BugInDataflow("ForwardInstructionAnalysis::seek() no initial state");
            }
            currentState = initial.copy();
            enter(restart);
        }
        while (replayPosition < target) {
            enter(replayPosition + 1);
        }
    }

    /** The nearest label at or before {@code target} holding a fixpoint, else the entry. */
    private int restartPosition(int target) {
        CodeSequence code = code();
        for (int position = target; position > code.begin(); position--) {
            if (code.isLabel(position) && mergePoints.containsKey(position)) {
                return position;
            }
        }
        return code.begin();
    }

    /** Moves the replay to {@code position} and applies its instruction. */
    private void enter(int position) {
        if (code().isLabel(position)) {
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
