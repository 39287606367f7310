package org.fixflow.dataflow.analysis;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.code.CodeSequence;
import org.fixflow.dataflow.dispatch.Dispatcher;
import org.fixflow.dataflow.state.State;
import org.fixflow.dataflow.util.BugInDataflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of common features for {@link ForwardAnalysisImpl} and {@link
 * BackwardAnalysisImpl}: the states owned by the driver, the merge-point table, the worklist and
 * the two hooks an analysis provides, its initial state and its dispatcher.
 *
 * <p>The driver owns every state it holds: the initial state, the current state, the final state
 * and the state at every merge point. States handed to it are copied, and states it hands out
 * must not be modified.
 *
 * <p>While walking, the current state is {@code null} when the walk has been abandoned because
 * merging brought no new information.
 *
 * @param <S> the state type used in the analysis
 */
public abstract class AbstractAnalysis<S extends State<S>> implements Analysis<S> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractAnalysis.class);

    /** The direction of this analysis. */
    protected final Direction direction;

    /** Creates the default initial state. */
    private final Supplier<S> emptyState;

    /** The code being analyzed, {@code null} if there are no results. */
    protected @Nullable CodeSequence code;

    /** The dispatcher obtained from {@link #createDispatcher()} for the current code. */
    protected @Nullable Dispatcher dispatcher;

    /** The initial state of the current run. */
    protected @Nullable S initialState;

    /** The state the analysis currently works on, {@code null} if the walk was abandoned. */
    protected @Nullable S currentState;

    /** The merge of the states at the end of every walk, {@code null} if there is none. */
    protected @Nullable S finalState;

    /** The position of the current state. */
    protected int currentPosition;

    /** The stored state at every merge point visited so far. */
    protected final Map<Integer, S> mergePoints;

    /** The positions from which the walk still has to continue. */
    protected final Worklist worklist;

    /** The positions dispatched while computing the fixpoint. */
    protected final BitSet reached;

    /** Is the analysis currently running? */
    protected boolean isRunning = false;

    /** The edit count of the code when the analysis ran. */
    private int analyzedEditCount;

    /** Number of dispatches in the current run, for logging. */
    private int dispatchCount;

    /**
     * Creates an analysis.
     *
     * @param direction the direction of the analysis
     * @param emptyState creates the default initial state, see {@link #initialState()}
     */
    protected AbstractAnalysis(Direction direction, Supplier<S> emptyState) {
        this.direction = direction;
        this.emptyState = emptyState;
        this.mergePoints = new HashMap<>();
        this.worklist = new Worklist();
        this.reached = new BitSet();
    }

    @Override
    public Direction getDirection() {
        return direction;
    }

    @Override
    public boolean isRunning() {
        return isRunning;
    }

    @Override
    public boolean isValid() {
        return code != null;
    }

    @Override
    public void analyze(CodeSequence code) {
        if (isRunning) {
            throw new BugInDataflow(
                    "AbstractAnalysis::analyze() doesn't expect to be called while the analysis is"
                            + " running!");
        }
        if (this.code != null) {
            invalidate();
        }
        this.code = code;
        analyzedEditCount = code.editCount();
        isRunning = true;
        dispatchCount = 0;
        try {
            dispatcher = createDispatcher();
            doAnalyze();
        } finally {
            isRunning = false;
        }
        logger.debug(
                "{} analysis of {} instructions reached a fixpoint: {} dispatches, {} merge points",
                direction,
                code.size(),
                dispatchCount,
                mergePoints.size());
    }

    @Override
    public void invalidate() {
        code = null;
        dispatcher = null;
        initialState = null;
        currentState = null;
        finalState = null;
        currentPosition = 0;
        mergePoints.clear();
        worklist.clear();
        reached.clear();
    }

    /**
     * Computes the fixpoint. {@link #code}, {@link #dispatcher} and empty tables are set up when
     * this is called.
     */
    protected abstract void doAnalyze();

    /**
     * Returns the state the analysis starts from. The default is the empty state supplied to the
     * constructor. Analyses override this to describe the state at the entry (forward) or at the
     * exits (backward) more precisely, for example to bind the arguments of a function.
     *
     * @return a new initial state, owned by the analysis from now on
     */
    protected S initialState() {
        return emptyState.get();
    }

    /**
     * Returns the dispatcher running the transfer functions of this analysis. It is called once
     * at the start of every run. The transfer functions work on {@link #current()}.
     *
     * @return the dispatcher
     */
    protected abstract Dispatcher createDispatcher();

    /**
     * Returns the state the transfer functions work on. It is only available while the driver
     * dispatches an instruction.
     *
     * @return the current state
     */
    protected S current() {
        if (currentState == null) {
            throw new BugInDataflow(
                    "AbstractAnalysis::current() there is no current state at position %d",
                    currentPosition);
        }
        return currentState;
    }

    /**
     * Returns the code under analysis.
     *
     * @return the code
     */
    protected CodeSequence code() {
        if (code == null) {
            throw new BugInDataflow("AbstractAnalysis::code() the analysis has no results");
        }
        return code;
    }

    /**
     * Returns the fixpoint stored at a merge point. The returned state belongs to the analysis and
     * must not be modified.
     *
     * @param position a position
     * @return the state stored at {@code position}, or {@code null} if {@code position} is not a
     *     merge point or was never reached
     */
    public @Nullable S getMergePointState(int position) {
        return mergePoints.get(position);
    }

    /**
     * Whether the instruction at a position was dispatched while computing the fixpoint. States
     * are only defined at reached positions.
     *
     * @param position a position
     * @return true if {@code position} was reached
     */
    public boolean isReached(int position) {
        return reached.get(position);
    }

    /**
     * Runs the dispatcher on the instruction at {@code position}, which transforms the current
     * state.
     *
     * @param position a position
     * @return the result of the dispatch
     */
    protected boolean dispatch(int position) {
        Dispatcher d = dispatcher;
        if (d == null) {
            throw new BugInDataflow("AbstractAnalysis::dispatch() the analysis has no dispatcher");
        }
        currentPosition = position;
        dispatchCount++;
        boolean handled = d.dispatch(code(), position);
        if (!handled) {
            logger.trace("dispatch declined at {}: {}", position, code().get(position));
        }
        return handled;
    }

    /**
     * Merges the incoming state into the state stored at a merge point and decides whether the
     * walk goes on.
     *
     * <ul>
     *   <li>The first visit stores a copy of the incoming state.
     *   <li>Without an incoming state (the walk starts here from the worklist) the walk continues
     *       with a copy of the stored state.
     *   <li>Otherwise the incoming state is merged into the stored one. If that changed the stored
     *       state, the walk continues with a copy of it, else the walk is abandoned.
     * </ul>
     *
     * @param position the merge point
     * @return true if the walk continues, false if it was abandoned
     */
    protected boolean mergeAt(int position) {
        S stored = mergePoints.get(position);
        if (stored == null) {
            if (currentState == null) {
                throw new BugInDataflow(
                        "AbstractAnalysis::mergeAt() no incoming state at the first visit of"
                                + " merge point %d",
                        position);
            }
            mergePoints.put(position, currentState.copy());
            return true;
        }
        if (currentState == null) {
            currentState = stored.copy();
            return true;
        }
        if (stored.mergeWith(currentState)) {
            currentState = stored.copy();
            return true;
        }
        logger.trace("no new information at merge point {}, walk abandoned", position);
        currentState = null;
        return false;
    }

    /**
     * Merges the current state into the state stored at a merge point the walk may jump to, and
     * tells whether a walk has to be scheduled from there.
     *
     * @param position the merge point
     * @return true if the stored state is new or changed
     */
    protected boolean shouldFollow(int position) {
        S stored = mergePoints.get(position);
        if (stored == null) {
            mergePoints.put(position, current().copy());
            return true;
        }
        return stored.mergeWith(current());
    }

    /** Merges the current state into the final state and ends the walk. */
    protected void mergeIntoFinal() {
        S state = current();
        if (finalState == null) {
            finalState = state;
        } else {
            finalState.mergeWith(state);
        }
        currentState = null;
    }

    /**
     * Ends the current walk, dropping the current state.
     *
     * @param reason why the walk ends, for logging
     */
    protected void abandon(String reason) {
        logger.trace("walk ends at {}: {}", currentPosition, reason);
        currentState = null;
    }

    /** Starts a walk from the next position of the worklist. */
    protected int nextWalk() {
        int position = worklist.poll();
        logger.trace("walk from {}, {} pending", position, worklist.size());
        return position;
    }

    /**
     * Checks that a position is inside the code, and that the code was not edited since the
     * analysis ran: edits shift positions, so the stored states no longer match them.
     *
     * @param position a position
     */
    protected void checkPosition(int position) {
        CodeSequence c = code();
        if (c.editCount() != analyzedEditCount) {
            throw new BugInDataflow(
                    "AbstractAnalysis: the code was edited after the analysis ran, rerun it");
        }
        if (position < c.begin() || position >= c.end()) {
            throw new BugInDataflow(
                    "AbstractAnalysis: position %d outside of [%d, %d)",
                    position, c.begin(), c.end());
        }
    }
}
