package org.fixflow.dataflow.analysis;

import org.fixflow.dataflow.code.CodeSequence;
import org.fixflow.dataflow.state.State;

/**
 * General dataflow analysis interface. An analysis computes a fixpoint of abstract states over a
 * piece of code, in one direction: a forward analysis is driven from the entry of the code to its
 * exits, a backward analysis from the exits to the entry.
 *
 * <p>An analysis object can be run many times. Every run discards the results of the previous
 * one.
 *
 * @param <S> the state type used in the analysis
 */
public interface Analysis<S extends State<S>> {

    /**
     * The direction of an analysis instance. An analysis could either be a forward analysis with
     * FORWARD direction, or a backward analysis with BACKWARD direction.
     */
    enum Direction {
        /** The forward direction. */
        FORWARD,
        /** The backward direction. */
        BACKWARD
    }

    /**
     * Get the direction of this analysis.
     *
     * @return the direction of this analysis
     */
    Direction getDirection();

    /**
     * Get the status of the analysis that whether it is currently running.
     *
     * @return true if the analysis is running currently
     */
    boolean isRunning();

    /**
     * Perform the analysis of the given code, discarding the results of any previous run.
     *
     * @param code the code to analyze
     */
    void analyze(CodeSequence code);

    /**
     * Discard all results of the analysis. Calling this repeatedly, or before any run, does no
     * harm.
     */
    void invalidate();

    /**
     * Whether the analysis holds results for some code.
     *
     * @return true after a run and before the next {@link #invalidate()}
     */
    boolean isValid();
}
