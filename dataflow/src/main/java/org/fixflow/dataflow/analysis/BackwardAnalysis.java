package org.fixflow.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.state.State;

/**
 * A backward analysis that exposes the state it reached at the entry of the code.
 *
 * @param <S> the state type used in the analysis
 */
public interface BackwardAnalysis<S extends State<S>> extends Analysis<S> {

    /**
     * Get the state at the entry point of the code. For a backward analysis it contains the
     * information flowing from all exit points to the entry. The returned state belongs to the
     * analysis and must not be modified.
     *
     * @return the final state, or {@code null} if the entry cannot be reached backward from an
     *     exit point or the analysis has not run
     */
    @Nullable S getFinalState();
}
