package org.fixflow.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.state.State;

/**
 * A forward analysis that exposes the state it reached at the exits of the code.
 *
 * @param <S> the state type used in the analysis
 */
public interface ForwardAnalysis<S extends State<S>> extends Analysis<S> {

    /**
     * Get the merge of the states at all exit points of the code. The returned state belongs to
     * the analysis and must not be modified.
     *
     * @return the final state, or {@code null} if no exit point is reachable or the analysis has
     *     not run
     */
    @Nullable S getFinalState();
}
