package org.fixflow.dataflow.analysis;

import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.state.State;

/**
 * A backward analysis whose only result is the state at the entry of the code.
 *
 * @param <S> the state type used in the analysis
 */
public abstract class BackwardFinalAnalysis<S extends State<S>> extends BackwardAnalysisImpl<S>
        implements BackwardAnalysis<S> {

    protected BackwardFinalAnalysis(Supplier<S> emptyState) {
        super(emptyState);
    }

    @Override
    public @Nullable S getFinalState() {
        return finalState;
    }
}
