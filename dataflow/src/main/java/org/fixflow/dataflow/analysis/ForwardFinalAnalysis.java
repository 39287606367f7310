package org.fixflow.dataflow.analysis;

import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.state.State;

/**
 * A forward analysis whose only result is the state at the exits of the code.
 *
 * @param <S> the state type used in the analysis
 */
public abstract class ForwardFinalAnalysis<S extends State<S>> extends ForwardAnalysisImpl<S>
        implements ForwardAnalysis<S> {

    protected ForwardFinalAnalysis(Supplier<S> emptyState) {
        super(emptyState);
    }

    @Override
    public @Nullable S getFinalState() {
        return finalState;
    }
}
