package org.fixflow.dataflow.state;

/**
 * A state is the information an analysis keeps at one program point.
 *
 * <p>The analysis drivers only need two capabilities from it: a deep copy and an in-place merge.
 * Termination of the drivers relies on {@link #mergeWith} being monotone (the merged state is at
 * least as large as both inputs) and on the underlying domain having finite height. Domains of
 * infinite height need widening, which the drivers do not perform.
 *
 * @param <S> the type of the state
 */
public interface State<S extends State<S>> {

    /**
     * Returns an exact copy of this state. The copy shares no mutable data with {@code this}.
     *
     * @return an exact copy of this state
     */
    S copy();

    /**
     * Merges the information of {@code other} into this state. {@code other} is not modified.
     *
     * @param other the state to merge into this one
     * @return true if this state changed
     */
    boolean mergeWith(S other);
}
