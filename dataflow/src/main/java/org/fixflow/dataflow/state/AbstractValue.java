package org.fixflow.dataflow.state;

/**
 * An abstract value used in the dataflow analysis: the leaf values held by an {@link
 * AbstractStack} and bound in an {@link AbstractEnvironment}.
 *
 * <p>Abstract values are immutable. Containers detect a change after a merge by comparing the
 * result of {@link #leastUpperBound} with the old value using {@link Object#equals}, so
 * implementations must override {@code equals} and {@code hashCode} consistently.
 *
 * @param <V> the type of the abstract value
 */
public interface AbstractValue<V extends AbstractValue<V>> {

    /**
     * Compute the least upper bound of two values.
     *
     * <p><em>Important</em>: This method must fulfill the following contract:
     *
     * <ul>
     *   <li>Does not change {@code this}.
     *   <li>Does not change {@code other}.
     *   <li>Returns a value that is equal to or above both {@code this} and {@code other} in the
     *       lattice, so that repeated merging is monotone.
     *   <li>Is commutative.
     * </ul>
     *
     * @param other another value
     * @return the least upper bound of two values
     */
    V leastUpperBound(V other);
}
