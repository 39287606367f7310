package org.fixflow.dataflow.state;

/**
 * The distinguished elements of an abstract value domain that the containers of the state model
 * need on their own, without the help of a transfer function.
 *
 * @param <V> the type of the abstract value
 */
public interface ValueDomain<V extends AbstractValue<V>> {

    /**
     * Returns the value that stands for "anything". It is the result of looking up an unbound key
     * and the initial value of a binding created by an indexed write.
     *
     * @return the top value of the domain
     */
    V top();

    /**
     * Returns the value that stands for "not bound on this path". When two environments are
     * merged and only one of them binds a key, the binding is merged with this value.
     *
     * <p>A domain that does not care about absence can return its bottom element here.
     *
     * @return the absent value of the domain
     */
    V absent();
}
