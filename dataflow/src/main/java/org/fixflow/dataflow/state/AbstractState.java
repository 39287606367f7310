package org.fixflow.dataflow.state;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The abstract state of a stack-machine program: an abstract operand stack, an abstract
 * environment and a global component that collects whatever else an analysis wants to track
 * (for example facts about the heap). This class is mostly a facade with shorthands for the
 * stack and the environment.
 *
 * <p>Merging merges the three components independently. All three are always merged, even when
 * an earlier one already reported a change, since each of them is a fixpoint of its own.
 *
 * @param <K> the type of the environment keys
 * @param <V> the type of the abstract values
 * @param <G> the type of the global component, {@link NoGlobal} if there is none
 */
public class AbstractState<K, V extends AbstractValue<V>, G extends State<G>>
        implements State<AbstractState<K, V, G>> {

    /** The abstract stack. */
    protected final AbstractStack<V> stack;

    /** The abstract environment. */
    protected final AbstractEnvironment<K, V> env;

    /** The global component. */
    protected final G global;

    /**
     * Creates a state with an empty stack, an empty environment and the given global component.
     *
     * @param domain the value domain
     * @param global the global component
     */
    public AbstractState(ValueDomain<V> domain, G global) {
        this(new AbstractStack<>(), new AbstractEnvironment<>(domain), global);
    }

    /**
     * Creates a state from its components. The state takes ownership of all of them.
     *
     * @param stack the abstract stack
     * @param env the abstract environment
     * @param global the global component
     */
    public AbstractState(AbstractStack<V> stack, AbstractEnvironment<K, V> env, G global) {
        this.stack = stack;
        this.env = env;
        this.global = global;
    }

    /**
     * Creates an empty state without a global component.
     *
     * @param domain the value domain
     * @param <K> the type of the environment keys
     * @param <V> the type of the abstract values
     * @return a state with an empty stack and an empty environment
     */
    public static <K, V extends AbstractValue<V>> AbstractState<K, V, NoGlobal> create(
            ValueDomain<V> domain) {
        return new AbstractState<>(domain, NoGlobal.INSTANCE);
    }

    @Override
    public AbstractState<K, V, G> copy() {
        return new AbstractState<>(stack.copy(), env.copy(), global.copy());
    }

    @Override
    public boolean mergeWith(AbstractState<K, V, G> other) {
        boolean changed = false;
        changed = global.mergeWith(other.global) || changed;
        changed = stack.mergeWith(other.stack) || changed;
        changed = env.mergeWith(other.env) || changed;
        return changed;
    }

    /** @return the abstract stack */
    public AbstractStack<V> stack() {
        return stack;
    }

    /** @return the abstract environment */
    public AbstractEnvironment<K, V> env() {
        return env;
    }

    /** @return the global component */
    public G global() {
        return global;
    }

    public void push(V value) {
        stack.push(value);
    }

    public V pop() {
        return stack.pop();
    }

    public void pop(int count) {
        stack.pop(count);
    }

    public V top() {
        return stack.top();
    }

    /**
     * @param index the distance from the top of the stack
     * @return the stack value at {@code index}
     */
    public V get(int index) {
        return stack.get(index);
    }

    public void set(int index, V value) {
        stack.set(index, value);
    }

    /**
     * @param key an environment key
     * @return the local binding of {@code key}, or top
     * @see AbstractEnvironment#get
     */
    public V get(K key) {
        return env.get(key);
    }

    /**
     * @param key an environment key
     * @return the binding of {@code key} in the environment or its parents, or top
     * @see AbstractEnvironment#find
     */
    public V find(K key) {
        return env.find(key);
    }

    public void put(K key, V value) {
        env.put(key, value);
    }

    /**
     * Merges {@code value} into every binding of the environment.
     *
     * @param value the value to merge in
     */
    public void mergeAllEnv(V value) {
        env.mergeAll(value);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof AbstractState)) {
            return false;
        }
        AbstractState<?, ?, ?> other = (AbstractState<?, ?, ?>) obj;
        return stack.equals(other.stack)
                && env.equals(other.env)
                && global.equals(other.global);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stack, env, global);
    }

    @Override
    public String toString() {
        if (global instanceof NoGlobal) {
            return "stack: " + stack + " env: " + env;
        }
        return "stack: " + stack + " env: " + env + " global: " + global;
    }
}
