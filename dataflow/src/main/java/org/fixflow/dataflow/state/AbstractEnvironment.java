package org.fixflow.dataflow.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * The abstract environment: a mapping from keys to abstract values with an optional parent
 * environment that is searched when a key is not bound locally.
 *
 * <p>An environment exclusively owns its parent chain. {@link #copy()} copies the whole chain and
 * a parent adopted during {@link #mergeWith} is a copy as well, so no two environments ever share
 * a mutable parent.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the abstract values
 */
public class AbstractEnvironment<K, V extends AbstractValue<V>>
        implements State<AbstractEnvironment<K, V>> {

    /** The domain providing the top and absent values. */
    protected final ValueDomain<V> domain;

    /** The bindings of this environment, not including those of its parents. */
    protected final Map<K, V> bindings;

    /** The parent environment, owned by this environment. */
    protected @Nullable AbstractEnvironment<K, V> parent;

    /**
     * Creates an empty environment without a parent.
     *
     * @param domain the value domain
     */
    public AbstractEnvironment(ValueDomain<V> domain) {
        this(domain, null);
    }

    /**
     * Creates an empty environment with the given parent. The new environment takes ownership of
     * {@code parent}; the caller must not modify it afterwards.
     *
     * @param domain the value domain
     * @param parent the parent environment, or {@code null} for none
     */
    public AbstractEnvironment(ValueDomain<V> domain, @Nullable AbstractEnvironment<K, V> parent) {
        this.domain = domain;
        this.bindings = new LinkedHashMap<>();
        this.parent = parent;
    }

    @Override
    public AbstractEnvironment<K, V> copy() {
        AbstractEnvironment<K, V> result =
                new AbstractEnvironment<>(domain, parent == null ? null : parent.copy());
        result.bindings.putAll(bindings);
        return result;
    }

    /**
     * Merges {@code other} into this environment.
     *
     * <p>A missing binding cannot be treated as bottom: if one path binds a key and the other does
     * not, the binding is merged with {@link ValueDomain#absent()} so that the analysis learns
     * that the key may be unbound. An analysis that does not care can make absent its bottom.
     */
    @Override
    public boolean mergeWith(AbstractEnvironment<K, V> other) {
        boolean changed = false;
        V absent = domain.absent();

        for (Map.Entry<K, V> theirs : other.bindings.entrySet()) {
            V mine = bindings.get(theirs.getKey());
            if (mine == null) {
                bindings.put(theirs.getKey(), theirs.getValue().leastUpperBound(absent));
                changed = true;
            } else {
                V merged = mine.leastUpperBound(theirs.getValue());
                if (!merged.equals(mine)) {
                    bindings.put(theirs.getKey(), merged);
                    changed = true;
                }
            }
        }
        for (Map.Entry<K, V> mine : bindings.entrySet()) {
            if (!other.bindings.containsKey(mine.getKey())) {
                V merged = mine.getValue().leastUpperBound(absent);
                if (!merged.equals(mine.getValue())) {
                    mine.setValue(merged);
                    changed = true;
                }
            }
        }

        if (parent == null) {
            if (other.parent != null) {
                parent = other.parent.copy();
                changed = true;
            }
        } else if (other.parent != null) {
            changed = parent.mergeWith(other.parent) || changed;
        }
        return changed;
    }

    /**
     * Looks up a key the way a running program would: first in this environment, then in the
     * parents. If no environment binds the key, the top value is returned.
     *
     * @param key the key to look up
     * @return the value bound to {@code key}
     */
    public V find(K key) {
        V value = bindings.get(key);
        if (value != null) {
            return value;
        }
        if (parent != null) {
            return parent.find(key);
        }
        return domain.top();
    }

    /**
     * Returns the local binding of a key, ignoring the parents.
     *
     * @param key the key to look up
     * @return the value bound to {@code key} in this environment, or the top value
     */
    public V get(K key) {
        V value = bindings.get(key);
        return value == null ? domain.top() : value;
    }

    /**
     * Binds a key in this environment.
     *
     * @param key the key
     * @param value the new value
     */
    public void put(K key, V value) {
        bindings.put(key, value);
    }

    /**
     * Replaces the local binding of a key by {@code fn} applied to it. A key that is not bound
     * locally is bound to the top value first, so after this call the key is always bound here.
     *
     * @param key the key
     * @param fn computes the new value from the current one
     * @return the new value
     */
    public V update(K key, UnaryOperator<V> fn) {
        V current = bindings.get(key);
        if (current == null) {
            current = domain.top();
            bindings.put(key, current);
        }
        V updated = fn.apply(current);
        bindings.put(key, updated);
        return updated;
    }

    /**
     * Merges {@code value} into every local binding. Used to invalidate what is known about the
     * environment after an effect the analysis cannot see through.
     *
     * @param value the value to merge in
     */
    public void mergeAll(V value) {
        for (Map.Entry<K, V> entry : bindings.entrySet()) {
            entry.setValue(entry.getValue().leastUpperBound(value));
        }
    }

    /**
     * @param key a key
     * @return true if {@code key} is bound in this environment, ignoring the parents
     */
    public boolean has(K key) {
        return bindings.containsKey(key);
    }

    /** @return true if this environment has no local bindings */
    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /** @return true if this environment has a parent */
    public boolean hasParent() {
        return parent != null;
    }

    /**
     * Returns the parent environment. It remains owned by this environment.
     *
     * @return the parent environment
     */
    public AbstractEnvironment<K, V> getParent() {
        if (parent == null) {
            throw new BugInDataflow("AbstractEnvironment::getParent() environment has no parent");
        }
        return parent;
    }

    /** @return the keys bound in this environment, as an unmodifiable view */
    public Set<K> keySet() {
        return Collections.unmodifiableSet(bindings.keySet());
    }

    /** @return the local bindings, as an unmodifiable view */
    public Set<Map.Entry<K, V>> entrySet() {
        return Collections.unmodifiableMap(bindings).entrySet();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof AbstractEnvironment)) {
            return false;
        }
        AbstractEnvironment<?, ?> other = (AbstractEnvironment<?, ?>) obj;
        return bindings.equals(other.bindings) && Objects.equals(parent, other.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings, parent);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        String sep = "";
        for (Map.Entry<K, V> entry : bindings.entrySet()) {
            sb.append(sep).append(entry.getKey()).append(": ").append(entry.getValue());
            sep = ", ";
        }
        sb.append("}");
        if (parent != null) {
            sb.append(" <- ").append(parent);
        }
        return sb.toString();
    }
}
