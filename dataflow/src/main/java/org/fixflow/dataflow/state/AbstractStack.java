package org.fixflow.dataflow.state;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * The abstract operand stack.
 *
 * <p>For well-formed code the stack depth at any merge point is the same on every incoming path,
 * so merging two stacks is a positional merge of their values. Different depths at a merge are a
 * {@link BugInDataflow}.
 *
 * <p>Values are indexed from the top: index 0 is the top of the stack.
 *
 * @param <V> the type of the abstract values on the stack
 */
public class AbstractStack<V extends AbstractValue<V>>
        implements State<AbstractStack<V>>, Iterable<V> {

    /** The values on the stack, the bottom of the stack first. */
    protected final List<V> values;

    /** Creates an empty stack. */
    public AbstractStack() {
        this.values = new ArrayList<>();
    }

    /**
     * Creates a stack holding the values of {@code other}.
     *
     * @param other the stack to copy
     */
    protected AbstractStack(AbstractStack<V> other) {
        this.values = new ArrayList<>(other.values);
    }

    @Override
    public AbstractStack<V> copy() {
        return new AbstractStack<>(this);
    }

    @Override
    public boolean mergeWith(AbstractStack<V> other) {
        if (depth() != other.depth()) {
            throw new BugInDataflow(
                    "AbstractStack::mergeWith() stacks must have the same depth at a merge point,"
                            + " but got %d and %d",
                    depth(),
                    other.depth());
        }
        boolean changed = false;
        for (int i = 0; i < values.size(); i++) {
            V mine = values.get(i);
            V merged = mine.leastUpperBound(other.values.get(i));
            if (!merged.equals(mine)) {
                values.set(i, merged);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Pushes a value on the stack.
     *
     * @param value the value to push
     */
    public void push(V value) {
        values.add(value);
    }

    /**
     * Removes the top value from the stack.
     *
     * @return the removed value
     */
    public V pop() {
        checkDepth(1);
        return values.remove(values.size() - 1);
    }

    /**
     * Removes the top {@code count} values from the stack.
     *
     * @param count the number of values to remove
     */
    public void pop(int count) {
        checkDepth(count);
        values.subList(values.size() - count, values.size()).clear();
    }

    /**
     * Returns the top value of the stack.
     *
     * @return the top value
     */
    public V top() {
        return get(0);
    }

    /**
     * Returns the value at the given distance from the top.
     *
     * @param index the distance from the top, 0 is the top value
     * @return the value at {@code index}
     */
    public V get(int index) {
        checkIndex(index);
        return values.get(values.size() - 1 - index);
    }

    /**
     * Replaces the value at the given distance from the top.
     *
     * @param index the distance from the top, 0 is the top value
     * @param value the new value
     */
    public void set(int index, V value) {
        checkIndex(index);
        values.set(values.size() - 1 - index, value);
    }

    /** @return the number of values on the stack */
    public int depth() {
        return values.size();
    }

    /** @return true if there are no values on the stack */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Iterates the values from the top of the stack to its bottom. */
    @Override
    public Iterator<V> iterator() {
        return new Iterator<V>() {
            private int next = values.size() - 1;

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public V next() {
                if (next < 0) {
                    throw new NoSuchElementException();
                }
                return values.get(next--);
            }
        };
    }

    private void checkIndex(int index) {
        if (index < 0) {
            throw new BugInDataflow("AbstractStack: negative stack index %d", index);
        }
        checkDepth(index + 1);
    }

    private void checkDepth(int required) {
        if (required < 0 || values.size() < required) {
            throw new BugInDataflow(
                    "AbstractStack: stack underflow, %d values required but depth is %d",
                    required,
                    values.size());
        }
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof AbstractStack)) {
            return false;
        }
        AbstractStack<?> other = (AbstractStack<?>) obj;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /** Prints the stack top first, e.g. {@code [3, top]} for a stack whose top value is 3. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        String sep = "";
        for (V value : this) {
            sb.append(sep).append(value);
            sep = ", ";
        }
        return sb.append("]").toString();
    }
}
