package org.fixflow.dataflow.state;

/**
 * The global component of an {@link AbstractState} for analyses that have nothing to track
 * besides the stack and the environment. It holds no information, so merging never changes it.
 */
public final class NoGlobal implements State<NoGlobal> {

    /** The only instance. */
    public static final NoGlobal INSTANCE = new NoGlobal();

    private NoGlobal() {}

    @Override
    public NoGlobal copy() {
        return this;
    }

    @Override
    public boolean mergeWith(NoGlobal other) {
        return false;
    }

    @Override
    public String toString() {
        return "no global";
    }
}
