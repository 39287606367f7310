package org.fixflow.dataflow.dispatch;

import org.fixflow.dataflow.code.CodeSequence;

/**
 * A dispatcher inspects the instruction at a position and runs whatever code is appropriate for
 * it, typically the transfer function of an analysis.
 *
 * <p>A dispatch either succeeds or fails. Failing is not an error: it only means the dispatcher,
 * or the code it dispatched to, did not handle this situation, so dispatchers can be chained with
 * fallbacks. Errors are reported with exceptions.
 *
 * <p>A dispatcher never decides which instruction comes next. Moving through the code is the job
 * of the analysis driver.
 */
public abstract class Dispatcher {

    /** Whether the current dispatch has succeeded so far. */
    private boolean success;

    protected Dispatcher() {}

    /**
     * Dispatches on the instruction at {@code position}.
     *
     * @param code the code
     * @param position the position of the instruction
     * @return true if the dispatch succeeded, false if it was declined
     */
    public final boolean dispatch(CodeSequence code, int position) {
        success = true;
        doDispatch(code, position);
        return success;
    }

    /** Marks the current dispatch as failed: {@link #dispatch} will return false. */
    protected final void fail() {
        success = false;
    }

    /**
     * The actual dispatch. Implementations call {@link #fail()} when they do not handle the
     * instruction.
     *
     * @param code the code
     * @param position the position of the instruction
     */
    protected abstract void doDispatch(CodeSequence code, int position);
}
