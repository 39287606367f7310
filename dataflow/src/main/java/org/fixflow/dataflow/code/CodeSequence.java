package org.fixflow.dataflow.code;

import java.util.List;
import java.util.Set;

/**
 * The view of a piece of code that the analysis drivers navigate.
 *
 * <p>Positions are the integers {@code begin() <= p < end()}. They are stable as long as the code
 * is not edited; editing the code invalidates the results of every analysis run on it. Stepping
 * forward is {@code p + 1}, stepping backward is {@code p - 1}.
 */
public interface CodeSequence {

    /** @return the number of instructions */
    int size();

    /** @return the first position */
    default int begin() {
        return 0;
    }

    /** @return the position one past the last instruction */
    default int end() {
        return size();
    }

    /**
     * @param position a position
     * @return the instruction at {@code position}
     */
    Instruction get(int position);

    /**
     * @param position a position
     * @return true if the instruction at {@code position} is a label, i.e. a merge point for a
     *     forward analysis
     */
    boolean isLabel(int position);

    /**
     * @param position a position
     * @return true if the instruction at {@code position} is a jump of any kind
     */
    boolean isJump(int position);

    /**
     * @param position a position
     * @return true if the instruction at {@code position} is a jump that never falls through
     */
    boolean isUnconditionalJump(int position);

    /**
     * @param position a position
     * @return true if control leaves the code at {@code position}
     */
    boolean isExitPoint(int position);

    /**
     * @param position a position
     * @return true if control enters the code at {@code position}
     */
    boolean isEntryPoint(int position);

    /**
     * Returns the positions of the labels a jump may transfer control to.
     *
     * @param position the position of a jump
     * @return the positions of its targets, never empty
     */
    List<Integer> targets(int position);

    /**
     * Returns every position that may execute right after {@code position}: the next position if
     * the instruction falls through, and the targets if it is a jump.
     *
     * @param position a position
     * @return the forward successors of {@code position}
     */
    Set<Integer> successors(int position);

    /**
     * Returns a count that changes with every edit of the code. Analyses compare it with the
     * count seen when they ran to detect stale results.
     *
     * @return the number of edits so far
     */
    default int editCount() {
        return 0;
    }
}
