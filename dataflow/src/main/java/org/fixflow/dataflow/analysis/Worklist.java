package org.fixflow.dataflow.analysis;

import java.util.ArrayDeque;
import java.util.Deque;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * The positions an analysis driver still has to walk from. Positions are handed out last in,
 * first out, so the walk keeps following the most recently discovered path.
 */
public class Worklist {

    private final Deque<Integer> positions = new ArrayDeque<>();

    /**
     * Schedules a walk from {@code position}.
     *
     * @param position a position in the code
     */
    public void add(int position) {
        positions.push(position);
    }

    /**
     * Removes the most recently added position.
     *
     * @return the position
     */
    public int poll() {
        Integer position = positions.poll();
        if (position == null) {
            throw new BugInDataflow("Worklist::poll() the worklist is empty");
        }
        return position;
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    public int size() {
        return positions.size();
    }

    public void clear() {
        positions.clear();
    }

    @Override
    public String toString() {
        return "Worklist" + positions;
    }
}
