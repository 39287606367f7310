package org.fixflow.dataflow.code;

import java.util.HashMap;
import java.util.Map;
import java.util.function.IntFunction;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates a textual listing of a piece of code with the state of an analysis on every line.
 *
 * <p>Configured through {@link #init(Map)}; the only key is {@code verbose} (a {@link Boolean},
 * default false), which also lists the positions the analysis never reached.
 */
public class StringStateVisualizer {

    /** Key of the listing in the map returned by {@link #visualize}. */
    public static final String STRING_LISTING = "stringListing";

    /** Whether unreached positions are listed. */
    protected boolean verbose;

    /**
     * Initialization method guaranteed to be called once before the first invocation of {@link
     * #visualize}.
     *
     * @param args implementation-dependent options
     */
    public void init(Map<String, Object> args) {
        Object verb = args.get("verbose");
        this.verbose = verb != null && (Boolean) verb;
    }

    /**
     * Lists the code, one instruction per line, each followed by its state.
     *
     * @param code the analyzed code
     * @param stateAt the state to show for a position, {@code null} if the position was not
     *     reached
     * @param finalState the summary of the analysis, or {@code null} if there is none
     * @return a map holding the listing under {@link #STRING_LISTING}
     */
    public Map<String, Object> visualize(
            CodeSequence code, IntFunction<?> stateAt, @Nullable Object finalState) {
        StringBuilder sb = new StringBuilder();
        for (int position = code.begin(); position < code.end(); position++) {
            Object state = stateAt.apply(position);
            if (state == null && !verbose) {
                continue;
            }
            sb.append(String.format("%4d  %-16s", position, code.get(position)));
            sb.append(state == null ? "unreachable" : state.toString());
            sb.append('\n');
        }
        sb.append("final: ").append(finalState == null ? "none" : finalState.toString());
        sb.append('\n');

        Map<String, Object> res = new HashMap<>();
        res.put(STRING_LISTING, sb.toString());
        return res;
    }
}
