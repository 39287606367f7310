package org.fixflow.dataflow.analysis;

import java.util.ArrayList;
import java.util.List;
import org.fixflow.dataflow.code.CodeSequence;
import org.fixflow.dataflow.dispatch.Dispatcher;
import org.fixflow.dataflow.livevariable.LiveVariableAnalysis;

/** Live variable analysis that records the positions dispatched while computing the fixpoint. */
class RecordingLiveVariableAnalysis extends LiveVariableAnalysis {

    final List<Integer> dispatched = new ArrayList<>();

    @Override
    protected Dispatcher createDispatcher() {
        Dispatcher transfer = super.createDispatcher();
        return new Dispatcher() {
            @Override
            protected void doDispatch(CodeSequence code, int position) {
                if (isRunning()) {
                    dispatched.add(position);
                }
                if (!transfer.dispatch(code, position)) {
                    fail();
                }
            }
        };
    }

    int timesDispatched(int position) {
        int count = 0;
        for (int p : dispatched) {
            if (p == position) {
                count++;
            }
        }
        return count;
    }
}
