package org.fixflow.dataflow.livevariable;

import org.fixflow.dataflow.state.AbstractValue;
import org.fixflow.dataflow.state.ValueDomain;

/**
 * An implementation of an abstract value used for live variable analysis: whether the current
 * value of a variable may still be read. A variable not bound in the environment is dead.
 */
public enum Liveness implements AbstractValue<Liveness> {
    DEAD,
    LIVE;

    /** The domain used by the containers of live variable states. */
    public static final ValueDomain<Liveness> DOMAIN =
            new ValueDomain<Liveness>() {
                @Override
                public Liveness top() {
                    return LIVE;
                }

                @Override
                public Liveness absent() {
                    return DEAD;
                }
            };

    @Override
    public Liveness leastUpperBound(Liveness other) {
        return this == LIVE || other == LIVE ? LIVE : DEAD;
    }
}
