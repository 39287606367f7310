package org.fixflow.dataflow.constantpropagation;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.state.AbstractValue;
import org.fixflow.dataflow.state.ValueDomain;
import org.fixflow.dataflow.util.BugInDataflow;

/**
 * The abstract value of constant propagation: nothing known yet, a single integer constant, any
 * value, or "not assigned on some path".
 *
 * <pre>
 *            TOP
 *         /   |   \
 *   ABSENT   ...  CONSTANT(n) ...
 *         \   |   /
 *           BOTTOM
 * </pre>
 */
public final class ConstantValue implements AbstractValue<ConstantValue> {

    /** The kinds of values. */
    public enum Kind {
        BOTTOM,
        ABSENT,
        CONSTANT,
        TOP
    }

    public static final ConstantValue BOTTOM = new ConstantValue(Kind.BOTTOM, 0);

    public static final ConstantValue ABSENT = new ConstantValue(Kind.ABSENT, 0);

    public static final ConstantValue TOP = new ConstantValue(Kind.TOP, 0);

    /** The domain used by the containers of constant propagation states. */
    public static final ValueDomain<ConstantValue> DOMAIN =
            new ValueDomain<ConstantValue>() {
                @Override
                public ConstantValue top() {
                    return TOP;
                }

                @Override
                public ConstantValue absent() {
                    return ABSENT;
                }
            };

    private final Kind kind;

    private final int value;

    private ConstantValue(Kind kind, int value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * @param value an integer
     * @return the abstract value standing for exactly {@code value}
     */
    public static ConstantValue of(int value) {
        return new ConstantValue(Kind.CONSTANT, value);
    }

    /**
     * @param value a boolean
     * @return the constant 1 for true, 0 for false
     */
    public static ConstantValue of(boolean value) {
        return of(value ? 1 : 0);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    /** @return the constant */
    public int getValue() {
        if (kind != Kind.CONSTANT) {
            throw new BugInDataflow("ConstantValue::getValue() %s is not a constant", this);
        }
        return value;
    }

    @Override
    public ConstantValue leastUpperBound(ConstantValue other) {
        if (this.equals(other) || other.kind == Kind.BOTTOM) {
            return this;
        }
        if (kind == Kind.BOTTOM) {
            return other;
        }
        return TOP;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof ConstantValue)) {
            return false;
        }
        ConstantValue other = (ConstantValue) obj;
        return kind == other.kind && value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BOTTOM:
                return "bottom";
            case ABSENT:
                return "absent";
            case CONSTANT:
                return Integer.toString(value);
            case TOP:
                return "top";
            default:
                throw new BugInDataflow("ConstantValue::toString() unexpected kind: " + kind);
        }
    }
}
