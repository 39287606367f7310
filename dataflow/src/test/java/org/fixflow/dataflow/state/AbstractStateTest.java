package org.fixflow.dataflow.state;

import static org.junit.Assert.*;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.constantpropagation.ConstantValue;
import org.junit.Test;

public class AbstractStateTest {

    /** A global component remembering the largest counter seen on any path. */
    private static class MaxCounter implements State<MaxCounter> {
        int count;

        MaxCounter(int count) {
            this.count = count;
        }

        @Override
        public MaxCounter copy() {
            return new MaxCounter(count);
        }

        @Override
        public boolean mergeWith(MaxCounter other) {
            if (other.count > count) {
                count = other.count;
                return true;
            }
            return false;
        }

        @Override
        public boolean equals(@Nullable Object obj) {
            return obj instanceof MaxCounter && ((MaxCounter) obj).count == count;
        }

        @Override
        public int hashCode() {
            return count;
        }

        @Override
        public String toString() {
            return "max " + count;
        }
    }

    private static AbstractState<String, ConstantValue, MaxCounter> state(int count) {
        return new AbstractState<>(ConstantValue.DOMAIN, new MaxCounter(count));
    }

    @Test
    public void testShorthands() {
        AbstractState<String, ConstantValue, NoGlobal> state =
                AbstractState.create(ConstantValue.DOMAIN);
        state.push(ConstantValue.of(1));
        state.push(ConstantValue.of(2));
        state.set(1, ConstantValue.of(3));
        assertEquals(ConstantValue.of(3), state.get(1));
        assertEquals(ConstantValue.of(2), state.top());

        state.put("x", state.pop());
        assertEquals(ConstantValue.of(2), state.get("x"));
        assertEquals(ConstantValue.of(2), state.find("x"));
        assertEquals(1, state.stack().depth());

        state.pop(1);
        assertTrue(state.stack().isEmpty());
        assertEquals("stack: [] env: {x: 2}", state.toString());
    }

    @Test
    public void testMergeCoversAllComponents() {
        AbstractState<String, ConstantValue, MaxCounter> left = state(1);
        left.push(ConstantValue.of(1));
        left.put("x", ConstantValue.of(1));
        AbstractState<String, ConstantValue, MaxCounter> right = state(1);
        right.push(ConstantValue.of(1));
        right.put("x", ConstantValue.of(1));

        assertFalse(left.mergeWith(right));

        right.global().count = 4;
        assertTrue(left.mergeWith(right));
        assertEquals(4, left.global().count);

        right.set(0, ConstantValue.of(2));
        assertTrue(left.mergeWith(right));
        assertEquals(ConstantValue.TOP, left.top());

        right.put("x", ConstantValue.of(2));
        assertTrue(left.mergeWith(right));
        assertEquals(ConstantValue.TOP, left.get("x"));

        assertEquals("stack: [top] env: {x: top} global: max 4", left.toString());
    }

    @Test
    public void testCopyIsDeep() {
        AbstractState<String, ConstantValue, MaxCounter> state = state(2);
        state.push(ConstantValue.of(1));
        state.put("x", ConstantValue.of(1));

        AbstractState<String, ConstantValue, MaxCounter> copy = state.copy();
        assertEquals(state, copy);

        copy.push(ConstantValue.of(2));
        copy.put("x", ConstantValue.TOP);
        copy.global().count = 9;

        assertEquals(1, state.stack().depth());
        assertEquals(ConstantValue.of(1), state.get("x"));
        assertEquals(2, state.global().count);
        assertNotEquals(state, copy);
    }

    @Test
    public void testMergeAllEnv() {
        AbstractState<String, ConstantValue, NoGlobal> state =
                AbstractState.create(ConstantValue.DOMAIN);
        state.put("x", ConstantValue.of(1));
        state.push(ConstantValue.of(1));

        state.mergeAllEnv(ConstantValue.TOP);
        assertEquals(ConstantValue.TOP, state.get("x"));
        assertEquals(ConstantValue.of(1), state.top());
    }

    @Test
    public void testNoGlobalNeverChanges() {
        assertFalse(NoGlobal.INSTANCE.mergeWith(NoGlobal.INSTANCE));
        assertSame(NoGlobal.INSTANCE, NoGlobal.INSTANCE.copy());
    }
}
