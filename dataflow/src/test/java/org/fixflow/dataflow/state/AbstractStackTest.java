package org.fixflow.dataflow.state;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.fixflow.dataflow.constantpropagation.ConstantValue;
import org.fixflow.dataflow.util.BugInDataflow;
import org.junit.Test;

public class AbstractStackTest {

    private static AbstractStack<ConstantValue> stackOf(int... bottomFirst) {
        AbstractStack<ConstantValue> stack = new AbstractStack<>();
        for (int value : bottomFirst) {
            stack.push(ConstantValue.of(value));
        }
        return stack;
    }

    @Test
    public void testPushPopTop() {
        AbstractStack<ConstantValue> stack = stackOf(1, 2);
        assertEquals(2, stack.depth());
        assertEquals(ConstantValue.of(2), stack.top());
        assertEquals(ConstantValue.of(2), stack.pop());
        assertEquals(ConstantValue.of(1), stack.pop());
        assertTrue(stack.isEmpty());
    }

    @Test
    public void testIndexedAccessCountsFromTheTop() {
        AbstractStack<ConstantValue> stack = stackOf(1, 2, 3);
        assertEquals(ConstantValue.of(3), stack.get(0));
        assertEquals(ConstantValue.of(1), stack.get(2));

        stack.set(1, ConstantValue.TOP);
        assertEquals(ConstantValue.TOP, stack.get(1));
        assertEquals(ConstantValue.of(3), stack.top());
    }

    @Test
    public void testPopMany() {
        AbstractStack<ConstantValue> stack = stackOf(1, 2, 3);
        stack.pop(2);
        assertEquals(1, stack.depth());
        assertEquals(ConstantValue.of(1), stack.top());
    }

    @Test(expected = BugInDataflow.class)
    public void testPopEmptyStack() {
        new AbstractStack<ConstantValue>().pop();
    }

    @Test(expected = BugInDataflow.class)
    public void testPopTooMany() {
        stackOf(1).pop(2);
    }

    @Test(expected = BugInDataflow.class)
    public void testGetBelowBottom() {
        stackOf(1, 2).get(2);
    }

    @Test(expected = BugInDataflow.class)
    public void testNegativeIndex() {
        stackOf(1, 2).get(-1);
    }

    @Test
    public void testIterationIsTopFirst() {
        List<ConstantValue> values = new ArrayList<>();
        for (ConstantValue value : stackOf(1, 2, 3)) {
            values.add(value);
        }
        assertEquals(
                Arrays.asList(ConstantValue.of(3), ConstantValue.of(2), ConstantValue.of(1)),
                values);
        assertEquals("[3, 2, 1]", stackOf(1, 2, 3).toString());
    }

    @Test
    public void testMergeIsSlotWise() {
        AbstractStack<ConstantValue> left = stackOf(1, 2);
        AbstractStack<ConstantValue> right = stackOf(1, 3);

        assertTrue(left.mergeWith(right));
        assertEquals(ConstantValue.TOP, left.get(0));
        assertEquals(ConstantValue.of(1), left.get(1));
        // right is not modified
        assertEquals(ConstantValue.of(3), right.top());
    }

    @Test
    public void testMergeWithEqualStackReportsNoChange() {
        AbstractStack<ConstantValue> stack = stackOf(4, 5);
        assertFalse(stack.mergeWith(stack.copy()));
        assertFalse(new AbstractStack<ConstantValue>().mergeWith(new AbstractStack<>()));
    }

    @Test(expected = BugInDataflow.class)
    public void testMergeWithDifferentDepth() {
        stackOf(1, 2).mergeWith(stackOf(1));
    }

    @Test
    public void testCopyIsIndependent() {
        AbstractStack<ConstantValue> stack = stackOf(1);
        AbstractStack<ConstantValue> copy = stack.copy();
        copy.push(ConstantValue.of(2));
        copy.set(1, ConstantValue.TOP);

        assertEquals(stackOf(1), stack);
        assertNotEquals(stack, copy);
    }
}
