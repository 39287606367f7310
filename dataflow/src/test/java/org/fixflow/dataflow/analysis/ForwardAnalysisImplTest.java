package org.fixflow.dataflow.analysis;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.fixflow.dataflow.code.CodeEditor;
import org.fixflow.dataflow.code.InstructionParser;
import org.fixflow.dataflow.constantpropagation.ConstantPropagation;
import org.fixflow.dataflow.constantpropagation.ConstantValue;
import org.fixflow.dataflow.state.AbstractState;
import org.fixflow.dataflow.state.NoGlobal;
import org.fixflow.dataflow.util.BugInDataflow;
import org.junit.Test;

public class ForwardAnalysisImplTest {

    @Test
    public void testStraightLineDispatchesEveryInstructionOnce() {
        CodeEditor code = InstructionParser.parse(Listings.STRAIGHT_LINE);
        RecordingConstantPropagation analysis = new RecordingConstantPropagation();
        analysis.analyze(code);

        assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5, 6), analysis.dispatched);

        AbstractState<String, ConstantValue, NoGlobal> expected =
                AbstractState.create(ConstantValue.DOMAIN);
        expected.put("x", ConstantValue.of(1));
        expected.put("y", ConstantValue.of(3));
        assertEquals(expected, analysis.getFinalState());
        assertEquals(Analysis.Direction.FORWARD, analysis.getDirection());
        assertTrue(analysis.isValid());
        assertFalse(analysis.isRunning());
    }

    @Test
    public void testIfElseJoinIsTheMergeOfBothBranches() {
        CodeEditor code = InstructionParser.parse(Listings.IF_ELSE);
        ConstantPropagation analysis = new ConstantPropagation();
        analysis.analyze(code);

        AbstractState<String, ConstantValue, NoGlobal> thenBranch =
                analysis.getStateAfter(4).copy();
        AbstractState<String, ConstantValue, NoGlobal> elseBranch =
                analysis.getStateAfter(7).copy();
        assertEquals(ConstantValue.of(1), thenBranch.get("x"));
        assertEquals(ConstantValue.of(2), elseBranch.get("x"));

        AbstractState<String, ConstantValue, NoGlobal> expected = thenBranch.copy();
        expected.mergeWith(elseBranch);

        AbstractState<String, ConstantValue, NoGlobal> join = analysis.getMergePointState(8);
        assertEquals(expected, join);
        assertEquals(ConstantValue.TOP, join.get("x"));

        // the fixpoint is stable
        assertFalse(join.copy().mergeWith(thenBranch));
        assertFalse(join.copy().mergeWith(elseBranch));

        assertEquals(ConstantValue.TOP, analysis.getFinalState().top());
    }

    @Test
    public void testLoopConverges() {
        CodeEditor code = InstructionParser.parse(Listings.LOOP);
        RecordingConstantPropagation analysis = new RecordingConstantPropagation();
        analysis.analyze(code);

        assertTrue(analysis.timesDispatched(2) >= 2);
        assertEquals(ConstantValue.TOP, analysis.getMergePointState(2).get("i"));
        assertEquals(ConstantValue.TOP, analysis.getFinalState().get("i"));
        assertTrue(analysis.getFinalState().stack().isEmpty());
    }

    @Test
    public void testUnreachedCode() {
        CodeEditor code = InstructionParser.parse(Listings.DEAD_CODE);
        RecordingConstantPropagation analysis = new RecordingConstantPropagation();
        analysis.analyze(code);

        assertEquals(Arrays.asList(0, 1, 2, 5, 6), analysis.dispatched);
        assertFalse(analysis.isReached(3));
        assertFalse(analysis.isReached(4));
        assertTrue(analysis.isReached(5));
        assertNull(analysis.getMergePointState(3));
        assertEquals(ConstantValue.of(7), analysis.getFinalState().get("x"));
    }

    @Test
    public void testNoReachableExit() {
        ConstantPropagation analysis = new ConstantPropagation();
        analysis.analyze(InstructionParser.parse("spin:\nbr spin"));
        assertNull(analysis.getFinalState());
        assertTrue(analysis.isReached(1));
    }

    @Test
    public void testEmptyCode() {
        ConstantPropagation analysis = new ConstantPropagation();
        analysis.analyze(new CodeEditor(Collections.emptyList()));
        assertNull(analysis.getFinalState());
        assertTrue(analysis.isValid());
    }

    @Test(expected = BugInDataflow.class)
    public void testFallingOffTheEnd() {
        new ConstantPropagation().analyze(InstructionParser.parse("push 1\npop"));
    }

    @Test(expected = BugInDataflow.class)
    public void testUnequalStacksAtLabel() {
        new ConstantPropagation()
                .analyze(InstructionParser.parse("ldvar c\nbrtrue l\npush 1\nl:\nret"));
    }

    @Test
    public void testReentrantAnalyze() {
        RecordingConstantPropagation analysis = new RecordingConstantPropagation();
        analysis.reenter = true;
        try {
            analysis.analyze(InstructionParser.parse(Listings.STRAIGHT_LINE));
            fail("expected a BugInDataflow");
        } catch (BugInDataflow e) {
            assertTrue(e.getMessage(), e.getMessage().contains("running"));
        }
        assertFalse(analysis.isRunning());
    }

    @Test
    public void testInvalidateThenRerunMatchesFreshAnalysis() {
        CodeEditor code = InstructionParser.parse(Listings.LOOP);
        ConstantPropagation reused = new ConstantPropagation();
        reused.invalidate();
        reused.analyze(InstructionParser.parse(Listings.IF_ELSE));
        reused.invalidate();
        reused.invalidate();
        assertFalse(reused.isValid());
        assertNull(reused.getFinalState());
        assertNull(reused.getMergePointState(8));

        reused.analyze(code);
        ConstantPropagation fresh = new ConstantPropagation();
        fresh.analyze(code);

        assertEquals(fresh.getFinalState(), reused.getFinalState());
        for (int position = code.begin(); position < code.end(); position++) {
            assertEquals(fresh.getMergePointState(position), reused.getMergePointState(position));
            assertEquals(fresh.isReached(position), reused.isReached(position));
        }
    }

    @Test
    public void testAnalyzeAgainDiscardsPreviousResults() {
        ConstantPropagation analysis = new ConstantPropagation();
        analysis.analyze(InstructionParser.parse(Listings.IF_ELSE));
        analysis.analyze(InstructionParser.parse(Listings.STRAIGHT_LINE));
        assertNull(analysis.getMergePointState(8));
        assertEquals(ConstantValue.of(3), analysis.getFinalState().get("y"));
    }
}
