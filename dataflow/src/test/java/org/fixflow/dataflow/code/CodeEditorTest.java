package org.fixflow.dataflow.code;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import org.fixflow.dataflow.util.BugInDataflow;
import org.fixflow.dataflow.util.UserError;
import org.junit.Test;

public class CodeEditorTest {

    private static final String LOOP =
            String.join(
                    "\n",
                    "push 0", // 0
                    "stvar i", // 1
                    "loop:", // 2
                    "ldvar i", // 3
                    "brfalse done", // 4
                    "switch loop done", // 5
                    "br loop", // 6
                    "done:", // 7
                    "ret"); // 8

    @Test
    public void testClassification() {
        CodeEditor code = InstructionParser.parse(LOOP);
        assertEquals(9, code.size());
        assertEquals(0, code.begin());
        assertEquals(9, code.end());

        assertTrue(code.isLabel(2));
        assertFalse(code.isLabel(3));
        assertTrue(code.isJump(4));
        assertFalse(code.isUnconditionalJump(4));
        assertTrue(code.isJump(6));
        assertTrue(code.isUnconditionalJump(6));
        assertTrue(code.isExitPoint(8));
        assertFalse(code.isExitPoint(6));
        assertTrue(code.isEntryPoint(0));
        assertFalse(code.isEntryPoint(2));
    }

    @Test
    public void testTargetsAndSuccessors() {
        CodeEditor code = InstructionParser.parse(LOOP);
        assertEquals(Collections.singletonList(7), code.targets(4));
        assertEquals(Arrays.asList(2, 7), code.targets(5));
        assertEquals(2, code.positionOf("loop"));

        assertEquals(new LinkedHashSet<>(Arrays.asList(2)), code.successors(1));
        assertEquals(new LinkedHashSet<>(Arrays.asList(5, 7)), code.successors(4));
        assertEquals(new LinkedHashSet<>(Arrays.asList(6, 2, 7)), code.successors(5));
        assertEquals(Collections.singleton(2), code.successors(6));
        assertTrue(code.successors(8).isEmpty());
    }

    @Test(expected = BugInDataflow.class)
    public void testTargetsOfNonJump() {
        InstructionParser.parse(LOOP).targets(3);
    }

    @Test(expected = BugInDataflow.class)
    public void testPositionOutOfRange() {
        InstructionParser.parse(LOOP).get(9);
    }

    @Test(expected = UserError.class)
    public void testDuplicateLabel() {
        new CodeEditor(
                Arrays.asList(Instruction.label("a"), Instruction.label("a"), Instruction.ret()));
    }

    @Test(expected = UserError.class)
    public void testUndefinedLabel() {
        new CodeEditor(Arrays.asList(Instruction.br("nowhere"), Instruction.ret()));
    }

    @Test(expected = UserError.class)
    public void testPositionOfUndefinedLabel() {
        InstructionParser.parse(LOOP).positionOf("nowhere");
    }

    @Test
    public void testCursorNavigation() {
        CodeEditor code = InstructionParser.parse(LOOP);
        CodeEditor.Cursor cursor = code.cursor();
        assertSame(code, cursor.editor());
        assertEquals(0, cursor.position());
        assertEquals(Instruction.push(0), cursor.instruction());

        cursor.advance().advance();
        assertEquals(Instruction.label("loop"), cursor.instruction());
        cursor.retreat();
        assertEquals(1, cursor.position());
        cursor.moveTo(9);
        assertTrue(cursor.isAtEnd());
    }

    @Test(expected = BugInDataflow.class)
    public void testCursorBeforeBegin() {
        InstructionParser.parse(LOOP).cursor().retreat();
    }

    @Test
    public void testCursorEditsShiftLabels() {
        CodeEditor code = InstructionParser.parse(LOOP);
        CodeEditor.Cursor cursor = code.cursorAt(2);
        cursor.insert(Instruction.of(Opcode.NOP));

        assertEquals(3, cursor.position());
        assertEquals(Instruction.label("loop"), cursor.instruction());
        assertEquals(3, code.positionOf("loop"));
        assertEquals(Arrays.asList(3, 8), code.targets(6));

        code.cursorAt(2).remove();
        assertEquals(2, code.positionOf("loop"));
        assertEquals(InstructionParser.parse(LOOP).instructions(), code.instructions());
    }

    @Test
    public void testListingRoundTrip() {
        CodeEditor code = InstructionParser.parse(LOOP);
        assertEquals(code.instructions(), InstructionParser.parse(code.toString()).instructions());
    }

    @Test
    public void testEditsAreCounted() {
        CodeEditor code = InstructionParser.parse(LOOP);
        assertEquals(0, code.editCount());
        code.cursor().advance();
        code.get(3);
        assertEquals(0, code.editCount());

        CodeEditor.Cursor cursor = code.cursorAt(3);
        cursor.insert(Instruction.of(Opcode.NOP));
        assertEquals(1, code.editCount());
        cursor.retreat().remove();
        assertEquals(2, code.editCount());
    }
}
