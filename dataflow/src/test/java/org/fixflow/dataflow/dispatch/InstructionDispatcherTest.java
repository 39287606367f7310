package org.fixflow.dataflow.dispatch;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.fixflow.dataflow.code.CodeEditor;
import org.fixflow.dataflow.code.Instruction;
import org.fixflow.dataflow.code.InstructionParser;
import org.junit.Test;

public class InstructionDispatcherTest {

    private static final String ALL_OPCODES =
            String.join(
                    "\n",
                    "start:",
                    "nop",
                    "push 1",
                    "ldvar x",
                    "stvar x",
                    "pop",
                    "dup",
                    "swap",
                    "add",
                    "sub",
                    "mul",
                    "lt",
                    "eq",
                    "not",
                    "call f 2",
                    "brtrue start",
                    "brfalse start",
                    "switch start end",
                    "br end",
                    "end:",
                    "ret");

    /** Records which handler got each instruction. */
    private static class Recorder extends AbstractInstructionVisitor {
        final List<String> calls = new ArrayList<>();

        @Override
        public boolean visitInstruction(Instruction insn, int position) {
            calls.add("other " + position);
            return true;
        }

        @Override
        public boolean visitLabel(Instruction insn, int position) {
            calls.add("label " + insn.getName());
            return true;
        }

        @Override
        public boolean visitPush(Instruction insn, int position) {
            calls.add("push " + insn.getConstant());
            return true;
        }

        @Override
        public boolean visitCall(Instruction insn, int position) {
            calls.add("call " + insn.getName() + " " + insn.getArgumentCount());
            return true;
        }

        @Override
        public boolean visitSwitch(Instruction insn, int position) {
            calls.add("switch " + insn.getTargets());
            return true;
        }

        @Override
        public boolean visitRet(Instruction insn, int position) {
            calls.add("ret");
            return true;
        }

        @Override
        public boolean visitNop(Instruction insn, int position) {
            calls.add("nop");
            return false;
        }
    }

    @Test
    public void testEveryOpcodeIsDispatched() {
        CodeEditor code = InstructionParser.parse(ALL_OPCODES);
        InstructionDispatcher dispatcher =
                new InstructionDispatcher(new AbstractInstructionVisitor() {});
        for (int position = code.begin(); position < code.end(); position++) {
            assertTrue(code.get(position).toString(), dispatcher.dispatch(code, position));
        }
    }

    @Test
    public void testHandlersReceiveTheirInstructions() {
        CodeEditor code = InstructionParser.parse(ALL_OPCODES);
        Recorder recorder = new Recorder();
        InstructionDispatcher dispatcher = new InstructionDispatcher(recorder);
        assertSame(recorder, dispatcher.getReceiver());

        assertTrue(dispatcher.dispatch(code, 0));
        assertTrue(dispatcher.dispatch(code, 2));
        assertTrue(dispatcher.dispatch(code, 3));
        assertTrue(dispatcher.dispatch(code, 14));
        assertTrue(dispatcher.dispatch(code, 17));
        assertTrue(dispatcher.dispatch(code, 20));

        assertEquals(
                Arrays.asList(
                        "label start",
                        "push 1",
                        "other 3",
                        "call f 2",
                        "switch [start, end]",
                        "ret"),
                recorder.calls);
    }

    @Test
    public void testDeclinedInstruction() {
        CodeEditor code = InstructionParser.parse(ALL_OPCODES);
        Recorder recorder = new Recorder();
        InstructionDispatcher dispatcher = new InstructionDispatcher(recorder);

        assertFalse(dispatcher.dispatch(code, 1));
        assertEquals(Arrays.asList("nop"), recorder.calls);
        assertTrue(dispatcher.dispatch(code, 2));
    }
}
