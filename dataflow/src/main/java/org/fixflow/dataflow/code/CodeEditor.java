package org.fixflow.dataflow.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.fixflow.dataflow.util.BugInDataflow;
import org.fixflow.dataflow.util.UserError;

/**
 * An editable list of instructions, navigable as a {@link CodeSequence}.
 *
 * <p>Label names are resolved to positions lazily, after every edit. Editing the code through a
 * {@link Cursor} shifts the positions behind the edit, so analyses must be rerun afterwards.
 */
public class CodeEditor implements CodeSequence {

    /** The instructions. */
    private final List<Instruction> instructions;

    /** Label name to position, or {@code null} if it must be rebuilt. */
    private @Nullable Map<String, Integer> labels;

    /** Number of edits made through cursors. */
    private int editCount;

    /**
     * Creates an editor over the given instructions and checks that labels are unique and that
     * every jump target exists.
     *
     * @param instructions the code
     */
    public CodeEditor(List<Instruction> instructions) {
        this.instructions = new ArrayList<>(instructions);
        this.labels = null;
        verify();
    }

    /**
     * Checks that labels are unique and that every jump target names an existing label.
     *
     * @throws UserError if a label is defined twice or a jump target is undefined
     */
    public void verify() {
        labels();
        for (int p = 0; p < instructions.size(); p++) {
            for (String target : instructions.get(p).getTargets()) {
                resolve(target, p);
            }
        }
    }

    private Map<String, Integer> labels() {
        Map<String, Integer> result = labels;
        if (result == null) {
            result = new HashMap<>();
            for (int p = 0; p < instructions.size(); p++) {
                Instruction insn = instructions.get(p);
                if (insn.getOpcode() == Opcode.LABEL) {
                    Integer previous = result.put(insn.getName(), p);
                    if (previous != null) {
                        throw new UserError(
                                "label %s defined twice, at %d and %d",
                                insn.getName(), previous, p);
                    }
                }
            }
            labels = result;
        }
        return result;
    }

    private int resolve(String label, int from) {
        Integer position = labels().get(label);
        if (position == null) {
            throw new UserError("jump at %d to undefined label %s", from, label);
        }
        return position;
    }

    /**
     * @param label a label name
     * @return the position of the label
     * @throws UserError if there is no such label
     */
    public int positionOf(String label) {
        Integer position = labels().get(label);
        if (position == null) {
            throw new UserError("undefined label %s", label);
        }
        return position;
    }

    /** @return the instructions, as an unmodifiable view */
    public List<Instruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    /** @return a cursor at the first instruction */
    public Cursor cursor() {
        return new Cursor(begin());
    }

    /**
     * @param position a position between {@link #begin()} and {@link #end()}, inclusive
     * @return a cursor at {@code position}
     */
    public Cursor cursorAt(int position) {
        checkCursorPosition(position);
        return new Cursor(position);
    }

    @Override
    public int editCount() {
        return editCount;
    }

    @Override
    public int size() {
        return instructions.size();
    }

    @Override
    public Instruction get(int position) {
        checkPosition(position);
        return instructions.get(position);
    }

    @Override
    public boolean isLabel(int position) {
        return get(position).getOpcode().getFlow() == Opcode.Flow.LABEL;
    }

    @Override
    public boolean isJump(int position) {
        return get(position).getOpcode().isJump();
    }

    @Override
    public boolean isUnconditionalJump(int position) {
        return get(position).getOpcode().getFlow() == Opcode.Flow.UNCONDITIONAL_JUMP;
    }

    @Override
    public boolean isExitPoint(int position) {
        return get(position).getOpcode().getFlow() == Opcode.Flow.EXIT;
    }

    @Override
    public boolean isEntryPoint(int position) {
        checkPosition(position);
        return position == begin();
    }

    @Override
    public List<Integer> targets(int position) {
        Instruction insn = get(position);
        if (!insn.getOpcode().isJump()) {
            throw new BugInDataflow("CodeEditor::targets() %s at %d is not a jump", insn, position);
        }
        List<Integer> result = new ArrayList<>(insn.getTargets().size());
        for (String label : insn.getTargets()) {
            result.add(resolve(label, position));
        }
        return result;
    }

    @Override
    public Set<Integer> successors(int position) {
        Instruction insn = get(position);
        Set<Integer> result = new LinkedHashSet<>();
        switch (insn.getOpcode().getFlow()) {
            case PLAIN:
            case LABEL:
                if (position + 1 < end()) {
                    result.add(position + 1);
                }
                break;
            case JUMP:
                if (position + 1 < end()) {
                    result.add(position + 1);
                }
                result.addAll(targets(position));
                break;
            case UNCONDITIONAL_JUMP:
                result.addAll(targets(position));
                break;
            case EXIT:
                break;
            default:
                throw new BugInDataflow(
                        "CodeEditor::successors() unexpected flow: " + insn.getOpcode().getFlow());
        }
        return result;
    }

    private void checkPosition(int position) {
        if (position < begin() || position >= end()) {
            throw new BugInDataflow(
                    "CodeEditor: position %d outside of [%d, %d)", position, begin(), end());
        }
    }

    private void checkCursorPosition(int position) {
        if (position < begin() || position > end()) {
            throw new BugInDataflow(
                    "CodeEditor: cursor position %d outside of [%d, %d]", position, begin(), end());
        }
    }

    /** Prints the code as a listing, one instruction per line. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Instruction insn : instructions) {
            sb.append(insn).append('\n');
        }
        return sb.toString();
    }

    /**
     * A cursor into the code. It can point at any instruction or one past the last one, and
     * edits the code at its position.
     */
    public final class Cursor {

        private int position;

        private Cursor(int position) {
            this.position = position;
        }

        /** @return the editor this cursor belongs to */
        public CodeEditor editor() {
            return CodeEditor.this;
        }

        /** @return the position of the cursor */
        public int position() {
            return position;
        }

        /** @return true if the cursor is past the last instruction */
        public boolean isAtEnd() {
            return position == end();
        }

        /** @return the instruction under the cursor */
        public Instruction instruction() {
            return get(position);
        }

        /** Moves to the next instruction. */
        public Cursor advance() {
            checkCursorPosition(position + 1);
            position++;
            return this;
        }

        /** Moves to the previous instruction. */
        public Cursor retreat() {
            checkCursorPosition(position - 1);
            position--;
            return this;
        }

        public Cursor moveTo(int newPosition) {
            checkCursorPosition(newPosition);
            position = newPosition;
            return this;
        }

        /**
         * Inserts an instruction before the cursor. The cursor keeps pointing at the same
         * instruction as before, which is now one position further.
         *
         * @param insn the instruction to insert
         */
        public Cursor insert(Instruction insn) {
            instructions.add(position, insn);
            labels = null;
            editCount++;
            position++;
            return this;
        }

        /**
         * Removes the instruction under the cursor. The cursor then points at the instruction
         * that followed it.
         *
         * @return the removed instruction
         */
        public Instruction remove() {
            checkPosition(position);
            labels = null;
            editCount++;
            return instructions.remove(position);
        }

        @Override
        public String toString() {
            return "Cursor(" + position + ")";
        }
    }
}
