package org.fixflow.dataflow.code;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.fixflow.dataflow.util.UserError;

/**
 * Reads textual listings of stack-machine code.
 *
 * <p>The syntax is line based. Everything after a {@code #} is a comment. A line of the form
 * {@code name:} is a label. Any other non-empty line is a mnemonic followed by its operands,
 * separated by whitespace:
 *
 * <pre>
 *     push 1
 *     stvar x
 * loop:
 *     ldvar x
 *     brfalse done
 *     call print 1
 *     br loop
 * done:
 *     ret
 * </pre>
 */
public class InstructionParser {

    private InstructionParser() {}

    /**
     * Parses a listing read from a file.
     *
     * @param file the listing
     * @return the code
     * @throws IOException if the file cannot be read
     * @throws UserError if the listing is malformed
     */
    public static CodeEditor parse(Path file) throws IOException {
        return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    /**
     * Parses a listing.
     *
     * @param source the listing
     * @return the code
     * @throws UserError if the listing is malformed
     */
    public static CodeEditor parse(String source) {
        return new CodeEditor(parseInstructions(source));
    }

    /**
     * Parses a listing into instructions without checking labels and jump targets.
     *
     * @param source the listing
     * @return the instructions in order
     * @throws UserError if a line is malformed
     */
    public static List<Instruction> parseInstructions(String source) {
        List<Instruction> result = new ArrayList<>();
        String[] lines = source.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            result.add(parseLine(line, i + 1));
        }
        return result;
    }

    private static Instruction parseLine(String line, int lineNumber) {
        if (line.endsWith(":")) {
            String name = line.substring(0, line.length() - 1).trim();
            if (!isName(name)) {
                throw error(lineNumber, "invalid label name '%s'", name);
            }
            return Instruction.label(name);
        }

        String[] words = line.split("\\s+");
        Opcode opcode = Opcode.fromMnemonic(words[0]);
        if (opcode == null || opcode == Opcode.LABEL) {
            throw error(lineNumber, "unknown instruction '%s'", words[0]);
        }
        List<String> operands = Arrays.asList(words).subList(1, words.length);

        switch (opcode.getOperands()) {
            case NONE:
                expectOperands(operands, 0, opcode, lineNumber);
                return Instruction.of(opcode);
            case INT:
                expectOperands(operands, 1, opcode, lineNumber);
                return Instruction.push(parseInt(operands.get(0), lineNumber));
            case NAME:
                expectOperands(operands, 1, opcode, lineNumber);
                String variable = checkName(operands.get(0), lineNumber);
                return opcode == Opcode.LDVAR
                        ? Instruction.ldvar(variable)
                        : Instruction.stvar(variable);
            case NAME_INT:
                expectOperands(operands, 2, opcode, lineNumber);
                int argumentCount = parseInt(operands.get(1), lineNumber);
                if (argumentCount < 0) {
                    throw error(lineNumber, "negative argument count %d", argumentCount);
                }
                return Instruction.call(checkName(operands.get(0), lineNumber), argumentCount);
            case LABEL:
                expectOperands(operands, 1, opcode, lineNumber);
                return Instruction.jump(opcode, checkName(operands.get(0), lineNumber));
            case LABELS:
                if (operands.isEmpty()) {
                    throw error(lineNumber, "%s needs at least one target", opcode.getMnemonic());
                }
                String[] targets = new String[operands.size()];
                for (int i = 0; i < targets.length; i++) {
                    targets[i] = checkName(operands.get(i), lineNumber);
                }
                return Instruction.jump(opcode, targets);
            default:
                throw error(lineNumber, "unsupported operands %s", opcode.getOperands());
        }
    }

    private static void expectOperands(
            List<String> operands, int expected, Opcode opcode, int lineNumber) {
        if (operands.size() != expected) {
            throw error(
                    lineNumber,
                    "%s takes %d operand(s), found %d",
                    opcode.getMnemonic(),
                    expected,
                    operands.size());
        }
    }

    private static int parseInt(String word, int lineNumber) {
        try {
            return Integer.parseInt(word);
        } catch (NumberFormatException e) {
            throw error(lineNumber, "'%s' is not an integer", word);
        }
    }

    private static String checkName(String word, int lineNumber) {
        if (!isName(word)) {
            throw error(lineNumber, "invalid name '%s'", word);
        }
        return word;
    }

    private static boolean isName(String word) {
        if (word.isEmpty() || !Character.isJavaIdentifierStart(word.charAt(0))) {
            return false;
        }
        for (int i = 1; i < word.length(); i++) {
            if (!Character.isJavaIdentifierPart(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static UserError error(int lineNumber, String fmt, Object... args) {
        return new UserError("line " + lineNumber + ": " + String.format(fmt, args));
    }
}
