package io.github.manjago.mepa.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of a {@link ProgramImage} prepared for execution.
 * <p>
 * Holds the ascending line sequence (the program counter indexes into it), the
 * parsed instruction of every line, the line-number index and the label table.
 * If several lines declare the same label, the one with the greatest line number
 * wins.
 */
public final class LoadedProgram {

    private static final Logger log = LoggerFactory.getLogger(LoadedProgram.class);

    /** Jump targets that count as line numbers: digits with an optional minus sign */
    private static final Pattern LINE_NUMBER = Pattern.compile("-?\\d+");

    public static final LoadedProgram EMPTY = new LoadedProgram(new int[0], List.of(), List.of());

    private final int[] lineNumbers;
    private final List<String> texts;
    private final List<Instruction> instructions;
    private final Map<Integer, Integer> indexByLine = new HashMap<>();
    private final Map<String, Integer> labels = new HashMap<>();

    private LoadedProgram(int[] lineNumbers, List<String> texts, List<Instruction> instructions) {
        this.lineNumbers = lineNumbers;
        this.texts = texts;
        this.instructions = instructions;

        for (int i = 0; i < lineNumbers.length; i++) {
            indexByLine.put(lineNumbers[i], i);
            Instruction insn = instructions.get(i);
            if (insn.hasLabel()) {
                Integer previous = labels.put(insn.label(), lineNumbers[i]);
                if (previous != null) {
                    log.debug("Label '{}' redeclared at line {} (was line {})",
                            insn.label(), lineNumbers[i], previous);
                }
            }
        }
    }

    /**
     * Parse every line of the image.
     */
    public static @NotNull LoadedProgram of(@NotNull ProgramImage image) {
        List<ProgramImage.Line> lines = image.sortedLines();
        int[] numbers = new int[lines.size()];
        String[] texts = new String[lines.size()];
        Instruction[] parsed = new Instruction[lines.size()];

        for (int i = 0; i < lines.size(); i++) {
            ProgramImage.Line line = lines.get(i);
            numbers[i] = line.number();
            texts[i] = line.text();
            parsed[i] = InstructionParser.parse(line.text());
        }
        return new LoadedProgram(numbers, List.of(texts), List.of(parsed));
    }

    // ========== Line sequence ==========

    public int size() {
        return lineNumbers.length;
    }

    public boolean isEmpty() {
        return lineNumbers.length == 0;
    }

    public int lineAt(int index) {
        return lineNumbers[index];
    }

    public @NotNull String textAt(int index) {
        return texts.get(index);
    }

    public @NotNull Instruction instructionAt(int index) {
        return instructions.get(index);
    }

    /**
     * @return index of the line in the sequence, or -1 if the line does not exist
     */
    public int indexOfLine(int lineNumber) {
        Integer index = indexByLine.get(lineNumber);
        return index != null ? index : -1;
    }

    /**
     * Index where execution starts: the first INPP line, else the first line.
     *
     * @return start index, or -1 if the program is empty
     */
    public int startIndex() {
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i).opCode() == OpCode.INPP) {
                return i;
            }
        }
        return isEmpty() ? -1 : 0;
    }

    // ========== Labels ==========

    /**
     * @return line number bearing the label, or null if undeclared
     */
    public @Nullable Integer labelLine(@NotNull String label) {
        return labels.get(label);
    }

    public @NotNull Map<String, Integer> labels() {
        return Map.copyOf(labels);
    }

    /**
     * Resolve a jump target. The token is tried as a line number first, then as a label.
     *
     * @return index of the target line, or -1 if neither resolves
     */
    public int resolveTarget(@NotNull String target) {
        Integer number = parseLineNumber(target);
        if (number != null && indexByLine.containsKey(number)) {
            return indexByLine.get(number);
        }
        Integer line = labels.get(target);
        return line != null ? indexOfLine(line) : -1;
    }

    private static @Nullable Integer parseLineNumber(String token) {
        if (!LINE_NUMBER.matcher(token).matches()) {
            return null;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
