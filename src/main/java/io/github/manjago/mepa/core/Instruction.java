package io.github.manjago.mepa.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One parsed program line: {@code [label:] MNEMONIC [arg ...]}.
 * <p>
 * The mnemonic is kept as written (uppercased) even when it is not part of the
 * instruction set, so the engine can report it. A null mnemonic means the line
 * had no instruction at all (blank or label-only).
 *
 * @param label     label declared on the line, or null
 * @param mnemonic  uppercased mnemonic, or null for an empty line
 * @param arguments raw argument tokens, in order; evaluated only at execution
 */
public record Instruction(@Nullable String label, @Nullable String mnemonic, @NotNull List<String> arguments) {

    public Instruction {
        arguments = List.copyOf(arguments);
    }

    /**
     * @return the decoded opcode, or null if the line is empty or the mnemonic is unknown
     */
    public @Nullable OpCode opCode() {
        return OpCode.fromMnemonic(mnemonic);
    }

    /**
     * @return true if the line carries no instruction
     */
    public boolean isEmpty() {
        return mnemonic == null;
    }

    public boolean hasLabel() {
        return label != null;
    }

    public int argumentCount() {
        return arguments.size();
    }

    public String argument(int index) {
        return arguments.get(index);
    }
}
