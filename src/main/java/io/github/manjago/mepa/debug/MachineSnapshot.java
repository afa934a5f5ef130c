package io.github.manjago.mepa.debug;

import io.github.manjago.mepa.core.MachineMode;
import io.github.manjago.mepa.core.MachineState;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Copy of the stack and memory at one point of execution.
 *
 * @param mode        machine mode when taken
 * @param currentLine line the program counter points at, or -1
 * @param memory      memory cells, address 0 first
 * @param stack       stack entries, bottom first
 */
public record MachineSnapshot(
    @NotNull MachineMode mode,
    int currentLine,
    @NotNull List<Long> memory,
    @NotNull List<Long> stack
) {

    public MachineSnapshot {
        memory = List.copyOf(memory);
        stack = List.copyOf(stack);
    }

    public static MachineSnapshot of(@NotNull MachineState state, int currentLine) {
        return new MachineSnapshot(state.getMode(), currentLine, state.getMemory(), state.getStack());
    }

    public boolean isEmpty() {
        return memory.isEmpty() && stack.isEmpty();
    }

    /**
     * @return top of stack, if any
     */
    public @Nullable Long top() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }
}
