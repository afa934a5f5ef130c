package io.github.manjago.mepa.core;

import org.jetbrains.annotations.NotNull;

/**
 * Result of executing a single instruction.
 */
public sealed interface StepResult {

    /** Line number of the instruction that was executed (or attempted). */
    int line();

    /** Instruction executed, program counter moved to the next line. */
    record Continue(int line) implements StepResult {}

    /** Jump taken, program counter moved to {@code targetLine}. */
    record Jumped(int line, int targetLine) implements StepResult {}

    /** Execution is over. Further steps are not possible. */
    record Halted(int line, @NotNull HaltReason reason) implements StepResult {}

    /** Instruction failed. The run is aborted and its state discarded. */
    record Failed(int line, @NotNull MepaException error) implements StepResult {}

    /**
     * Why a program stopped.
     */
    enum HaltReason {

        /** PARA executed. */
        PARA,

        /** Program counter ran past the last line. */
        END_OF_PROGRAM
    }
}
