package io.github.manjago.mepa.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of a run to completion.
 *
 * @param status      how the run ended
 * @param steps       instructions executed
 * @param outputCount values printed by IMPR over the whole run
 * @param outputs     the last printed values, at most {@link #OUTPUT_HISTORY}, oldest first
 * @param lastLine    line of the last executed instruction
 */
public record RunReport(
    @NotNull Status status,
    long steps,
    long outputCount,
    @NotNull List<Long> outputs,
    int lastLine
) {

    /** Printed values kept in a report. */
    public static final int OUTPUT_HISTORY = 1000;

    public RunReport {
        outputs = List.copyOf(outputs);
    }

    public enum Status {

        /** PARA executed. */
        HALTED,

        /** Program counter ran past the last line. */
        END_OF_PROGRAM,

        /** The configured step budget was used up. */
        STEP_LIMIT;

        static Status from(StepResult.HaltReason reason) {
            return switch (reason) {
                case PARA -> HALTED;
                case END_OF_PROGRAM -> END_OF_PROGRAM;
            };
        }
    }

    /**
     * @return true if the program stopped on its own
     */
    public boolean completed() {
        return status != Status.STEP_LIMIT;
    }
}
