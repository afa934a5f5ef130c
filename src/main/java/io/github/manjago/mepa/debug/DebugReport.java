package io.github.manjago.mepa.debug;

import io.github.manjago.mepa.core.StepResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * What a debug start or step produced.
 *
 * @param state       session state after the call
 * @param pendingLine line about to execute, or -1 when halted
 * @param pendingText raw text of the pending line, or null when halted
 * @param outputs     values printed by the step that was just executed
 * @param haltReason  why the program stopped, or null while paused
 */
public record DebugReport(
    @NotNull DebugState state,
    int pendingLine,
    @Nullable String pendingText,
    @NotNull List<Long> outputs,
    @Nullable StepResult.HaltReason haltReason
) {

    public DebugReport {
        outputs = List.copyOf(outputs);
    }

    static DebugReport paused(int line, String text, List<Long> outputs) {
        return new DebugReport(DebugState.PAUSED, line, text, outputs, null);
    }

    static DebugReport halted(StepResult.HaltReason reason, List<Long> outputs) {
        return new DebugReport(DebugState.HALTED, -1, null, outputs, reason);
    }

    public boolean isHalted() {
        return state == DebugState.HALTED;
    }
}
