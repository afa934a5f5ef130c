package io.github.manjago.mepa.debug;

import io.github.manjago.mepa.core.MachineMode;
import io.github.manjago.mepa.core.MachineState;
import io.github.manjago.mepa.core.MepaException;
import io.github.manjago.mepa.core.StepResult;
import io.github.manjago.mepa.core.VirtualMachine;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-step execution on top of a {@link VirtualMachine}.
 *
 * <pre>
 * IDLE --start--> PAUSED --step--> PAUSED
 *                   |                 |
 *                   +-----step--------+--> HALTED   (PARA or end of program)
 * PAUSED/HALTED --stop--> IDLE
 * </pre>
 *
 * A failing step ends the session (IDLE) and rethrows the error. Starting a
 * new session, or a run on the same engine, discards the current one.
 */
public final class DebugController {

    private static final Logger log = LoggerFactory.getLogger(DebugController.class);

    private final VirtualMachine vm;

    private DebugState state = DebugState.IDLE;

    /** Machine state owned by the current session, null when idle */
    private MachineState session;

    /** Values printed by the step in progress */
    private final List<Long> printed = new ArrayList<>();

    public DebugController(@NotNull VirtualMachine vm) {
        this.vm = vm;
        vm.addOutputListener((line, value) -> {
            if (vm.getState() == session) {
                printed.add(value);
            }
        });
    }

    /**
     * Reset the machine and pause before the first instruction.
     *
     * @return report naming the instruction about to execute
     * @throws MepaException EMPTY_PROGRAM if there is nothing to execute
     */
    public DebugReport start() throws MepaException {
        state = DebugState.IDLE;
        session = null;
        vm.reset(MachineMode.DEBUG_PAUSED);
        session = vm.getState();
        state = DebugState.PAUSED;
        log.debug("Debug session started at line {}", vm.currentLine());
        return DebugReport.paused(vm.currentLine(), vm.currentText(), List.of());
    }

    /**
     * Execute exactly one instruction.
     *
     * @return next pending instruction, or completion
     * @throws MepaException if the instruction fails; the session is over
     * @throws IllegalStateException if no session is paused
     */
    public DebugReport step() throws MepaException {
        if (getState() != DebugState.PAUSED) {
            throw new IllegalStateException("Not in debug mode");
        }

        printed.clear();
        StepResult result = vm.step();
        List<Long> outputs = List.copyOf(printed);
        printed.clear();

        if (result instanceof StepResult.Failed failed) {
            state = DebugState.IDLE;
            session = null;
            throw failed.error();
        }

        if (result instanceof StepResult.Halted halted) {
            state = DebugState.HALTED;
            log.debug("Debug session finished: {}", halted.reason());
            return DebugReport.halted(halted.reason(), outputs);
        }
        return DebugReport.paused(vm.currentLine(), vm.currentText(), outputs);
    }

    /**
     * End the session and discard the machine state.
     *
     * @throws IllegalStateException if no session is active
     */
    public void stop() {
        if (getState() == DebugState.IDLE) {
            throw new IllegalStateException("Not in debug mode");
        }
        state = DebugState.IDLE;
        session = null;
        vm.discard();
        log.debug("Debug session stopped");
    }

    /**
     * Copy the stack and memory of the current session.
     *
     * @throws IllegalStateException if no session is active
     */
    public MachineSnapshot inspect() {
        if (getState() == DebugState.IDLE) {
            throw new IllegalStateException("Stack inspection is only available in debug mode");
        }
        return MachineSnapshot.of(vm.getState(), vm.currentLine());
    }

    /**
     * Current session state. A session whose machine was replaced by someone
     * else (a run on the same engine) reads as IDLE.
     */
    public DebugState getState() {
        if (state != DebugState.IDLE && vm.getState() != session) {
            state = DebugState.IDLE;
            session = null;
        }
        return state;
    }

    public boolean isActive() {
        return getState() != DebugState.IDLE;
    }
}
