package io.github.manjago.mepa.core;

/**
 * Execution mode of the machine.
 */
public enum MachineMode {

    /** No execution in progress. */
    IDLE,

    /** Run to completion in progress. */
    RUNNING,

    /** Single-step session waiting for the next step. */
    DEBUG_PAUSED,

    /** PARA reached or program counter ran past the last line. */
    HALTED;

    /**
     * @return true if instructions can still be executed in this mode
     */
    public boolean isActive() {
        return this == RUNNING || this == DEBUG_PAUSED;
    }
}
