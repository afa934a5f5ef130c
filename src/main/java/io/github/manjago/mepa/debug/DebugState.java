package io.github.manjago.mepa.debug;

/**
 * States of a single-step session.
 */
public enum DebugState {

    /** No session. */
    IDLE,

    /** Waiting for the next step. */
    PAUSED,

    /** Program finished; the final state can still be inspected. */
    HALTED
}
