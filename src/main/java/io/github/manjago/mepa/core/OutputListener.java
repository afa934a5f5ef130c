package io.github.manjago.mepa.core;

/**
 * Receives values printed by IMPR.
 */
@FunctionalInterface
public interface OutputListener {

    /**
     * Called for every executed IMPR.
     *
     * @param lineNumber line of the IMPR instruction
     * @param value top of stack (not removed)
     */
    void onOutput(int lineNumber, long value);

    /**
     * Listener that discards output. Output is still collected in the run report.
     */
    OutputListener NOOP = (lineNumber, value) -> {};
}
