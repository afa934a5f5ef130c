package io.github.manjago.mepa.core;

/**
 * Cause of a failed run. Every kind is terminal for the current run.
 */
public enum ErrorKind {

    /** An operator needed more stack entries than present. */
    STACK_UNDERFLOW,

    /** CRVL/ARMZ address outside {@code [0, memory length)}. */
    MEMORY_OUT_OF_BOUNDS,

    /** AMEM/DMEM with a negative size, or DMEM larger than the allocated memory. */
    INVALID_ALLOCATION,

    /** Wrong argument count, or an argument that is not an integer. */
    MALFORMED_ARGUMENTS,

    /** DSVS/DSVF target is neither an existing line nor a declared label. */
    UNRESOLVED_TARGET,

    /** Mnemonic outside the instruction set. */
    UNKNOWN_OPCODE,

    /** DIVI with a zero divisor. */
    DIVISION_BY_ZERO,

    /** Run or debug requested on a program with no lines. */
    EMPTY_PROGRAM
}
