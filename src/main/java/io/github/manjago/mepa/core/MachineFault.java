package io.github.manjago.mepa.core;

/**
 * Raised by instruction handlers; the engine converts it to {@link StepResult.Failed}
 * with the line number attached. Never escapes the core package.
 */
final class MachineFault extends RuntimeException {

    private final ErrorKind kind;

    MachineFault(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    ErrorKind getKind() {
        return kind;
    }
}
