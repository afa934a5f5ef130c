package io.github.manjago.mepa.core;

import org.jetbrains.annotations.NotNull;

/**
 * Terminal execution error, tagged with its kind and the failing line.
 */
public class MepaException extends Exception {

    /** Line number used when the error is not tied to a program line. */
    public static final int NO_LINE = -1;

    private final ErrorKind kind;
    private final int lineNumber;

    public MepaException(@NotNull ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.lineNumber = NO_LINE;
    }

    public MepaException(@NotNull ErrorKind kind, int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return failing line number, or {@link #NO_LINE}
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
