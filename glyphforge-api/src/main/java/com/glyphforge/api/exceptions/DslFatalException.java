package com.glyphforge.api.exceptions;

/**
 * Raised while interpreting pattern source when evaluation cannot continue:
 * an unknown command, a {@code snare} directive, or a failed {@code trap}
 * when traps are configured to be fatal.
 *
 * <p>Aborts the current pattern source only.
 */
public class DslFatalException extends RuntimeException {

    private final int line;

    public DslFatalException(String message, int line) {
        super(message + " at line " + line);
        this.line = line;
    }

    public DslFatalException(String message, int line, Throwable cause) {
        super(message + " at line " + line, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
