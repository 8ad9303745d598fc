package com.flashkit.hexbench.core.result;

/**
 * Unchecked wrapper for failures that cannot be returned as an {@link Outcome},
 * and for callers that unwrap a failed outcome.
 */
public class HexbenchException extends RuntimeException {

    private final EditorError error;

    public HexbenchException(EditorError error) {
        super(error.message());
        this.error = error;
    }

    public HexbenchException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    /**
     * The editor error this exception carries, or null when it wraps a raw cause.
     */
    public EditorError error() {
        return error;
    }
}
