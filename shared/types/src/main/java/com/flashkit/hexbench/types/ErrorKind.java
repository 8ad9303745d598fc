package com.flashkit.hexbench.types;

/**
 * Failure taxonomy shared by every editor operation that can fail.
 */
public enum ErrorKind {
    FILE_NOT_FOUND("file-not-found"),
    IO_FAILURE("io-failure"),
    INVALID_PATTERN("invalid-pattern"),
    OUT_OF_RANGE("out-of-range"),
    DECODE_FAILURE("decode-failure"),
    CANCELLED("cancelled");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
