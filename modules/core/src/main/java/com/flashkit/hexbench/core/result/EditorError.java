package com.flashkit.hexbench.core.result;

import com.flashkit.hexbench.types.ErrorKind;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Failure reported by an editor operation: a taxonomy kind plus a message
 * fit for the status bar.
 */
public record EditorError(ErrorKind kind, String message) {

    public EditorError {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    public static EditorError of(ErrorKind kind, String message) {
        return new EditorError(kind, message);
    }

    /**
     * Maps an I/O exception on {@code path} to FILE_NOT_FOUND or IO_FAILURE.
     */
    public static EditorError fromIo(String action, Path path, IOException e) {
        if (e instanceof NoSuchFileException) {
            return new EditorError(ErrorKind.FILE_NOT_FOUND, "File not found: " + path);
        }
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new EditorError(ErrorKind.IO_FAILURE, "Error " + action + " " + path + ": " + detail);
    }

    @Override
    public String toString() {
        return kind.label() + ": " + message;
    }
}
