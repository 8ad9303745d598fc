package com.flashkit.hexbench.types;

/**
 * Interpretations offered by the data inspector at a cursor position.
 * {@code width} is the decode window in bytes; STRING reads up to its width.
 */
public enum DataKind {
    INT8(1),
    UINT8(1),
    INT16(2),
    UINT16(2),
    INT32(4),
    UINT32(4),
    INT64(8),
    UINT64(8),
    FLOAT32(4),
    FLOAT64(8),
    STRING(64),
    BINARY(1);

    private final int width;

    DataKind(int width) {
        this.width = width;
    }

    public int width() {
        return width;
    }
}
