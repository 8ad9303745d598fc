package com.flashkit.hexbench.core.edit;

import java.util.Arrays;
import java.util.Objects;

/**
 * Reversible overwrite of a contiguous byte range.
 *
 * @param offset  First byte of the range
 * @param oldData Bytes before the edit
 * @param newData Bytes after the edit (same length as oldData)
 * @param kind    Edit kind; only in-place modification exists in the fixed-size model
 */
public record UndoAction(long offset, byte[] oldData, byte[] newData, Kind kind) {

    public enum Kind { MODIFY }

    public UndoAction {
        Objects.requireNonNull(oldData, "oldData cannot be null");
        Objects.requireNonNull(newData, "newData cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        if (oldData.length != newData.length) {
            throw new IllegalArgumentException(
                    "oldData and newData differ in length: " + oldData.length + " vs " + newData.length);
        }
        oldData = Arrays.copyOf(oldData, oldData.length);
        newData = Arrays.copyOf(newData, newData.length);
    }

    public static UndoAction modify(long offset, byte[] oldData, byte[] newData) {
        return new UndoAction(offset, oldData, newData, Kind.MODIFY);
    }

    public int length() {
        return newData.length;
    }

    @Override
    public byte[] oldData() {
        return Arrays.copyOf(oldData, oldData.length);
    }

    @Override
    public byte[] newData() {
        return Arrays.copyOf(newData, newData.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UndoAction other)) return false;
        return offset == other.offset
                && kind == other.kind
                && Arrays.equals(oldData, other.oldData)
                && Arrays.equals(newData, other.newData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, kind) * 31 + Arrays.hashCode(newData);
    }

    @Override
    public String toString() {
        return "UndoAction[" + kind + " @" + offset + " x" + newData.length + "]";
    }
}
