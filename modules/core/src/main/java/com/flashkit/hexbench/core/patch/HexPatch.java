package com.flashkit.hexbench.core.patch;

import com.flashkit.hexbench.util.HexText;

import java.util.Arrays;
import java.util.Objects;

/**
 * A byte replacement that only applies when the expected bytes are in place.
 */
public record HexPatch(long offset, byte[] originalBytes, byte[] newBytes, String description) {

    public HexPatch {
        Objects.requireNonNull(originalBytes, "originalBytes cannot be null");
        Objects.requireNonNull(newBytes, "newBytes cannot be null");
        if (offset < 0) {
            throw new IllegalArgumentException("Negative patch offset: " + offset);
        }
        originalBytes = Arrays.copyOf(originalBytes, originalBytes.length);
        newBytes = Arrays.copyOf(newBytes, newBytes.length);
        description = description != null ? description : "";
    }

    @Override
    public byte[] originalBytes() {
        return Arrays.copyOf(originalBytes, originalBytes.length);
    }

    @Override
    public byte[] newBytes() {
        return Arrays.copyOf(newBytes, newBytes.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HexPatch other)) return false;
        return offset == other.offset
                && Arrays.equals(originalBytes, other.originalBytes)
                && Arrays.equals(newBytes, other.newBytes)
                && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(offset, description);
        result = 31 * result + Arrays.hashCode(originalBytes);
        return 31 * result + Arrays.hashCode(newBytes);
    }

    @Override
    public String toString() {
        return "HexPatch[" + HexText.offset(offset) + " " + HexText.toHex(originalBytes)
                + " -> " + HexText.toHex(newBytes) + "]";
    }
}
