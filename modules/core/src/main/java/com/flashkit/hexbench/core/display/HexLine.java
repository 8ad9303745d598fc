package com.flashkit.hexbench.core.display;

import com.flashkit.hexbench.util.HexText;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * One display row: the bytes starting at {@code offset} and which of them are modified.
 */
public record HexLine(long offset, byte[] bytes, BitSet modified) {

    public HexLine {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        bytes = Arrays.copyOf(bytes, bytes.length);
        modified = modified != null ? (BitSet) modified.clone() : new BitSet();
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public BitSet modified() {
        return (BitSet) modified.clone();
    }

    public int length() {
        return bytes.length;
    }

    public boolean isModified(int column) {
        return modified.get(column);
    }

    /**
     * Offset as eight upper-case hex digits, no prefix.
     */
    public String offsetText() {
        return String.format("%08X", offset);
    }

    /**
     * Each byte as {@code "XX "}, padded with spaces up to {@code columns} bytes.
     */
    public String hexText(int columns) {
        StringBuilder sb = new StringBuilder(columns * 3);
        for (int i = 0; i < columns; i++) {
            sb.append(i < bytes.length ? HexText.toHex(bytes[i]) + " " : "   ");
        }
        return sb.toString();
    }

    /**
     * Printable ASCII as itself, everything else as {@code '.'}.
     */
    public String asciiText() {
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            sb.append(b >= 0x20 && b <= 0x7E ? (char) b : '.');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HexLine other)) return false;
        return offset == other.offset && Arrays.equals(bytes, other.bytes) && modified.equals(other.modified);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(offset) * 31 + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return offsetText() + "  " + hexText(bytes.length) + " " + asciiText();
    }
}
