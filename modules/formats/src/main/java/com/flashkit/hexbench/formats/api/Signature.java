package com.flashkit.hexbench.formats.api;

import com.flashkit.hexbench.util.buffer.BinaryData;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Magic bytes identifying a format or an embedded structure.
 *
 * @param name       Display name (e.g., "GPT Header")
 * @param magicBytes Bytes to match
 */
public record Signature(
        String name,
        byte[] magicBytes
) {
    public Signature {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(magicBytes, "magicBytes cannot be null");
        if (magicBytes.length == 0) {
            throw new IllegalArgumentException("Signature '" + name + "' has no magic bytes");
        }
        magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
    }

    public static Signature of(String name, int... magic) {
        byte[] bytes = new byte[magic.length];
        for (int i = 0; i < magic.length; i++) {
            bytes[i] = (byte) magic[i];
        }
        return new Signature(name, bytes);
    }

    public static Signature ascii(String name, String magic) {
        return new Signature(name, magic.getBytes(StandardCharsets.US_ASCII));
    }

    public int length() {
        return magicBytes.length;
    }

    @Override
    public byte[] magicBytes() {
        return Arrays.copyOf(magicBytes, magicBytes.length);
    }

    /**
     * Checks whether the magic occurs at {@code position}.
     * A magic that would run past the end of the data never matches.
     */
    public boolean matches(BinaryData data, long position) {
        return data.matchesAt(position, magicBytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Signature other)) return false;
        return name.equals(other.name) && Arrays.equals(magicBytes, other.magicBytes);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(magicBytes);
    }

    @Override
    public String toString() {
        return name;
    }
}
