package com.flashkit.hexbench.util.buffer;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length byte array that can be overwritten in place but never resized.
 *
 * The whole file lives on the heap; offsets are longs to match
 * {@link BinaryData} but must stay below {@link Integer#MAX_VALUE}.
 */
public final class FixedBuffer extends BinaryData {

    private final byte[] data;

    private FixedBuffer(byte[] data) {
        this.data = data;
    }

    /**
     * Takes ownership of the given array without copying.
     */
    public static FixedBuffer wrap(byte[] data) {
        return new FixedBuffer(Objects.requireNonNull(data, "data cannot be null"));
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public byte get(long offset) {
        return data[checkIndex(offset)];
    }

    @Override
    public byte[] copy(long offset, int length) {
        if (offset < 0 || length < 0) {
            throw new IndexOutOfBoundsException("Invalid range: offset=" + offset + " length=" + length);
        }
        if (offset >= data.length) {
            return new byte[0];
        }
        int from = (int) offset;
        int to = (int) Math.min((long) from + length, data.length);
        return Arrays.copyOfRange(data, from, to);
    }

    /**
     * Overwrites a single byte.
     *
     * @return the previous value
     */
    public byte set(long offset, byte value) {
        int index = checkIndex(offset);
        byte old = data[index];
        data[index] = value;
        return old;
    }

    private int checkIndex(long offset) {
        if (offset < 0 || offset >= data.length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside buffer of " + data.length);
        }
        return (int) offset;
    }
}
