package com.flashkit.hexbench.util.buffer;

/**
 * Read-only random-access view of an in-memory byte sequence.
 *
 * Detectors and scanners only ever see this view; mutation lives in
 * {@link FixedBuffer}.
 */
public abstract class BinaryData {

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Returns the byte at the given offset.
     *
     * @throws IndexOutOfBoundsException if offset is outside [0, size)
     */
    public abstract byte get(long offset);

    /**
     * Copies {@code length} bytes starting at {@code offset}.
     * The copy is clipped at the end of the data, so it may be shorter than requested.
     */
    public abstract byte[] copy(long offset, int length);

    /**
     * Unsigned value of the byte at the given offset.
     */
    public int getUnsigned(long offset) {
        return get(offset) & 0xFF;
    }

    /**
     * True when {@code length} bytes starting at {@code offset} fit inside the data.
     */
    public boolean contains(long offset, long length) {
        return offset >= 0 && length >= 0 && offset + length <= size();
    }

    /**
     * Checks whether {@code pattern} occurs at {@code offset}.
     */
    public boolean matchesAt(long offset, byte[] pattern) {
        if (!contains(offset, pattern.length)) {
            return false;
        }
        for (int i = 0; i < pattern.length; i++) {
            if (get(offset + i) != pattern[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Full copy of the current content.
     */
    public byte[] snapshot() {
        if (size() > Integer.MAX_VALUE) {
            throw new IllegalStateException("Data too large to snapshot: " + size());
        }
        return copy(0, (int) size());
    }
}
