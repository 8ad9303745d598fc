package com.flashkit.hexbench.core.edit;

import com.flashkit.hexbench.util.buffer.BinaryData;
import com.flashkit.hexbench.util.buffer.FixedBuffer;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The loaded file held in memory, plus the offsets that differ from it on disk.
 *
 * <p>For every modified offset the buffer remembers the byte it had at load
 * (or last save) time. An offset leaves the modified set as soon as its byte
 * equals that value again, and the buffer is dirty exactly while the set is
 * non-empty.
 *
 * <p>Writes are package-private: everything outside this package mutates the
 * buffer through {@link EditEngine}, so every change is undoable.
 */
public class EditBuffer {

    private final FixedBuffer bytes;
    private final TreeMap<Long, Byte> pristine = new TreeMap<>();

    private EditBuffer(FixedBuffer bytes) {
        this.bytes = bytes;
    }

    /**
     * Takes ownership of the loaded file content.
     */
    public static EditBuffer of(byte[] content) {
        return new EditBuffer(FixedBuffer.wrap(content));
    }

    /**
     * Read-only view for detectors, scanners and exporters.
     */
    public BinaryData data() {
        return bytes;
    }

    public long size() {
        return bytes.size();
    }

    public boolean isEmpty() {
        return bytes.size() == 0;
    }

    public byte get(long offset) {
        return bytes.get(offset);
    }

    public boolean inRange(long offset) {
        return offset >= 0 && offset < bytes.size();
    }

    public boolean isDirty() {
        return !pristine.isEmpty();
    }

    public boolean isModified(long offset) {
        return pristine.containsKey(offset);
    }

    /**
     * Offsets whose byte differs from the on-disk value, ascending.
     */
    public NavigableSet<Long> modifiedOffsets() {
        return Collections.unmodifiableNavigableSet(pristine.navigableKeySet());
    }

    /**
     * Full copy of the current content.
     */
    public byte[] snapshot() {
        return bytes.snapshot();
    }

    /**
     * Overwrites a range and updates modification tracking.
     * The caller guarantees the range fits.
     */
    void write(long offset, byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        for (int i = 0; i < data.length; i++) {
            long at = offset + i;
            byte old = bytes.set(at, data[i]);
            Byte original = pristine.get(at);
            if (original == null) {
                if (old != data[i]) {
                    pristine.put(at, old);
                }
            } else if (original == data[i]) {
                pristine.remove(at);
            }
        }
    }

    /**
     * Called after a successful save: the current content becomes the on-disk baseline.
     */
    public void markSaved() {
        pristine.clear();
    }
}
