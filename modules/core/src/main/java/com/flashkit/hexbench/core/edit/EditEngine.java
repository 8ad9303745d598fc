package com.flashkit.hexbench.core.edit;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Undo/redo engine over one {@link EditBuffer}.
 *
 * <p>Every mutation is recorded as an {@link UndoAction} before it is applied.
 * Mutations that would change nothing (offset out of range, identical bytes)
 * are not recorded and return empty.
 */
public class EditEngine {

    private final EditBuffer buffer;
    private final UndoHistory history;

    public EditEngine(EditBuffer buffer, int maxHistory) {
        this.buffer = Objects.requireNonNull(buffer, "buffer cannot be null");
        this.history = new UndoHistory(maxHistory);
    }

    public EditBuffer buffer() {
        return buffer;
    }

    public UndoHistory history() {
        return history;
    }

    /**
     * Overwrites one byte.
     *
     * @return the recorded action, or empty when the offset is out of range or the value is unchanged
     */
    public Optional<UndoAction> writeByte(long offset, byte value) {
        return writeBytes(offset, new byte[]{value});
    }

    /**
     * Overwrites a contiguous range as one action. Data running past the end
     * of the buffer is clipped; a start offset outside the buffer writes nothing.
     */
    public Optional<UndoAction> writeBytes(long offset, byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        if (!buffer.inRange(offset) || data.length == 0) {
            return Optional.empty();
        }
        int length = (int) Math.min(data.length, buffer.size() - offset);
        byte[] next = Arrays.copyOf(data, length);
        byte[] current = buffer.data().copy(offset, length);
        if (Arrays.equals(current, next)) {
            return Optional.empty();
        }
        UndoAction action = UndoAction.modify(offset, current, next);
        history.record(action);
        buffer.write(offset, next);
        return Optional.of(action);
    }

    /**
     * Sets {@code length} bytes starting at {@code offset} to {@code value}, clipped at the end.
     */
    public Optional<UndoAction> fill(long offset, int length, byte value) {
        if (length <= 0) {
            return Optional.empty();
        }
        byte[] data = new byte[length];
        Arrays.fill(data, value);
        return writeBytes(offset, data);
    }

    /**
     * Reverts the newest action.
     *
     * @return the reverted action, or empty when there is nothing to undo
     */
    public Optional<UndoAction> undo() {
        Optional<UndoAction> action = history.popUndo();
        action.ifPresent(a -> buffer.write(a.offset(), a.oldData()));
        return action;
    }

    /**
     * Reapplies the most recently undone action.
     */
    public Optional<UndoAction> redo() {
        Optional<UndoAction> action = history.popRedo();
        action.ifPresent(a -> buffer.write(a.offset(), a.newData()));
        return action;
    }

    /**
     * Undoes every recorded action, newest first.
     *
     * @return number of actions undone
     */
    public int undoAll() {
        int count = 0;
        while (undo().isPresent()) {
            count++;
        }
        return count;
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }
}
