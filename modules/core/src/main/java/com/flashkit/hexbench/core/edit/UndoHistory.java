package com.flashkit.hexbench.core.edit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Paired undo/redo stacks with a bounded undo depth.
 *
 * <p>Recording a new action clears the redo stack. When the undo stack
 * exceeds its capacity the oldest action is evicted, so memory stays flat
 * however long the session runs.
 */
public class UndoHistory {

    private final Deque<UndoAction> undo = new ArrayDeque<>();
    private final Deque<UndoAction> redo = new ArrayDeque<>();
    private final int capacity;

    public UndoHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Undo capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public void record(UndoAction action) {
        undo.push(action);
        if (undo.size() > capacity) {
            undo.removeLast();
        }
        redo.clear();
    }

    /**
     * Moves the newest undo entry to the redo stack and returns it.
     */
    Optional<UndoAction> popUndo() {
        UndoAction action = undo.poll();
        if (action != null) {
            redo.push(action);
        }
        return Optional.ofNullable(action);
    }

    /**
     * Moves the newest redo entry back to the undo stack and returns it.
     */
    Optional<UndoAction> popRedo() {
        UndoAction action = redo.poll();
        if (action != null) {
            undo.push(action);
        }
        return Optional.ofNullable(action);
    }

    public int undoDepth() {
        return undo.size();
    }

    public int redoDepth() {
        return redo.size();
    }

    public boolean canUndo() {
        return !undo.isEmpty();
    }

    public boolean canRedo() {
        return !redo.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        undo.clear();
        redo.clear();
    }
}
