package com.flashkit.hexbench.core.event;

import java.nio.file.Path;

/**
 * Notifications published by an editor session to its listeners.
 */
public sealed interface SessionEvent {

    record BufferLoaded(Path path, long size) implements SessionEvent {}

    /**
     * Bytes in [offset, offset+length) changed; views should redraw that range.
     */
    record BufferChanged(long offset, int length) implements SessionEvent {}

    /**
     * A single display row must be re-rendered.
     */
    record LineInvalidated(long line) implements SessionEvent {}

    record DirtyChanged(boolean dirty) implements SessionEvent {}

    record CursorMoved(long offset) implements SessionEvent {}

    record SelectionChanged(long start, int length) implements SessionEvent {}

    record StatusMessage(String text) implements SessionEvent {}

    record BufferClosed(Path path) implements SessionEvent {}
}
