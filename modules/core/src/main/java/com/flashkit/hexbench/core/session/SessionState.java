package com.flashkit.hexbench.core.session;

import java.nio.ByteOrder;
import java.nio.file.Path;

/**
 * Point-in-time view of a session for rendering and for deciding whether to
 * prompt before discarding changes.
 *
 * @param path            File backing the buffer, null when nothing is loaded
 * @param size            Buffer size, 0 when nothing is loaded
 * @param dirty           Unsaved modifications exist
 * @param modifiedCount   Number of modified offsets
 * @param cursor          Cursor offset
 * @param selectionStart  First selected byte
 * @param selectionLength Selected byte count, 0 for none
 * @param undoDepth       Actions available to undo
 * @param redoDepth       Actions available to redo
 * @param searchHits      Results of the last search
 * @param bookmarkCount   Bookmarks in the session
 * @param byteOrder       Byte order used by the data inspector
 */
public record SessionState(Path path,
                           long size,
                           boolean dirty,
                           int modifiedCount,
                           long cursor,
                           long selectionStart,
                           int selectionLength,
                           int undoDepth,
                           int redoDepth,
                           int searchHits,
                           int bookmarkCount,
                           ByteOrder byteOrder) {

    public boolean loaded() {
        return path != null;
    }
}
