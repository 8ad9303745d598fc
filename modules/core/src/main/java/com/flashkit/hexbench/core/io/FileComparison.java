package com.flashkit.hexbench.core.io;

import java.util.List;

/**
 * Byte-wise comparison of the open buffer against another file.
 *
 * @param leftSize    Size of the open buffer
 * @param rightSize   Size of the other file
 * @param differences Offsets in the common prefix where the bytes differ, ascending
 * @param truncated   True when more differences exist than were collected
 */
public record FileComparison(long leftSize, long rightSize, List<Long> differences, boolean truncated) {

    public FileComparison {
        differences = List.copyOf(differences);
    }

    public boolean sameSize() {
        return leftSize == rightSize;
    }

    public boolean identical() {
        return sameSize() && differences.isEmpty();
    }
}
