package com.flashkit.hexbench.core.io;

import com.flashkit.hexbench.core.result.EditorError;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares the buffer with a file on disk over their common length.
 */
public class FileComparator {

    public static final int DEFAULT_MAX_DIFFERENCES = 1000;

    private final int maxDifferences;

    public FileComparator(int maxDifferences) {
        if (maxDifferences <= 0) {
            throw new IllegalArgumentException("maxDifferences must be > 0, got: " + maxDifferences);
        }
        this.maxDifferences = maxDifferences;
    }

    public FileComparator() {
        this(DEFAULT_MAX_DIFFERENCES);
    }

    public Outcome<FileComparison> compare(BinaryData data, Path other) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(other, "other cannot be null");
        byte[] right;
        try {
            right = Files.readAllBytes(other);
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("reading", other, e));
        }
        long common = Math.min(data.size(), right.length);
        List<Long> differences = new ArrayList<>();
        boolean truncated = false;
        for (long i = 0; i < common; i++) {
            if (data.get(i) != right[(int) i]) {
                if (differences.size() == maxDifferences) {
                    truncated = true;
                    break;
                }
                differences.add(i);
            }
        }
        return Outcome.ok(new FileComparison(data.size(), right.length, differences, truncated));
    }
}
