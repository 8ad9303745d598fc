package com.flashkit.hexbench.core.bookmark;

import java.time.Instant;
import java.util.Objects;

/**
 * A named offset the operator can jump back to.
 */
public record Bookmark(String name, long offset, String description, Instant createdAt) {

    public Bookmark {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (offset < 0) {
            throw new IllegalArgumentException("Negative bookmark offset: " + offset);
        }
        description = description != null ? description : "";
    }

    public Bookmark withName(String newName) {
        return new Bookmark(newName, offset, description, createdAt);
    }
}
