package com.flashkit.hexbench.formats.api;

import java.util.List;

/**
 * Result list that stops at a fixed cap. {@code truncated} tells the caller
 * the scan ended at the cap rather than at the end of the data.
 */
public record Capped<T>(List<T> items, boolean truncated) {

    public Capped {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
