package com.flashkit.hexbench.formats.api;

/**
 * Occurrence of a well-known magic anywhere in the buffer.
 */
public record PatternHit(long offset, int length, String name) {
}
