package com.flashkit.hexbench.core.search;

/**
 * One match of a search.
 *
 * @param offset      Where the match starts
 * @param length      Match length in bytes
 * @param previewText First bytes at the match as spaced hex, or a pattern name
 */
public record SearchResult(long offset, int length, String previewText) {
}
