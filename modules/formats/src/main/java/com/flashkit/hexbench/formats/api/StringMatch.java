package com.flashkit.hexbench.formats.api;

/**
 * Printable-ASCII run found by string extraction.
 *
 * @param offset  Offset of the first character
 * @param length  Full run length in bytes
 * @param preview Run text, truncated to 50 characters plus "..." when longer
 */
public record StringMatch(long offset, int length, String preview) {
}
