package com.flashkit.hexbench.core.checksum;

/**
 * How often one byte value occurs in a buffer.
 *
 * @param value      Byte value, 0-255
 * @param count      Occurrences
 * @param percentage Share of the buffer, 0-100
 */
public record ByteFrequency(int value, long count, double percentage) {
}
