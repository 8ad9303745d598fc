package com.flashkit.hexbench.core.checksum;

import java.util.List;

/**
 * Digests and byte distribution of a buffer at one point in time.
 * Hex strings are upper case without separators.
 *
 * @param size        Bytes hashed
 * @param crc32       CRC-32 value (IEEE, reflected)
 * @param md5         MD5 digest
 * @param sha1        SHA-1 digest
 * @param sha256      SHA-256 digest
 * @param topBytes    Most frequent byte values, most frequent first
 */
public record ChecksumReport(long size, long crc32, String md5, String sha1, String sha256,
                             List<ByteFrequency> topBytes) {

    public ChecksumReport {
        topBytes = List.copyOf(topBytes);
    }

    /**
     * CRC-32 as eight upper-case hex digits.
     */
    public String crc32Hex() {
        return String.format("%08X", crc32);
    }
}
