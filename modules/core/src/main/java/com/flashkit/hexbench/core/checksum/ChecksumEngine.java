package com.flashkit.hexbench.core.checksum;

import com.flashkit.hexbench.util.buffer.BinaryData;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.PureJavaCrc32;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes CRC32, MD5, SHA1, SHA256 and the byte histogram in one pass.
 * Stateless: every call reads the buffer as it is now.
 */
public class ChecksumEngine {

    public static final int TOP_BYTES = 20;
    private static final int CHUNK_SIZE = 64 * 1024;

    public ChecksumReport compute(BinaryData data) {
        Objects.requireNonNull(data, "data cannot be null");
        PureJavaCrc32 crc = new PureJavaCrc32();
        MessageDigest md5 = DigestUtils.getMd5Digest();
        MessageDigest sha1 = DigestUtils.getSha1Digest();
        MessageDigest sha256 = DigestUtils.getSha256Digest();
        long[] counts = new long[256];

        long size = data.size();
        for (long pos = 0; pos < size; pos += CHUNK_SIZE) {
            byte[] chunk = data.copy(pos, CHUNK_SIZE);
            crc.update(chunk, 0, chunk.length);
            md5.update(chunk);
            sha1.update(chunk);
            sha256.update(chunk);
            for (byte b : chunk) {
                counts[b & 0xFF]++;
            }
        }

        return new ChecksumReport(size, crc.getValue(),
                Hex.encodeHexString(md5.digest(), false),
                Hex.encodeHexString(sha1.digest(), false),
                Hex.encodeHexString(sha256.digest(), false),
                topBytes(counts, size));
    }

    static List<ByteFrequency> topBytes(long[] counts, long total) {
        List<ByteFrequency> frequencies = new ArrayList<>();
        for (int value = 0; value < counts.length; value++) {
            if (counts[value] > 0) {
                frequencies.add(new ByteFrequency(value, counts[value], counts[value] * 100.0 / total));
            }
        }
        frequencies.sort(Comparator.comparingLong(ByteFrequency::count).reversed()
                .thenComparingInt(ByteFrequency::value));
        return frequencies.size() > TOP_BYTES ? frequencies.subList(0, TOP_BYTES) : frequencies;
    }
}
