package com.flashkit.hexbench.core.export;

import com.flashkit.hexbench.core.checksum.ByteFrequency;
import com.flashkit.hexbench.core.checksum.ChecksumReport;
import com.flashkit.hexbench.formats.api.FileType;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of everything the analysis export reports about a buffer.
 */
public record AnalysisReport(String file, long size, Instant generatedAt, String fileType,
                             String crc32, String md5, String sha1, String sha256,
                             List<ByteFrequency> byteDistribution) {

    public AnalysisReport {
        byteDistribution = List.copyOf(byteDistribution);
    }

    public static AnalysisReport of(String file, FileType type, ChecksumReport checksums, Instant generatedAt) {
        return new AnalysisReport(file, checksums.size(), generatedAt, type.label(),
                checksums.crc32Hex(), checksums.md5(), checksums.sha1(), checksums.sha256(),
                checksums.topBytes());
    }
}
