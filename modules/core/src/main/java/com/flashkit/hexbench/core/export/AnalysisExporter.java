package com.flashkit.hexbench.core.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flashkit.hexbench.core.checksum.ByteFrequency;
import com.flashkit.hexbench.core.checksum.ChecksumEngine;
import com.flashkit.hexbench.core.result.EditorError;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.formats.registry.StructureDetector;
import com.flashkit.hexbench.util.FileSizes;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the file analysis report and writes it as text or JSON.
 */
public class AnalysisExporter {

    private final StructureDetector detector;
    private final ChecksumEngine checksums;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnalysisExporter(StructureDetector detector, ChecksumEngine checksums,
                            ObjectMapper objectMapper, Clock clock) {
        this.detector = Objects.requireNonNull(detector, "detector cannot be null");
        this.checksums = Objects.requireNonNull(checksums, "checksums cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public AnalysisReport analyze(BinaryData data, String source) {
        return AnalysisReport.of(source, detector.detectFileType(data), checksums.compute(data), clock.instant());
    }

    public Outcome<Void> exportText(AnalysisReport report, Path target) {
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writeText(report, out);
            return Outcome.done();
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("writing analysis to", target, e));
        }
    }

    public Outcome<Void> exportJson(AnalysisReport report, Path target) {
        try {
            objectMapper.writeValue(target.toFile(), report);
            return Outcome.done();
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("writing analysis to", target, e));
        }
    }

    public void writeText(AnalysisReport report, Writer out) throws IOException {
        String generated = HexDumpExporter.TIMESTAMP.format(report.generatedAt().atZone(clock.getZone()));
        out.write("File Analysis Report\n");
        out.write("=".repeat(60) + "\n");
        out.write("File: " + report.file() + "\n");
        out.write("Size: " + FileSizes.format(report.size()) + " (" + report.size() + " bytes)\n");
        out.write("Generated: " + generated + "\n");
        out.write("\n");
        out.write("Checksums:\n");
        out.write("  CRC32:  " + report.crc32() + "\n");
        out.write("  MD5:    " + report.md5() + "\n");
        out.write("  SHA1:   " + report.sha1() + "\n");
        out.write("  SHA256: " + report.sha256() + "\n");
        out.write("\n");
        out.write("File Type: " + report.fileType() + "\n");
        out.write("\n");
        out.write("Byte Distribution:\n");
        for (ByteFrequency f : report.byteDistribution()) {
            out.write(String.format(Locale.ROOT, "  0x%02X: %10d (%.2f%%)\n", f.value(), f.count(), f.percentage()));
        }
        out.flush();
    }
}
