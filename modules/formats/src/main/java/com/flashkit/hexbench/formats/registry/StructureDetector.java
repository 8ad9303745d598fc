package com.flashkit.hexbench.formats.registry;

import com.flashkit.hexbench.formats.api.Capped;
import com.flashkit.hexbench.formats.api.FileType;
import com.flashkit.hexbench.formats.api.PatternHit;
import com.flashkit.hexbench.formats.api.StringMatch;
import com.flashkit.hexbench.formats.api.StructureNode;
import com.flashkit.hexbench.formats.scan.KnownPatternFinder;
import com.flashkit.hexbench.formats.scan.SignatureScanner;
import com.flashkit.hexbench.formats.scan.StringExtractor;
import com.flashkit.hexbench.util.buffer.BinaryData;

/**
 * Entry point for structure analysis of a loaded buffer: file-type
 * classification, the stride signature scan, string extraction and the
 * known-pattern search.
 */
public class StructureDetector {

    public static final int DEFAULT_STRIDE = 512;
    public static final int DEFAULT_MIN_STRING_LENGTH = 4;
    public static final int DEFAULT_MAX_RESULTS = 1000;

    private final FileTypeDetector typeDetector = new FileTypeDetector();
    private final SignatureScanner scanner;
    private final StringExtractor strings;
    private final KnownPatternFinder patterns;
    private final int minStringLength;

    public StructureDetector(int stride, int minStringLength, int maxResults) {
        if (minStringLength <= 0) {
            throw new IllegalArgumentException("minStringLength must be > 0, got: " + minStringLength);
        }
        this.scanner = new SignatureScanner(SignatureTable.STRUCTURES, stride);
        this.strings = new StringExtractor(maxResults);
        this.patterns = new KnownPatternFinder(SignatureTable.KNOWN_PATTERNS, maxResults);
        this.minStringLength = minStringLength;
    }

    public static StructureDetector defaults() {
        return new StructureDetector(DEFAULT_STRIDE, DEFAULT_MIN_STRING_LENGTH, DEFAULT_MAX_RESULTS);
    }

    public FileType detectFileType(BinaryData data) {
        return typeDetector.detect(data);
    }

    public StructureNode scanSignatures(BinaryData data) {
        return scanner.scan(data, detectFileType(data));
    }

    public Capped<StringMatch> extractStrings(BinaryData data) {
        return strings.extract(data, minStringLength);
    }

    public Capped<StringMatch> extractStrings(BinaryData data, int minLength) {
        return strings.extract(data, minLength);
    }

    public Capped<PatternHit> findKnownPatterns(BinaryData data) {
        return patterns.find(data);
    }

    public int stride() {
        return scanner.stride();
    }
}
