package com.flashkit.hexbench.core.config;

import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;

/**
 * Tunables for an editor session.
 *
 * <p>Resolved from MicroProfile Config keys under {@code hexbench.*}; the
 * bundled {@code META-INF/microprofile-config.properties} carries the
 * defaults, system properties and environment variables override them.
 *
 * @param maxUndoHistory        Undo depth before the oldest action is evicted
 * @param maxSearchResults      Hit cap for searches, string extraction and pattern finding
 * @param scanStride            Alignment of the structure signature scan
 * @param minStringLength       Shortest printable run reported by string extraction
 * @param confirmThresholdBytes Loads above this size ask the large-file gate first
 * @param bytesPerLine          Display row width
 * @param maxRecentFiles        Length of the recent-files list
 */
public record EditorSettings(int maxUndoHistory,
                             int maxSearchResults,
                             int scanStride,
                             int minStringLength,
                             long confirmThresholdBytes,
                             int bytesPerLine,
                             int maxRecentFiles) {

    public static final String PREFIX = "hexbench.";

    public EditorSettings {
        requirePositive("undo.max-history", maxUndoHistory);
        requirePositive("search.max-results", maxSearchResults);
        requirePositive("scan.stride", scanStride);
        requirePositive("strings.min-length", minStringLength);
        requirePositive("display.bytes-per-line", bytesPerLine);
        requirePositive("recent.max-entries", maxRecentFiles);
        if (confirmThresholdBytes < 0) {
            throw new IllegalArgumentException(
                    PREFIX + "load.confirm-threshold-bytes must be >= 0, got: " + confirmThresholdBytes);
        }
    }

    public static EditorSettings defaults() {
        return new EditorSettings(100, 1000, 512, 4, 500L * 1024 * 1024, 16, 10);
    }

    /**
     * Reads settings from the default config sources.
     */
    public static EditorSettings load() {
        return fromConfig(new SmallRyeConfigBuilder().addDefaultSources().build());
    }

    public static EditorSettings fromConfig(Config config) {
        EditorSettings d = defaults();
        return new EditorSettings(
                config.getOptionalValue(PREFIX + "undo.max-history", Integer.class).orElse(d.maxUndoHistory()),
                config.getOptionalValue(PREFIX + "search.max-results", Integer.class).orElse(d.maxSearchResults()),
                config.getOptionalValue(PREFIX + "scan.stride", Integer.class).orElse(d.scanStride()),
                config.getOptionalValue(PREFIX + "strings.min-length", Integer.class).orElse(d.minStringLength()),
                config.getOptionalValue(PREFIX + "load.confirm-threshold-bytes", Long.class)
                        .orElse(d.confirmThresholdBytes()),
                config.getOptionalValue(PREFIX + "display.bytes-per-line", Integer.class).orElse(d.bytesPerLine()),
                config.getOptionalValue(PREFIX + "recent.max-entries", Integer.class).orElse(d.maxRecentFiles()));
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(PREFIX + key + " must be > 0, got: " + value);
        }
    }
}
