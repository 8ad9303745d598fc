package com.flashkit.hexbench.util;

import java.util.Locale;

/**
 * Human-readable byte counts ({@code "1.50 KB"}).
 */
public final class FileSizes {

    private static final String[] SUFFIXES = {"B", "KB", "MB", "GB", "TB"};

    private FileSizes() {
    }

    public static String format(long bytes) {
        double size = bytes;
        int i = 0;
        while (size >= 1024 && i < SUFFIXES.length - 1) {
            size /= 1024;
            i++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, SUFFIXES[i]);
    }
}
