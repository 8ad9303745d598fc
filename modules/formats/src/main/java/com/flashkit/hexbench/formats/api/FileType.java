package com.flashkit.hexbench.formats.api;

/**
 * Classification of a whole buffer, as shown in the structure tree root and
 * in analysis reports.
 */
public enum FileType {
    ANDROID_BOOT_IMAGE("Android Boot Image"),
    ELF("ELF Executable"),
    ZIP("ZIP Archive (possibly APK)"),
    SPARSE_IMAGE("Android Sparse Image"),
    PNG("PNG Image"),
    JPEG("JPEG Image"),
    TEXT("Text File"),
    BINARY("Binary File"),
    UNKNOWN("Unknown");

    private final String label;

    FileType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
