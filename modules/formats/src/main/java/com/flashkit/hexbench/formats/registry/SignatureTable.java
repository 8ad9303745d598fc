package com.flashkit.hexbench.formats.registry;

import com.flashkit.hexbench.formats.api.FileType;
import com.flashkit.hexbench.formats.api.Signature;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in magic-byte tables.
 */
public final class SignatureTable {

    private SignatureTable() {
    }

    /** Whole-file magics checked at offset 0, in detection order (EnumMap iterates by ordinal). */
    public static final Map<FileType, Signature> FILE_TYPES;

    static {
        Map<FileType, Signature> types = new EnumMap<>(FileType.class);
        types.put(FileType.ANDROID_BOOT_IMAGE, Signature.ascii("Android Boot Image", "ANDROID!"));
        types.put(FileType.ELF, Signature.of("ELF Executable", 0x7F, 0x45, 0x4C, 0x46));
        types.put(FileType.ZIP, Signature.of("ZIP Archive (possibly APK)", 0x50, 0x4B, 0x03, 0x04));
        types.put(FileType.SPARSE_IMAGE, Signature.of("Android Sparse Image", 0x3A, 0xFF, 0x26, 0xED));
        types.put(FileType.PNG, Signature.of("PNG Image", 0x89, 0x50, 0x4E, 0x47));
        types.put(FileType.JPEG, Signature.of("JPEG Image", 0xFF, 0xD8, 0xFF));
        FILE_TYPES = Collections.unmodifiableMap(types);
    }

    /** Structures looked for by the stride scan. */
    public static final List<Signature> STRUCTURES = List.of(
            Signature.ascii("Android Boot Header", "ANDROID!"),
            Signature.ascii("GPT Header", "EFI PART"),
            Signature.ascii("FAT Boot Sector", "MSDOS5.0"),
            Signature.of("EXT Superblock", 0x53, 0xEF),
            Signature.ascii("SquashFS", "hsqs"),
            Signature.of("GZIP Data", 0x1F, 0x8B),
            Signature.of("XZ Data", 0xFD, 0x37, 0x7A, 0x58, 0x5A, 0x00)
    );

    /** Magics looked for at every offset by the known-pattern finder. */
    public static final List<Signature> KNOWN_PATTERNS = List.of(
            Signature.ascii("Android Boot Magic", "ANDROID!"),
            Signature.of("ELF Magic", 0x7F, 0x45, 0x4C, 0x46),
            Signature.of("ZIP/APK", 0x50, 0x4B, 0x03, 0x04),
            Signature.of("PNG", 0x89, 0x50, 0x4E, 0x47),
            Signature.of("JPEG", 0xFF, 0xD8, 0xFF),
            Signature.ascii("DEX", "dex\n"),
            Signature.of("GZIP", 0x1F, 0x8B)
    );
}
