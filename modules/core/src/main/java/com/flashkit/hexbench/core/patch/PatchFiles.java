package com.flashkit.hexbench.core.patch;

import com.flashkit.hexbench.core.result.EditorError;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.types.ErrorKind;
import com.flashkit.hexbench.util.HexText;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Text patch files, one patch per line:
 * <pre>
 * # comment
 * 0x1A0:DEADBEEF:CAFEBABE:optional description
 * </pre>
 * The offset is hex with an optional {@code 0x} prefix. Lines starting with
 * {@code #} or {@code //} and blank lines are skipped.
 */
public final class PatchFiles {

    static final String HEADER = "# Hex Patch File";
    static final String FORMAT_LINE = "# Format: OFFSET:ORIGINAL:NEW:DESCRIPTION";

    private PatchFiles() {
    }

    public static Outcome<List<HexPatch>> read(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("reading patches from", path, e));
        }
        return parse(lines);
    }

    /**
     * Parses patch lines. The first malformed line fails the whole read.
     */
    public static Outcome<List<HexPatch>> parse(List<String> lines) {
        List<HexPatch> patches = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }
            String[] parts = line.split(":", 4);
            if (parts.length < 3) {
                return Outcome.failed(ErrorKind.INVALID_PATTERN,
                        "Line " + (i + 1) + ": expected OFFSET:ORIGINAL:NEW");
            }
            try {
                long offset = parseHexOffset(parts[0].trim());
                byte[] original = HexText.parseCompact(parts[1].trim());
                byte[] replacement = HexText.parseCompact(parts[2].trim());
                String description = parts.length > 3 ? parts[3].trim() : "";
                patches.add(new HexPatch(offset, original, replacement, description));
            } catch (IllegalArgumentException e) {
                return Outcome.failed(ErrorKind.INVALID_PATTERN, "Line " + (i + 1) + ": " + e.getMessage());
            }
        }
        return Outcome.ok(patches);
    }

    public static Outcome<Void> write(Path path, List<HexPatch> patches) {
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add(FORMAT_LINE);
        lines.add("");
        for (HexPatch patch : patches) {
            lines.add(format(patch));
        }
        try {
            Files.write(path, lines, StandardCharsets.UTF_8);
            return Outcome.done();
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("writing patches to", path, e));
        }
    }

    static String format(HexPatch patch) {
        String line = String.format("0x%X:%s:%s", patch.offset(),
                HexText.toHex(patch.originalBytes()), HexText.toHex(patch.newBytes()));
        return patch.description().isEmpty() ? line : line + ":" + patch.description();
    }

    private static long parseHexOffset(String text) {
        String digits = text.regionMatches(true, 0, "0x", 0, 2) ? text.substring(2) : text;
        try {
            return Long.parseLong(digits, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid offset: " + text, e);
        }
    }
}
