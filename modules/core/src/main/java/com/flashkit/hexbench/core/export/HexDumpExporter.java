package com.flashkit.hexbench.core.export;

import com.flashkit.hexbench.core.display.HexLine;
import com.flashkit.hexbench.core.display.HexLines;
import com.flashkit.hexbench.core.result.EditorError;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.util.FileSizes;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Writes a classic 16-bytes-per-row hex dump:
 * <pre>
 * Offset     00 01 02 03 04 05 06 07 08 09 0A 0B 0C 0D 0E 0F  ASCII
 * 00000000   7F 45 4C 46 02 01 01 00 00 00 00 00 00 00 00 00  .ELF............
 * </pre>
 */
public class HexDumpExporter {

    static final int COLUMNS = 16;
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final HexLines layout = new HexLines(COLUMNS);
    private final Clock clock;

    public HexDumpExporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public Outcome<Void> export(BinaryData data, String source, Path target) {
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(data, source, out);
            return Outcome.done();
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("writing hex dump to", target, e));
        }
    }

    public void write(BinaryData data, String source, Writer out) throws IOException {
        out.write("Hex Dump of: " + source + "\n");
        out.write("Size: " + FileSizes.format(data.size()) + "\n");
        out.write("Generated: " + LocalDateTime.now(clock).format(TIMESTAMP) + "\n");
        out.write("=".repeat(80) + "\n");
        out.write("\n");
        out.write(ruler() + "\n");
        out.write("-".repeat(80) + "\n");
        for (HexLine line : layout.lines(data)) {
            out.write(line.offsetText() + "   " + line.hexText(COLUMNS) + " " + line.asciiText() + "\n");
        }
        out.flush();
    }

    static String ruler() {
        StringBuilder sb = new StringBuilder("Offset     ");
        for (int i = 0; i < COLUMNS; i++) {
            sb.append(String.format("%02X ", i));
        }
        return sb.append(" ASCII").toString();
    }
}
