package com.flashkit.hexbench.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Assembles minimal APK-shaped archives. Entries are STORED so their
 * magic bytes stay visible to byte-level scans.
 */
public class TestApkBuilder {

    private static final long FIXED_TIME = 1704067200000L;

    private final Map<String, byte[]> members = new LinkedHashMap<>();

    public TestApkBuilder manifest(String packageName) {
        String xml = "<manifest package=\"" + packageName + "\"/>";
        members.put("AndroidManifest.xml", xml.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    /** Adds {@code classes.dex} with a "dex\n035\0" header followed by {@code body}. */
    public TestApkBuilder dex(String body) {
        byte[] header = "dex\n035\0".getBytes(StandardCharsets.US_ASCII);
        byte[] tail = body.getBytes(StandardCharsets.US_ASCII);
        byte[] dex = new byte[header.length + tail.length];
        System.arraycopy(header, 0, dex, 0, header.length);
        System.arraycopy(tail, 0, dex, header.length, tail.length);
        members.put("classes.dex", dex);
        return this;
    }

    public TestApkBuilder resource(String name, byte[] data) {
        members.put("res/" + name, data);
        return this;
    }

    public int memberCount() {
        return members.size();
    }

    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> member : members.entrySet()) {
                zip.putNextEntry(storedEntry(member.getKey(), member.getValue()));
                zip.write(member.getValue());
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to assemble test APK", e);
        }
        return out.toByteArray();
    }

    public Path writeTo(Path path) throws IOException {
        return Files.write(path, toBytes());
    }

    private static ZipEntry storedEntry(String name, byte[] data) {
        CRC32 crc = new CRC32();
        crc.update(data);
        ZipEntry entry = new ZipEntry(name);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(data.length);
        entry.setCompressedSize(data.length);
        entry.setCrc(crc.getValue());
        entry.setTime(FIXED_TIME);
        return entry;
    }
}
