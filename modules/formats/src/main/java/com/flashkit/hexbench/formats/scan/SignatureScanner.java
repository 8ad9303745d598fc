package com.flashkit.hexbench.formats.scan;

import com.flashkit.hexbench.formats.api.FileType;
import com.flashkit.hexbench.formats.api.Signature;
import com.flashkit.hexbench.formats.api.StructureNode;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Looks for embedded structures at stride-aligned offsets only.
 *
 * <p>Each signature is reported once, at the first aligned offset where it
 * matches. Structures that do not start on a stride boundary are not found.
 */
public class SignatureScanner {

    private final List<Signature> signatures;
    private final int stride;

    public SignatureScanner(List<Signature> signatures, int stride) {
        if (stride <= 0) {
            throw new IllegalArgumentException("Stride must be > 0, got: " + stride);
        }
        this.signatures = List.copyOf(Objects.requireNonNull(signatures, "signatures cannot be null"));
        this.stride = stride;
    }

    public int stride() {
        return stride;
    }

    /**
     * Builds the structure tree: a root covering the whole buffer, named
     * after the detected type, with one child per signature found.
     */
    public StructureNode scan(BinaryData data, FileType type) {
        List<StructureNode> children = new ArrayList<>();
        long size = data.size();

        for (Signature signature : signatures) {
            for (long pos = 0; pos + signature.length() <= size; pos += stride) {
                if (signature.matches(data, pos)) {
                    children.add(StructureNode.leaf(signature.name(), pos));
                    break;
                }
            }
        }

        String location = size == 0 ? "empty" : String.format("0x0 - 0x%X", size - 1);
        return new StructureNode(type.label(), location, 0, children);
    }
}
