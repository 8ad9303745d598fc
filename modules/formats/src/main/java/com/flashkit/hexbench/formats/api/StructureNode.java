package com.flashkit.hexbench.formats.api;

import java.util.List;
import java.util.Objects;

/**
 * Node of the detected-structure tree. The root covers the whole file;
 * children are structures found inside it, in scan order.
 *
 * @param name     Display name
 * @param location Human-readable location ("0x0 - 0x1FF" or "@ 0x00000200")
 * @param offset   First byte of the structure
 * @param children Nested structures (immutable)
 */
public record StructureNode(
        String name,
        String location,
        long offset,
        List<StructureNode> children
) {
    public StructureNode {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(location, "location cannot be null");
        children = List.copyOf(children);
    }

    public static StructureNode leaf(String name, long offset) {
        return new StructureNode(name, String.format("@ 0x%08X", offset), offset, List.of());
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Depth-first search for a node by name, including this one.
     */
    public boolean contains(String nodeName) {
        if (name.equals(nodeName)) {
            return true;
        }
        for (StructureNode child : children) {
            if (child.contains(nodeName)) {
                return true;
            }
        }
        return false;
    }
}
