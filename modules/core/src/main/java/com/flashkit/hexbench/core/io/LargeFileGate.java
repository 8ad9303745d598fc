package com.flashkit.hexbench.core.io;

import java.nio.file.Path;

/**
 * Asks the operator whether to load a file above the size threshold.
 */
@FunctionalInterface
public interface LargeFileGate {

    LargeFileGate ALWAYS = (path, size) -> true;
    LargeFileGate NEVER = (path, size) -> false;

    /**
     * @return true to continue loading
     */
    boolean confirm(Path path, long size);
}
