package com.flashkit.hexbench.core.io;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Path chooser supplied by the presentation layer. Empty means the operator cancelled.
 */
public interface FilePicker {

    Optional<Path> chooseOpen(String title);

    Optional<Path> chooseSave(String title, String suggestedName);
}
