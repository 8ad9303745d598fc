/**
 * Shared utilities for all Hexbench modules.
 *
 * <p>Contains {@link com.flashkit.hexbench.util.HexText} and the
 * {@link com.flashkit.hexbench.util.buffer buffer layer} (BinaryData, FixedBuffer).
 * Only commons-codec as a dependency.
 */
package com.flashkit.hexbench.util;
