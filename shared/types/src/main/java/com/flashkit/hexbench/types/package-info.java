/**
 * Pure Java value types shared across all Hexbench modules.
 *
 * <p>Hex text handling and the buffer layer live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.flashkit.hexbench.types;
