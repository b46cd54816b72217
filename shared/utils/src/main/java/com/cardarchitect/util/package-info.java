/**
 * Shared utilities for all Card Architect modules.
 *
 * <p>Contains {@link com.cardarchitect.util.Crc32} (table-driven CRC-32) and
 * {@link com.cardarchitect.util.RawContainer}, the read-only view over a received PNG or ZIP file.
 * No framework dependencies.
 */
package com.cardarchitect.util;
