package com.cardarchitect.util;

import java.util.Objects;

/**
 * Table-driven CRC-32 (IEEE 802.3, reflected polynomial {@code 0xEDB88320}).
 *
 * <p>Init {@code 0xFFFFFFFF}, final XOR {@code 0xFFFFFFFF}. The 256-entry table is built once
 * per class load. Stateless and thread-safe.
 */
public final class Crc32 {

    private static final int POLYNOMIAL = 0xEDB88320;
    private static final int INITIAL = 0xFFFFFFFF;
    private static final int[] TABLE = buildTable();

    private Crc32() {}

    /**
     * Checksum of the whole array, as an unsigned 32-bit value.
     */
    public static long compute(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return compute(data, 0, data.length);
    }

    public static long compute(byte[] data, int offset, int length) {
        return finish(update(INITIAL, data, offset, length));
    }

    /**
     * Checksum over several byte ranges as if they were concatenated.
     * PNG chunk CRCs cover {@code type ++ data}, which live in separate arrays.
     */
    public static long compute(byte[]... parts) {
        int crc = INITIAL;
        for (byte[] part : parts) {
            crc = update(crc, part, 0, part.length);
        }
        return finish(crc);
    }

    private static int update(int crc, byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);
        int c = crc;
        for (int i = offset; i < offset + length; i++) {
            c = TABLE[(c ^ data[i]) & 0xFF] ^ (c >>> 8);
        }
        return c;
    }

    private static long finish(int crc) {
        return (crc ^ 0xFFFFFFFF) & 0xFFFFFFFFL;
    }

    private static int[] buildTable() {
        int[] table = new int[256];
        for (int n = 0; n < 256; n++) {
            int c = n;
            for (int k = 0; k < 8; k++) {
                c = (c & 1) != 0 ? POLYNOMIAL ^ (c >>> 1) : c >>> 1;
            }
            table[n] = c;
        }
        return table;
    }
}
