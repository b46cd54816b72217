package com.cardarchitect.formats.png;

import java.nio.charset.StandardCharsets;

/**
 * One chunk of a PNG stream.
 *
 * @param type   4-character ASCII tag ("IHDR", "tEXt", "IEND", ...)
 * @param data   chunk payload (a copy; never aliases the container)
 * @param length declared payload length
 * @param crc    CRC field as stored; not re-validated when reading
 * @param offset position of the chunk's length field in the container
 */
public record PngChunk(String type, byte[] data, long length, long crc, int offset) {

    public static final String TEXT = "tEXt";
    public static final String IEND = "IEND";

    /** Length, type and CRC fields around the payload. */
    public static final int FRAMING_BYTES = 12;

    /** The fixed 8-byte signature every PNG starts with. */
    static final byte[] SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    static final byte[] IEND_TAG = IEND.getBytes(StandardCharsets.US_ASCII);

    public boolean isType(String tag) {
        return type.equals(tag);
    }

    /**
     * Total bytes the chunk occupies in the stream, framing included.
     */
    public long totalSize() {
        return length + FRAMING_BYTES;
    }
}
