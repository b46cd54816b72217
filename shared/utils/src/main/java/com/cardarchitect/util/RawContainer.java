package com.cardarchitect.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Read-only view over an entire PNG or ZIP file as received.
 *
 * <p>Wraps the caller's array without copying; nothing in the codec writes to it.
 * Transforms always allocate a new output array. Accessors throw
 * {@link IndexOutOfBoundsException} on misuse; callers parsing untrusted input
 * must bounds-check with {@link #hasRemaining(int, long)} first.
 */
public final class RawContainer {

    private final byte[] bytes;

    private RawContainer(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps the array without copying. The caller must not mutate it afterwards.
     */
    public static RawContainer wrap(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RawContainer(bytes);
    }

    public int length() {
        return bytes.length;
    }

    /**
     * True when {@code count} bytes can be read starting at {@code offset}.
     */
    public boolean hasRemaining(int offset, long count) {
        return offset >= 0 && count >= 0 && offset + count <= bytes.length;
    }

    /**
     * Reads an unsigned big-endian 32-bit value.
     */
    public long readUInt32(int offset) {
        Objects.checkFromIndexSize(offset, 4, bytes.length);
        return ((long) (bytes[offset] & 0xFF) << 24)
                | ((bytes[offset + 1] & 0xFF) << 16)
                | ((bytes[offset + 2] & 0xFF) << 8)
                | (bytes[offset + 3] & 0xFF);
    }

    /**
     * Reads {@code length} bytes as ISO-8859-1 text (PNG chunk types, keywords).
     */
    public String readAscii(int offset, int length) {
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return new String(bytes, offset, length, StandardCharsets.ISO_8859_1);
    }

    /**
     * Copies a region into a new array.
     */
    public byte[] slice(int offset, int length) {
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return Arrays.copyOfRange(bytes, offset, offset + length);
    }

    public void copyTo(int srcOffset, byte[] dest, int destOffset, int length) {
        System.arraycopy(bytes, srcOffset, dest, destOffset, length);
    }

    /**
     * True when the bytes at {@code offset} equal {@code expected}. Out-of-range regions never match.
     */
    public boolean regionMatches(int offset, byte[] expected) {
        if (!hasRemaining(offset, expected.length)) {
            return false;
        }
        return Arrays.equals(bytes, offset, offset + expected.length, expected, 0, expected.length);
    }

    /**
     * Returns a copy of the full contents.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(bytes, bytes.length);
    }
}
