package com.cardarchitect.formats;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.Deflater;

/**
 * Builds small valid PNGs for tests. CRCs come from {@link java.util.zip.CRC32} so they
 * independently check the codec's own CRC engine.
 */
public final class TestPngs {

    public static final byte[] SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private TestPngs() {
    }

    /** A 1x1 grayscale PNG: IHDR, IDAT, IEND. */
    public static byte[] minimal() {
        return png(ihdr(), idat());
    }

    /** A 1x1 PNG carrying the given tEXt chunks between IHDR and IDAT. */
    public static byte[] withText(Map<String, String> texts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(SIGNATURE);
        out.writeBytes(ihdr());
        texts.forEach((keyword, text) -> out.writeBytes(textChunk(keyword, text)));
        out.writeBytes(idat());
        out.writeBytes(chunk("IEND", new byte[0]));
        return out.toByteArray();
    }

    /** Signature, the given chunks, then IEND. */
    public static byte[] png(byte[]... chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(SIGNATURE);
        for (byte[] chunk : chunks) {
            out.writeBytes(chunk);
        }
        out.writeBytes(chunk("IEND", new byte[0]));
        return out.toByteArray();
    }

    public static byte[] textChunk(String keyword, String text) {
        byte[] k = keyword.getBytes(StandardCharsets.ISO_8859_1);
        byte[] t = text.getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[k.length + 1 + t.length];
        System.arraycopy(k, 0, data, 0, k.length);
        System.arraycopy(t, 0, data, k.length + 1, t.length);
        return chunk("tEXt", data);
    }

    public static byte[] chunk(String type, byte[] data) {
        byte[] typeBytes = type.getBytes(StandardCharsets.US_ASCII);
        CRC32 crc = new CRC32();
        crc.update(typeBytes);
        crc.update(data);
        return ByteBuffer.allocate(12 + data.length)
                .putInt(data.length)
                .put(typeBytes)
                .put(data)
                .putInt((int) crc.getValue())
                .array();
    }

    public static byte[] ihdr() {
        byte[] data = ByteBuffer.allocate(13)
                .putInt(1)          // width
                .putInt(1)          // height
                .put((byte) 8)      // bit depth
                .put((byte) 0)      // grayscale
                .put((byte) 0)
                .put((byte) 0)
                .put((byte) 0)
                .array();
        return chunk("IHDR", data);
    }

    public static byte[] idat() {
        Deflater deflater = new Deflater();
        deflater.setInput(new byte[]{0, 0}); // filter byte + one pixel
        deflater.finish();
        byte[] buf = new byte[64];
        int len = deflater.deflate(buf);
        deflater.end();
        byte[] data = new byte[len];
        System.arraycopy(buf, 0, data, 0, len);
        return chunk("IDAT", data);
    }

    public static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) continue outer;
            }
            return i;
        }
        return -1;
    }
}
