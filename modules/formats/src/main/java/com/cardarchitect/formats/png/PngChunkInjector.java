package com.cardarchitect.formats.png;

import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.api.MissingTerminalChunkException;
import com.cardarchitect.util.Crc32;
import com.cardarchitect.util.RawContainer;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Objects;

/**
 * Splices a new {@code tEXt} chunk into a PNG immediately before its IEND chunk, and removes
 * {@code tEXt} chunks by keyword.
 *
 * <p>All other bytes are copied through unchanged and in order; the input is never modified.
 */
public class PngChunkInjector {

    private static final Logger log = Logger.getLogger(PngChunkInjector.class);

    private static final byte[] TEXT_TYPE = PngChunk.TEXT.getBytes(StandardCharsets.US_ASCII);
    private static final int MAX_KEYWORD_LENGTH = 79;

    private final PngChunkReader reader = new PngChunkReader();

    /**
     * Returns a new PNG holding one more {@code tEXt} chunk keyed {@code keyword}.
     *
     * @throws MalformedContainerException    if the signature is wrong
     * @throws MissingTerminalChunkException  if no IEND chunk can be located
     */
    public byte[] embed(RawContainer png, String keyword, String text) throws MalformedContainerException {
        if (!PngChunkReader.hasSignature(png)) {
            throw new MalformedContainerException("Not a PNG: signature mismatch", 0);
        }
        int iendStart = findIendStart(png);
        if (iendStart < 0) {
            throw new MissingTerminalChunkException(png.length());
        }

        byte[] chunk = buildTextChunk(keyword, text);
        byte[] out = new byte[png.length() + chunk.length];
        png.copyTo(0, out, 0, iendStart);
        System.arraycopy(chunk, 0, out, iendStart, chunk.length);
        png.copyTo(iendStart, out, iendStart + chunk.length, png.length() - iendStart);

        log.debugf("Inserted tEXt chunk '%s' (%d bytes) at offset %d", keyword, chunk.length, iendStart);
        return out;
    }

    /**
     * Returns a copy of the PNG without the {@code tEXt} chunks whose keyword is in {@code keywords}.
     * Returns an unchanged copy when nothing matches.
     *
     * @throws MalformedContainerException if the chunk framing is corrupt
     */
    public byte[] strip(RawContainer png, Collection<String> keywords) throws MalformedContainerException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(png.length());
        int cursor = 0;
        int removed = 0;
        for (PngChunk chunk : reader.readChunks(png)) {
            if (PngChunkReader.textKeyword(chunk).filter(keywords::contains).isEmpty()) {
                continue;
            }
            out.writeBytes(png.slice(cursor, chunk.offset() - cursor));
            cursor = chunk.offset() + (int) chunk.totalSize();
            removed++;
        }
        if (removed == 0) {
            return png.toByteArray();
        }
        out.writeBytes(png.slice(cursor, png.length() - cursor));

        log.debugf("Removed %d tEXt chunk(s) matching %s", removed, keywords);
        return out.toByteArray();
    }

    /**
     * Encodes a complete {@code tEXt} chunk: length, type, {@code keyword NUL text}, CRC.
     */
    public byte[] buildTextChunk(String keyword, String text) {
        requireValidKeyword(keyword);
        Objects.requireNonNull(text, "text cannot be null");

        byte[] keywordBytes = keyword.getBytes(StandardCharsets.ISO_8859_1);
        byte[] textBytes = text.getBytes(StandardCharsets.UTF_8);

        byte[] data = new byte[keywordBytes.length + 1 + textBytes.length];
        System.arraycopy(keywordBytes, 0, data, 0, keywordBytes.length);
        data[keywordBytes.length] = 0;
        System.arraycopy(textBytes, 0, data, keywordBytes.length + 1, textBytes.length);

        long crc = Crc32.compute(TEXT_TYPE, data);

        return ByteBuffer.allocate(data.length + PngChunk.FRAMING_BYTES)
                .putInt(data.length)
                .put(TEXT_TYPE)
                .put(data)
                .putInt((int) crc)
                .array();
    }

    /**
     * Offset of the IEND chunk's length field, scanning backwards from the end; -1 if absent.
     */
    int findIendStart(RawContainer png) {
        for (int offset = png.length() - PngChunk.FRAMING_BYTES; offset >= PngChunk.SIGNATURE.length; offset--) {
            if (png.regionMatches(offset + 4, PngChunk.IEND_TAG)) {
                return offset;
            }
        }
        return -1;
    }

    private static void requireValidKeyword(String keyword) {
        Objects.requireNonNull(keyword, "keyword cannot be null");
        if (keyword.isEmpty() || keyword.length() > MAX_KEYWORD_LENGTH) {
            throw new IllegalArgumentException("tEXt keyword must be 1-79 characters: " + keyword);
        }
        for (int i = 0; i < keyword.length(); i++) {
            char c = keyword.charAt(i);
            if (c == 0 || c > 0xFF) {
                throw new IllegalArgumentException("tEXt keyword must be Latin-1 without NUL: " + keyword);
            }
        }
    }
}
