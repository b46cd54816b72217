package com.cardarchitect.formats.png;

import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.util.RawContainer;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a PNG byte stream chunk by chunk.
 *
 * <p>Every field read is bounds-checked against the remaining buffer first; corrupt input
 * produces a {@link MalformedContainerException} naming the offset. Scanning stops after IEND,
 * ignoring trailing bytes. A stream that simply ends without IEND is accepted. Chunk CRCs are
 * not re-validated here.
 */
public class PngChunkReader {

    private static final Logger log = Logger.getLogger(PngChunkReader.class);

    /**
     * True when the container starts with the PNG signature.
     */
    public static boolean hasSignature(RawContainer container) {
        return container.regionMatches(0, PngChunk.SIGNATURE);
    }

    /**
     * Reads all chunks up to and including IEND.
     *
     * @throws MalformedContainerException on signature mismatch, truncated fields or chunk overrun
     */
    public List<PngChunk> readChunks(RawContainer png) throws MalformedContainerException {
        requireSignature(png);

        List<PngChunk> chunks = new ArrayList<>();
        int pos = PngChunk.SIGNATURE.length;

        while (pos < png.length()) {
            if (!png.hasRemaining(pos, 4)) {
                throw new MalformedContainerException("Truncated chunk length field", pos);
            }
            long length = png.readUInt32(pos);

            if (!png.hasRemaining(pos + 4, 4)) {
                throw new MalformedContainerException("Truncated chunk type field", pos + 4);
            }
            String type = png.readAscii(pos + 4, 4);

            int dataStart = pos + 8;
            if (!png.hasRemaining(dataStart, length)) {
                throw new MalformedContainerException(
                        "Chunk " + type + " declares " + length + " bytes but only "
                                + (png.length() - dataStart) + " remain", dataStart);
            }
            int crcStart = dataStart + (int) length;
            if (!png.hasRemaining(crcStart, 4)) {
                throw new MalformedContainerException("Truncated CRC field of chunk " + type, crcStart);
            }

            chunks.add(new PngChunk(type, png.slice(dataStart, (int) length), length, png.readUInt32(crcStart), pos));
            pos = crcStart + 4;

            if (PngChunk.IEND.equals(type)) {
                if (pos < png.length()) {
                    log.debugf("Ignoring %d trailing bytes after IEND", png.length() - pos);
                }
                return chunks;
            }
        }

        log.debugf("PNG stream ended without IEND after %d chunks", chunks.size());
        return chunks;
    }

    /**
     * Reads the stream and collects every {@code tEXt} chunk's keyword and text.
     *
     * <p>The keyword is the Latin-1 text before the first NUL byte, the text is the UTF-8
     * remainder. Chunks without a NUL separator are skipped.
     */
    public TextChunkMap readTextChunks(RawContainer png) throws MalformedContainerException {
        Map<String, String> entries = new LinkedHashMap<>();
        for (PngChunk chunk : readChunks(png)) {
            if (!chunk.isType(PngChunk.TEXT)) {
                continue;
            }
            byte[] data = chunk.data();
            int nul = indexOfNul(data);
            if (nul < 0) {
                log.debugf("Skipping tEXt chunk at offset %d without keyword separator", chunk.offset());
                continue;
            }
            String keyword = new String(data, 0, nul, StandardCharsets.ISO_8859_1);
            String text = new String(Arrays.copyOfRange(data, nul + 1, data.length), StandardCharsets.UTF_8);
            entries.put(keyword, text);
        }
        return new TextChunkMap(entries);
    }

    /**
     * Keyword of a {@code tEXt} chunk; empty for other chunk types and for text without a NUL separator.
     */
    static Optional<String> textKeyword(PngChunk chunk) {
        if (!chunk.isType(PngChunk.TEXT)) {
            return Optional.empty();
        }
        int nul = indexOfNul(chunk.data());
        return nul < 0
                ? Optional.empty()
                : Optional.of(new String(chunk.data(), 0, nul, StandardCharsets.ISO_8859_1));
    }

    private static void requireSignature(RawContainer png) throws MalformedContainerException {
        if (!hasSignature(png)) {
            throw new MalformedContainerException("Not a PNG: signature mismatch", 0);
        }
    }

    private static int indexOfNul(byte[] data) {
        for (int i = 0; i < data.length; i++) {
            if (data[i] == 0) return i;
        }
        return -1;
    }
}
