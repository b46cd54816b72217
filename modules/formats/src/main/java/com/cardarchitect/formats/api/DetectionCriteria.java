package com.cardarchitect.formats.api;

import java.util.Arrays;
import java.util.Set;

/**
 * Criteria for detecting when a handler should be used.
 *
 * @param mimeTypes    MIME types to match (e.g., "image/png", "application/*")
 * @param extensions   File extensions without dot (e.g., "png", "charx")
 * @param magicBytes   Magic bytes to match, or null if not applicable
 * @param magicOffset  Offset in header where magic bytes start
 * @param priority     Higher priority wins on conflict (e.g., PNG=300 beats CHARX=200)
 */
public record DetectionCriteria(
        Set<String> mimeTypes,
        Set<String> extensions,
        byte[] magicBytes,
        int magicOffset,
        int priority
) {
    public DetectionCriteria {
        mimeTypes = Set.copyOf(mimeTypes);
        extensions = Set.copyOf(extensions);
        if (magicBytes != null) {
            magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
        }
    }

    /**
     * Checks if this criteria matches the given file properties.
     */
    public boolean matches(String mimeType, String filename, byte[] header) {
        // Magic bytes first (most reliable)
        if (matchesMagic(header)) {
            return true;
        }

        if (mimeType != null) {
            if (mimeTypes.contains(mimeType)) {
                return true;
            }
            String baseType = mimeType.split("/")[0];
            if (mimeTypes.contains(baseType + "/*")) {
                return true;
            }
        }

        if (filename != null) {
            int dotIndex = filename.lastIndexOf('.');
            if (dotIndex > 0) {
                String ext = filename.substring(dotIndex + 1).toLowerCase();
                return extensions.contains(ext);
            }
        }

        return false;
    }

    /**
     * True when the header carries this format's magic bytes at {@link #magicOffset()}.
     */
    public boolean matchesMagic(byte[] header) {
        if (magicBytes == null || header == null) {
            return false;
        }
        int endOffset = magicOffset + magicBytes.length;
        if (header.length < endOffset) {
            return false;
        }
        return Arrays.equals(header, magicOffset, endOffset, magicBytes, 0, magicBytes.length);
    }
}
