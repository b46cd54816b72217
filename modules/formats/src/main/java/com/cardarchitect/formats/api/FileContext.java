package com.cardarchitect.formats.api;

import java.util.Optional;

/**
 * Context information about an uploaded file being processed.
 */
public record FileContext(
        String filename,
        Optional<String> detectedMimeType
) {
    public static FileContext of(String filename) {
        return new FileContext(filename, Optional.empty());
    }

    public static FileContext of(String filename, String mimeType) {
        return new FileContext(filename, Optional.ofNullable(mimeType).filter(m -> !m.isBlank()));
    }

    public FileContext withMimeType(String mimeType) {
        return new FileContext(filename, Optional.of(mimeType));
    }
}
