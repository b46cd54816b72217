package com.cardarchitect.core.exports;

import com.cardarchitect.types.CardSpec;

import java.util.List;

/**
 * A card embedded into a PNG.
 *
 * @param spec     generation the card was embedded as; decides the tEXt keyword
 * @param warnings size advisories, never blocking
 */
public record PngExportResult(byte[] png, CardSpec spec, List<String> warnings) {

    public PngExportResult {
        warnings = List.copyOf(warnings);
    }
}
