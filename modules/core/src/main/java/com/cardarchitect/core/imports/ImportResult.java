package com.cardarchitect.core.imports;

import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.charx.CharxAsset;
import com.cardarchitect.types.CardSpec;

import java.util.List;

/**
 * A successfully imported card.
 *
 * @param card     normalised document, always wrapped ({@code spec}, {@code spec_version}, {@code data})
 * @param format   container it came from: "png", "charx" or "json"
 * @param warnings non-fatal findings for the user
 * @param assets   files bundled in a CHARX; empty for other formats
 */
public record ImportResult(
        CardDocument card,
        CardSpec spec,
        String format,
        List<String> warnings,
        List<CharxAsset> assets
) {
    public ImportResult {
        warnings = List.copyOf(warnings);
        assets = List.copyOf(assets);
    }
}
