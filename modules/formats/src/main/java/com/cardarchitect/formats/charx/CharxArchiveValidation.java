package com.cardarchitect.formats.charx;

import java.util.List;

/**
 * Completeness report for a CHARX archive that was read back.
 *
 * @param missingAssets {@code embeded://} URIs with no matching archive entry
 */
public record CharxArchiveValidation(
        boolean valid,
        List<String> problems,
        boolean hasMainIcon,
        int assetCount,
        long totalSize,
        List<String> missingAssets
) {
    public CharxArchiveValidation {
        problems = List.copyOf(problems);
        missingAssets = List.copyOf(missingAssets);
    }
}
