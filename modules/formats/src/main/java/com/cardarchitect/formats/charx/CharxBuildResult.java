package com.cardarchitect.formats.charx;

import com.cardarchitect.formats.card.CardDocument;

import java.util.List;

/**
 * Outcome of a CHARX build.
 *
 * @param archive    the ZIP bytes
 * @param card       the document written to {@code card.json}, URIs rewritten
 * @param assetCount asset files actually packaged
 * @param totalSize  size of the finished archive in bytes
 * @param assetBytes uncompressed bytes of the packaged asset files
 * @param entryPaths every entry written, in order
 * @param skipped    assets left out, with the reason
 */
public record CharxBuildResult(
        byte[] archive,
        CardDocument card,
        int assetCount,
        long totalSize,
        long assetBytes,
        List<String> entryPaths,
        List<SkippedAsset> skipped
) {
    public CharxBuildResult {
        entryPaths = List.copyOf(entryPaths);
        skipped = List.copyOf(skipped);
    }
}
