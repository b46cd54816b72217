package com.cardarchitect.core.assets;

import com.cardarchitect.types.AssetType;

/**
 * An asset attached to a stored card, as recorded by the card repository.
 *
 * @param url      {@code /storage/...} for uploaded files, otherwise a remote or default URI
 * @param mimetype recorded mimetype, null when unknown
 */
public record CardAssetRecord(
        AssetType type,
        String name,
        String ext,
        int order,
        boolean main,
        String url,
        String mimetype
) {
}
