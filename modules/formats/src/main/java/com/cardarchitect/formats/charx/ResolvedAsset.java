package com.cardarchitect.formats.charx;

import com.cardarchitect.formats.uri.MediaTypes;
import com.cardarchitect.types.AssetType;

/**
 * An asset of a card paired with the bytes fetched from storage.
 *
 * @param type       logical role, also the first directory under {@code assets/}
 * @param name       descriptor name, matched together with {@code type}
 * @param ext        file extension without dot
 * @param order      position among siblings of the same type; becomes the archive file name
 * @param main       primary asset of its type
 * @param mimetype   recorded mimetype; its subtype names the second directory
 * @param storageRef where the bytes came from ({@code /storage/...}, or a remote URL)
 * @param content    file bytes, null when storage could not supply them
 */
public record ResolvedAsset(
        AssetType type,
        String name,
        String ext,
        int order,
        boolean main,
        String mimetype,
        String storageRef,
        byte[] content
) {

    public boolean hasContent() {
        return content != null;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }

    public String subtype() {
        return MediaTypes.subtype(mimetype);
    }

    public boolean matches(AssetType descriptorType, String descriptorName) {
        return type == descriptorType && name.equals(descriptorName);
    }

    public ResolvedAsset withoutContent() {
        return new ResolvedAsset(type, name, ext, order, main, mimetype, storageRef, null);
    }
}
