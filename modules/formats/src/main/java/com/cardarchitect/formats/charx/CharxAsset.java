package com.cardarchitect.formats.charx;

import com.cardarchitect.formats.card.AssetDescriptor;

import java.util.Optional;

/**
 * An asset file found inside a CHARX archive.
 *
 * @param path       entry path, e.g. {@code assets/icon/png/0.png}
 * @param bytes      file contents
 * @param descriptor the card's descriptor whose {@code embeded://} URI points here, if any
 */
public record CharxAsset(String path, byte[] bytes, Optional<AssetDescriptor> descriptor) {

    public String filename() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
