package com.cardarchitect.formats.card;

import com.cardarchitect.types.AssetType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a v3 card's {@code data.assets} list.
 *
 * @param type  logical role; custom types collapse to {@link AssetType#OTHER}
 * @param name  "main" for the primary asset of its type, arbitrary otherwise
 * @param uri   embeded://, ccdefault:, http(s)://, data: or a storage reference
 * @param ext   file extension without dot, may be null
 */
public record AssetDescriptor(AssetType type, String name, String uri, String ext) {

    static AssetDescriptor fromJson(JsonNode node) {
        return new AssetDescriptor(
                AssetType.fromLabel(node.path("type").asText(null)),
                node.path("name").asText(""),
                node.path("uri").asText(""),
                node.path("ext").asText(null)
        );
    }
}
