package com.cardarchitect.formats.charx;

import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.types.CardSpec;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything read out of a CHARX archive.
 *
 * @param card        parsed {@code card.json}
 * @param spec        detected spec generation, empty if unclassifiable
 * @param assets      files under {@code assets/}, in archive order
 * @param metadata    {@code x_meta/{n}.json} objects keyed by {@code n}
 * @param moduleRisum raw {@code module.risum} bytes, if present
 */
public record CharxContents(
        CardDocument card,
        Optional<CardSpec> spec,
        List<CharxAsset> assets,
        Map<Integer, ObjectNode> metadata,
        Optional<byte[]> moduleRisum
) {
    public CharxContents {
        assets = List.copyOf(assets);
        metadata = Map.copyOf(metadata);
    }
}
