package com.cardarchitect.formats.png;

import com.cardarchitect.formats.card.CardJson;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * One strategy for turning a {@code tEXt} payload into a JSON object.
 * Decoders never throw; a payload they cannot handle yields empty.
 */
@FunctionalInterface
public interface PayloadDecoder {

    Optional<ObjectNode> decode(String text);

    /** The payload is the JSON text itself. */
    static PayloadDecoder rawJson() {
        return CardJson::parseObject;
    }

    /** The payload is base64 of UTF-8 JSON. */
    static PayloadDecoder base64Json() {
        return text -> {
            String trimmed = text.trim();
            if (trimmed.isEmpty() || !Base64.isBase64(trimmed)) {
                return Optional.empty();
            }
            byte[] decoded = Base64.decodeBase64(trimmed);
            return CardJson.parseObject(new String(decoded, StandardCharsets.UTF_8));
        };
    }
}
