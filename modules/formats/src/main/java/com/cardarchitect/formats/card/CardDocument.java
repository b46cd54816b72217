package com.cardarchitect.formats.card;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable spec-v2 or spec-v3 card document.
 *
 * <p>Holds a private copy of the JSON tree; {@link #node()} hands out copies too, so a
 * document can be shared between concurrent exports.
 */
public final class CardDocument {

    private final ObjectNode root;

    private CardDocument(ObjectNode root) {
        this.root = root;
    }

    public static CardDocument of(ObjectNode node) {
        Objects.requireNonNull(node, "node cannot be null");
        return new CardDocument(node.deepCopy());
    }

    /**
     * Parses a JSON object.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static CardDocument parse(String json) {
        return CardJson.parseObject(json)
                .map(CardDocument::new)
                .orElseThrow(() -> new IllegalArgumentException("Card JSON must be an object"));
    }

    /**
     * Returns a mutable deep copy of the JSON tree.
     */
    public ObjectNode node() {
        return root.deepCopy();
    }

    /**
     * Top-level {@code spec} field, if present.
     */
    public Optional<String> specField() {
        JsonNode spec = root.get("spec");
        return spec != null && spec.isTextual() ? Optional.of(spec.asText()) : Optional.empty();
    }

    /**
     * True when the card nests its fields under {@code data} (v3, and wrapped v2).
     */
    public boolean isWrapped() {
        return root.path("data").isObject();
    }

    /**
     * Character name: {@code data.name} for wrapped cards, top-level {@code name} for legacy v2.
     */
    public String name() {
        JsonNode name = isWrapped() ? root.path("data").path("name") : root.path("name");
        return name.isTextual() ? name.asText() : "";
    }

    /**
     * Entries of {@code data.assets}; empty for cards without an asset list.
     */
    public List<AssetDescriptor> assets() {
        JsonNode assets = root.path("data").path("assets");
        if (!assets.isArray()) {
            return List.of();
        }
        List<AssetDescriptor> result = new ArrayList<>();
        for (JsonNode asset : assets) {
            if (asset.isObject()) {
                result.add(AssetDescriptor.fromJson(asset));
            }
        }
        return List.copyOf(result);
    }

    public String toMinifiedJson() {
        return CardJson.minified(root);
    }

    public String toPrettyJson() {
        return CardJson.pretty(root);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CardDocument other)) return false;
        return root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "CardDocument[" + name() + "]";
    }
}
