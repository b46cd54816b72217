package com.cardarchitect.core.imports;

import com.cardarchitect.types.CardSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Locale;

/**
 * Repairs common deviations in imported cards so they validate against their spec.
 *
 * <ul>
 *   <li>wrapped cards get the canonical {@code spec} value for their detected generation</li>
 *   <li>a {@code null} {@code character_book} is removed</li>
 *   <li>lorebook entries get defaults for missing required fields and a canonical {@code position}</li>
 *   <li>legacy flat v2 cards are wrapped in {@code {spec, spec_version, data}}</li>
 * </ul>
 */
public class CardNormalizer {

    static final List<String> V3_ENTRY_FIELDS = List.of(
            "probability", "depth", "use_regex", "scan_frequency", "role",
            "group", "automation_id", "selective_logic", "selectiveLogic");

    /**
     * Returns a normalised copy; the input is not modified.
     */
    public ObjectNode normalize(ObjectNode card, CardSpec spec) {
        ObjectNode result = card.deepCopy();

        fixSpecValue(result, spec);

        JsonNode data = result.get("data");
        if (data instanceof ObjectNode dataObj) {
            dropNullCharacterBook(dataObj);
            normalizeLorebook(dataObj, spec);
        } else {
            dropNullCharacterBook(result);
            normalizeLorebook(result, spec);
        }

        if (spec == CardSpec.V2 && !(data instanceof ObjectNode) && result.path("name").isTextual()) {
            return wrapLegacy(result);
        }
        return result;
    }

    private static void fixSpecValue(ObjectNode card, CardSpec spec) {
        if (!card.has("spec") || spec.discriminator().equals(card.path("spec").asText(null))) {
            return;
        }
        card.put("spec", spec.discriminator());
        String version = card.path("spec_version").asText("");
        if (spec == CardSpec.V2 && version.isEmpty()) {
            card.put("spec_version", "2.0");
        } else if (spec == CardSpec.V3 && !version.startsWith("3")) {
            card.put("spec_version", "3.0");
        }
    }

    private static void dropNullCharacterBook(ObjectNode holder) {
        if (holder.has("character_book") && holder.get("character_book").isNull()) {
            holder.remove("character_book");
        }
    }

    private static void normalizeLorebook(ObjectNode holder, CardSpec spec) {
        JsonNode entries = holder.path("character_book").path("entries");
        if (!entries.isArray()) {
            return;
        }
        for (JsonNode node : entries) {
            if (node instanceof ObjectNode entry) {
                normalizeEntry(entry, spec);
            }
        }
    }

    static void normalizeEntry(ObjectNode entry, CardSpec spec) {
        if (!entry.path("keys").isArray()) {
            entry.putArray("keys");
        }
        if (!entry.path("content").isTextual()) {
            entry.put("content", "");
        }
        if (!entry.path("enabled").isBoolean()) {
            entry.put("enabled", true);
        }
        if (!entry.path("insertion_order").isNumber()) {
            entry.put("insertion_order", 100);
        }
        if (!entry.path("extensions").isObject()) {
            entry.putObject("extensions");
        }

        if (entry.has("position")) {
            JsonNode position = entry.get("position");
            if (position.isNumber()) {
                entry.put("position", position.asInt() == 0 ? "before_char" : "after_char");
            } else if (position.isTextual()) {
                entry.put("position", canonicalPosition(position.asText()));
            } else if (position.isNull()) {
                entry.remove("position");
            }
        }

        if (spec == CardSpec.V2) {
            ObjectNode extensions = (ObjectNode) entry.get("extensions");
            for (String field : V3_ENTRY_FIELDS) {
                if (entry.has(field)) {
                    extensions.set(field, entry.remove(field));
                }
            }
        }
    }

    private static String canonicalPosition(String raw) {
        String pos = raw.toLowerCase(Locale.ROOT);
        if (pos.contains("before") || pos.equals("0")) {
            return "before_char";
        }
        // "after", "1" and anything unrecognised
        return "after_char";
    }

    private static ObjectNode wrapLegacy(ObjectNode flat) {
        ObjectNode wrapped = flat.objectNode();
        wrapped.put("spec", CardSpec.V2.discriminator());
        wrapped.put("spec_version", "2.0");
        wrapped.set("data", flat);
        return wrapped;
    }
}
