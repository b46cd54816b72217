package com.cardarchitect.formats.card;

import com.cardarchitect.types.CardSpec;
import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Decides whether a JSON document is a v2 card, a v3 card, or neither.
 *
 * <p>Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>{@code spec} equals {@code chara_card_v3}</li>
 *   <li>{@code spec} equals {@code chara_card_v2}, or {@code spec_version} is 2.0</li>
 *   <li>any other {@code spec} on a wrapped card with a {@code data.name}: v3 when the spec
 *       mentions "3", v2 when it mentions "2", v3 otherwise</li>
 *   <li>a non-empty top-level {@code name} next to a legacy character field</li>
 * </ol>
 * The order is load-bearing: an ambiguous document (for example a v2 card with a {@code data.name}
 * inside its extensions) is classified by whichever rule fires first.
 */
public class SpecDetector {

    private static final Logger log = Logger.getLogger(SpecDetector.class);

    record Rule(String name, Function<JsonNode, Optional<CardSpec>> classify) {

        static Rule fixed(String name, Predicate<JsonNode> matches, CardSpec spec) {
            return new Rule(name, n -> matches.test(n) ? Optional.of(spec) : Optional.empty());
        }
    }

    private static final List<Rule> RULES = List.of(
            Rule.fixed("explicit-v3", n -> specIs(n, CardSpec.V3), CardSpec.V3),
            Rule.fixed("explicit-v2", n -> specIs(n, CardSpec.V2) || isV2SpecVersion(n.get("spec_version")), CardSpec.V2),
            new Rule("wrapped", SpecDetector::inferWrapped),
            Rule.fixed("legacy-v2", SpecDetector::isLegacyV2, CardSpec.V2)
    );

    /**
     * Classifies a parsed JSON document.
     *
     * @return the spec, or empty for non-objects and unrecognisable shapes
     */
    public Optional<CardSpec> detect(JsonNode json) {
        if (json == null || !json.isObject()) {
            return Optional.empty();
        }
        for (Rule rule : RULES) {
            Optional<CardSpec> spec = rule.classify().apply(json);
            if (spec.isPresent()) {
                log.debugf("Detected %s via rule %s", spec.get(), rule.name());
                return spec;
            }
        }
        return Optional.empty();
    }

    public Optional<CardSpec> detect(CardDocument card) {
        return detect(card.node());
    }

    private static boolean specIs(JsonNode node, CardSpec spec) {
        JsonNode field = node.get("spec");
        return field != null && field.isTextual() && spec.discriminator().equals(field.asText());
    }

    private static boolean isV2SpecVersion(JsonNode version) {
        if (version == null) return false;
        if (version.isTextual()) return "2.0".equals(version.asText());
        return version.isNumber() && version.asDouble() == 2.0;
    }

    private static Optional<CardSpec> inferWrapped(JsonNode node) {
        JsonNode spec = node.get("spec");
        if (!isTruthy(spec) || !node.path("data").isObject() || !hasDataName(node)) {
            return Optional.empty();
        }
        if (spec.isTextual()) {
            String text = spec.asText();
            if (text.contains("3")) return Optional.of(CardSpec.V3);
            if (text.contains("2")) return Optional.of(CardSpec.V2);
        }
        return Optional.of(CardSpec.V3);
    }

    private static boolean isTruthy(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return false;
        if (value.isTextual()) return !value.asText().isEmpty();
        if (value.isBoolean()) return value.asBoolean();
        if (value.isNumber()) return value.asDouble() != 0.0;
        return true;
    }

    private static boolean hasDataName(JsonNode node) {
        JsonNode name = node.path("data").path("name");
        return name.isTextual() && !name.asText().isEmpty();
    }

    private static boolean isLegacyV2(JsonNode node) {
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            return false;
        }
        return node.has("description") || node.has("personality") || node.has("scenario");
    }
}
