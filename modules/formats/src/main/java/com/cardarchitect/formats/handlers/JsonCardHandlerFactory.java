package com.cardarchitect.formats.handlers;

import com.cardarchitect.formats.api.CardFormatHandler;
import com.cardarchitect.formats.api.CardFormatHandlerFactory;
import com.cardarchitect.formats.api.DetectionCriteria;
import com.cardarchitect.formats.api.FileContext;
import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.card.CardJson;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.card.SpecDetector;
import com.cardarchitect.util.RawContainer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handler for bare card JSON files.
 * Priority 100 (lower than the binary containers).
 */
@ApplicationScoped
public class JsonCardHandlerFactory implements CardFormatHandlerFactory {

    private static final byte[] JSON_MAGIC = new byte[]{'{'};
    private static final char BOM = '\uFEFF';

    private final SpecDetector specDetector = new SpecDetector();

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
                Set.of("application/json", "text/json"),
                Set.of("json"),
                JSON_MAGIC,
                0,
                100
        );
    }

    @Override
    public CardFormatHandler createInstance(RawContainer container, FileContext context) {
        return new JsonCardHandler(container);
    }

    private class JsonCardHandler implements CardFormatHandler {
        private final RawContainer container;

        JsonCardHandler(RawContainer container) {
            this.container = container;
        }

        @Override
        public String formatKey() {
            return "json";
        }

        @Override
        public Optional<ExtractedCard> extractCard() throws MalformedContainerException {
            String text = new String(container.toByteArray(), StandardCharsets.UTF_8);
            if (!text.isEmpty() && text.charAt(0) == BOM) {
                text = text.substring(1);
            }
            ObjectNode json = CardJson.parseObject(text)
                    .orElseThrow(() -> new MalformedContainerException("Card file is not a JSON object", 0));
            return specDetector.detect(json)
                    .map(spec -> new ExtractedCard(CardDocument.of(json), spec, "json"));
        }

        @Override
        public Map<String, Object> extractMetadata() {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("format", "JSON");
            metadata.put("size", container.length());
            return metadata;
        }
    }
}
