package com.cardarchitect.formats.handlers;

import com.cardarchitect.formats.api.CardFormatHandler;
import com.cardarchitect.formats.api.CardFormatHandlerFactory;
import com.cardarchitect.formats.api.DetectionCriteria;
import com.cardarchitect.formats.api.FileContext;
import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.png.CardPayloadExtractor;
import com.cardarchitect.formats.png.PngChunkReader;
import com.cardarchitect.formats.png.TextChunkMap;
import com.cardarchitect.util.RawContainer;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handler for cards embedded in PNG {@code tEXt} chunks.
 * Priority 300, the highest: a PNG is never mistaken for anything else.
 */
@ApplicationScoped
public class PngCardHandlerFactory implements CardFormatHandlerFactory {

    private static final Logger log = Logger.getLogger(PngCardHandlerFactory.class);

    private static final byte[] PNG_MAGIC = new byte[]{(byte) 0x89, 0x50, 0x4E, 0x47}; // "\x89PNG"

    private final PngChunkReader reader = new PngChunkReader();
    private final CardPayloadExtractor extractor = new CardPayloadExtractor();

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
                Set.of("image/png"),
                Set.of("png"),
                PNG_MAGIC,
                0,
                300
        );
    }

    @Override
    public CardFormatHandler createInstance(RawContainer container, FileContext context) {
        return new PngCardHandler(container, context);
    }

    private class PngCardHandler implements CardFormatHandler {
        private final RawContainer container;
        private final FileContext context;

        PngCardHandler(RawContainer container, FileContext context) {
            this.container = container;
            this.context = context;
        }

        @Override
        public String formatKey() {
            return "png";
        }

        @Override
        public Optional<ExtractedCard> extractCard() throws MalformedContainerException {
            return extractor.extract(container);
        }

        @Override
        public Map<String, Object> extractMetadata() {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("format", "PNG");
            metadata.put("size", container.length());
            try {
                TextChunkMap chunks = reader.readTextChunks(container);
                metadata.put("textKeywords", Set.copyOf(chunks.keywords()));
            } catch (MalformedContainerException e) {
                log.debugf("PNG %s is malformed: %s", context.filename(), e.getMessage());
                metadata.put("malformed", e.getMessage());
            }
            return metadata;
        }
    }
}
