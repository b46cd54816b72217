package com.cardarchitect.formats.handlers;

import com.cardarchitect.formats.api.CardFormatHandler;
import com.cardarchitect.formats.api.CardFormatHandlerFactory;
import com.cardarchitect.formats.api.DetectionCriteria;
import com.cardarchitect.formats.api.FileContext;
import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.charx.CharxArchiveBuilder;
import com.cardarchitect.formats.charx.CharxArchiveReader;
import com.cardarchitect.formats.charx.CharxAsset;
import com.cardarchitect.formats.charx.CharxContents;
import com.cardarchitect.util.RawContainer;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handler for CHARX archives (ZIP with {@code card.json} at the root).
 * Priority 200.
 */
@ApplicationScoped
public class CharxCardHandlerFactory implements CardFormatHandlerFactory {

    private static final byte[] ZIP_MAGIC = new byte[]{0x50, 0x4B, 0x03, 0x04}; // "PK\u0003\u0004"

    private final CharxArchiveReader reader = new CharxArchiveReader();

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
                Set.of("application/zip", "application/x-zip-compressed"),
                Set.of("charx", "zip"),
                ZIP_MAGIC,
                0,
                200
        );
    }

    @Override
    public CardFormatHandler createInstance(RawContainer container, FileContext context) {
        return new CharxCardHandler(container);
    }

    private class CharxCardHandler implements CardFormatHandler {
        private final RawContainer container;
        private CharxContents contents;

        CharxCardHandler(RawContainer container) {
            this.container = container;
        }

        @Override
        public String formatKey() {
            return "charx";
        }

        @Override
        public Optional<ExtractedCard> extractCard() throws MalformedContainerException {
            CharxContents read = contents();
            return read.spec().map(spec -> new ExtractedCard(read.card(), spec, CharxArchiveBuilder.CARD_ENTRY));
        }

        @Override
        public List<CharxAsset> extractAssets() throws MalformedContainerException {
            return contents().assets();
        }

        @Override
        public Map<String, Object> extractMetadata() {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("format", "CHARX");
            metadata.put("size", container.length());
            if (contents != null) {
                metadata.put("assetCount", contents.assets().size());
                metadata.put("hasModuleRisum", contents.moduleRisum().isPresent());
            }
            return metadata;
        }

        private CharxContents contents() throws MalformedContainerException {
            if (contents == null) {
                contents = reader.read(container.toByteArray());
            }
            return contents;
        }
    }
}
