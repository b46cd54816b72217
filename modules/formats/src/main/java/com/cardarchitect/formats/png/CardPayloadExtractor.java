package com.cardarchitect.formats.png;

import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.card.SpecDetector;
import com.cardarchitect.util.RawContainer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Locates the card document embedded in a PNG's text chunks.
 *
 * <p>Keywords are tried in priority order; for each keyword present, decoders are tried in order.
 * The first payload that decodes to a JSON object <em>and</em> classifies as v2 or v3 wins.
 * Everything is evaluated lazily and stops at the first success.
 */
public class CardPayloadExtractor {

    private static final Logger log = Logger.getLogger(CardPayloadExtractor.class);

    /**
     * v3-era keys, then v2-era keys, then keys written by other tools. Case matters.
     */
    public static final List<String> CARD_KEYS = List.of(
            "ccv3", "chara_card_v3",
            "chara", "ccv2", "character",
            "charactercard", "card", "CharacterCard", "Chara"
    );

    public static final List<PayloadDecoder> DEFAULT_DECODERS = List.of(
            PayloadDecoder.rawJson(),
            PayloadDecoder.base64Json()
    );

    private record Candidate(String keyword, ObjectNode json) {}

    private final PngChunkReader reader;
    private final SpecDetector specDetector;
    private final List<String> keys;
    private final List<PayloadDecoder> decoders;

    public CardPayloadExtractor() {
        this(new PngChunkReader(), new SpecDetector(), CARD_KEYS, DEFAULT_DECODERS);
    }

    public CardPayloadExtractor(PngChunkReader reader, SpecDetector specDetector,
                                List<String> keys, List<PayloadDecoder> decoders) {
        this.reader = reader;
        this.specDetector = specDetector;
        this.keys = List.copyOf(keys);
        this.decoders = List.copyOf(decoders);
    }

    /**
     * Extracts the card from a PNG.
     *
     * @return the card, or empty when the PNG carries no recognisable card data
     * @throws MalformedContainerException when the PNG framing itself is corrupt
     */
    public Optional<ExtractedCard> extract(RawContainer png) throws MalformedContainerException {
        TextChunkMap chunks = reader.readTextChunks(png);
        Optional<ExtractedCard> card = extract(chunks);
        if (card.isEmpty()) {
            log.debugf("No card data among tEXt keywords %s", chunks.keywords());
        }
        return card;
    }

    /**
     * Extracts the card from already-collected text chunks.
     */
    public Optional<ExtractedCard> extract(TextChunkMap chunks) {
        return keys.stream()
                .filter(chunks::contains)
                .flatMap(key -> decoders.stream()
                        .map(decoder -> decoder.decode(chunks.get(key).orElseThrow()))
                        .flatMap(Optional::stream)
                        .map(json -> new Candidate(key, json)))
                .flatMap(candidate -> specDetector.detect(candidate.json())
                        .map(spec -> new ExtractedCard(CardDocument.of(candidate.json()), spec, candidate.keyword()))
                        .stream())
                .findFirst()
                .map(found -> {
                    log.debugf("Found %s card under tEXt keyword '%s'", found.spec().label(), found.source());
                    return found;
                });
    }
}
