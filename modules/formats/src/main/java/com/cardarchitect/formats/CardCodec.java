package com.cardarchitect.formats;

import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.card.SpecDetector;
import com.cardarchitect.formats.charx.CharxArchiveBuilder;
import com.cardarchitect.formats.charx.CharxArchiveReader;
import com.cardarchitect.formats.charx.CharxArchiveValidation;
import com.cardarchitect.formats.charx.CharxBuildResult;
import com.cardarchitect.formats.charx.CharxBuildValidation;
import com.cardarchitect.formats.charx.CharxBuildValidator;
import com.cardarchitect.formats.charx.CharxContents;
import com.cardarchitect.formats.charx.ResolvedAsset;
import com.cardarchitect.formats.png.CardPayloadExtractor;
import com.cardarchitect.formats.png.PngChunkInjector;
import com.cardarchitect.formats.uri.ParsedUri;
import com.cardarchitect.formats.uri.UriSafetyOptions;
import com.cardarchitect.formats.uri.UriSchemeResolver;
import com.cardarchitect.types.CardSpec;
import com.cardarchitect.util.RawContainer;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Entry point to the card container codec.
 *
 * <p>Stateless; every call allocates its own output and never touches the input arrays,
 * so one instance serves concurrent requests.
 */
@ApplicationScoped
public class CardCodec {

    private final SpecDetector specDetector = new SpecDetector();
    private final UriSchemeResolver uris = new UriSchemeResolver();
    private final CardPayloadExtractor extractor = new CardPayloadExtractor();
    private final PngChunkInjector injector = new PngChunkInjector();
    private final CharxArchiveBuilder charxBuilder = new CharxArchiveBuilder(uris);
    private final CharxBuildValidator charxValidator = new CharxBuildValidator();
    private final CharxArchiveReader charxReader = new CharxArchiveReader(specDetector, uris);

    /**
     * Finds the card embedded in a PNG.
     *
     * @return empty when the PNG is well-formed but carries no recognisable card
     * @throws MalformedContainerException when the PNG framing is corrupt
     */
    public Optional<ExtractedCard> extractCard(byte[] png) throws MalformedContainerException {
        return extractor.extract(RawContainer.wrap(png));
    }

    /**
     * Embeds a card into a PNG under the keyword of its spec generation, as minified JSON.
     * Card chunks already in the image are dropped first, under every keyword the extractor reads.
     *
     * @throws MalformedContainerException when the PNG framing is corrupt or has no IEND chunk
     */
    public byte[] embedCard(byte[] png, CardDocument card, CardSpec spec) throws MalformedContainerException {
        byte[] base = injector.strip(RawContainer.wrap(png), CardPayloadExtractor.CARD_KEYS);
        return injector.embed(RawContainer.wrap(base), spec.pngKeyword(), card.toMinifiedJson());
    }

    /**
     * Embeds a card, detecting its spec generation. Unclassifiable documents go under {@code chara}.
     */
    public byte[] embedCard(byte[] png, CardDocument card) throws MalformedContainerException {
        return embedCard(png, card, specDetector.detect(card).orElse(CardSpec.V2));
    }

    public CharxBuildResult buildCharx(CardDocument card, List<ResolvedAsset> assets) throws IOException {
        return charxBuilder.build(card, assets);
    }

    public CharxBuildValidation validateCharxBuild(CardDocument card, List<ResolvedAsset> assets) {
        return charxValidator.validate(card, assets);
    }

    public CharxContents readCharx(byte[] archive) throws MalformedContainerException {
        return charxReader.read(archive);
    }

    public CharxArchiveValidation validateCharx(CharxContents contents) {
        return charxReader.validate(contents);
    }

    public Optional<CardSpec> detectSpec(CardDocument card) {
        return specDetector.detect(card);
    }

    public ParsedUri parseUri(String uri) {
        return uris.parse(uri);
    }

    public boolean isUriSafe(String uri, UriSafetyOptions options) {
        return uris.isSafe(uri, options);
    }

    public UriSchemeResolver uris() {
        return uris;
    }
}
