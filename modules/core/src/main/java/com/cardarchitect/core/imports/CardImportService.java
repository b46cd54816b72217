package com.cardarchitect.core.imports;

import com.cardarchitect.formats.api.CardFormatHandler;
import com.cardarchitect.formats.api.FileContext;
import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.AssetDescriptor;
import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.charx.CharxAsset;
import com.cardarchitect.formats.registry.CardFormatRegistry;
import com.cardarchitect.formats.uri.UriSafetyOptions;
import com.cardarchitect.formats.uri.UriSchemeResolver;
import com.cardarchitect.util.RawContainer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns an uploaded PNG, CHARX or JSON file into a normalised card.
 */
@ApplicationScoped
public class CardImportService {

    private static final Logger log = Logger.getLogger(CardImportService.class);

    private static final double MB = 1024.0 * 1024.0;

    @Inject
    CardFormatRegistry registry;

    @ConfigProperty(name = "cardarchitect.limits.max-png-size-mb", defaultValue = "4")
    int maxPngSizeMb;

    @ConfigProperty(name = "cardarchitect.limits.warn-png-size-mb", defaultValue = "2")
    int warnPngSizeMb;

    @ConfigProperty(name = "cardarchitect.limits.max-card-size-mb", defaultValue = "5")
    int maxCardSizeMb;

    @ConfigProperty(name = "cardarchitect.limits.warn-card-size-mb", defaultValue = "2")
    int warnCardSizeMb;

    @ConfigProperty(name = "cardarchitect.uri.allow-http", defaultValue = "false")
    boolean allowHttp;

    @ConfigProperty(name = "cardarchitect.uri.allow-file", defaultValue = "false")
    boolean allowFile;

    private final CardNormalizer normalizer = new CardNormalizer();
    private final UriSchemeResolver uris = new UriSchemeResolver();

    /**
     * Imports one uploaded file.
     *
     * @param mimeType declared content type, may be null
     * @throws CardImportException when the file is too large, of an unsupported type, corrupt,
     *                             or carries no recognisable card
     */
    public ImportResult importCard(byte[] bytes, String filename, String mimeType) {
        RawContainer container = RawContainer.wrap(bytes);
        FileContext context = FileContext.of(filename, mimeType);
        List<String> warnings = new ArrayList<>();

        CardFormatHandler handler = registry.findHandler(container, context)
                .orElseThrow(() -> new CardImportException("Unsupported file type: " + describe(filename, mimeType)
                        + ". Only JSON, PNG, and CHARX files are supported."));
        String format = handler.formatKey();

        switch (format) {
            case "png" -> checkSize("PNG", bytes.length, maxPngSizeMb, warnPngSizeMb, warnings);
            case "json" -> checkSize("Card JSON", bytes.length, maxCardSizeMb, warnCardSizeMb, warnings);
            default -> { }
        }

        ExtractedCard extracted;
        List<CharxAsset> assets;
        try {
            extracted = handler.extractCard().orElseThrow(() -> new CardImportException(notFoundMessage(format), warnings));
            assets = handler.extractAssets();
        } catch (MalformedContainerException e) {
            log.warnf("Failed to extract card from %s %s: %s", format, filename, e.getMessage());
            throw new CardImportException("Failed to extract card from " + format.toUpperCase(Locale.ROOT)
                    + ": " + e.getMessage(), warnings, e);
        }

        CardDocument card = CardDocument.of(normalizer.normalize(extracted.card().node(), extracted.spec()));
        warnings.addAll(unsafeAssetWarnings(card));

        log.infof("Imported %s card '%s' from %s (%s, %d assets, %d warnings)",
                extracted.spec().label(), card.name(), filename, format, assets.size(), warnings.size());

        return new ImportResult(card, extracted.spec(), format, warnings, assets);
    }

    UriSafetyOptions uriSafetyOptions() {
        return new UriSafetyOptions(allowHttp, allowFile);
    }

    private List<String> unsafeAssetWarnings(CardDocument card) {
        UriSafetyOptions options = uriSafetyOptions();
        List<String> warnings = new ArrayList<>();
        for (AssetDescriptor asset : card.assets()) {
            if (!uris.isStorageReference(asset.uri()) && !uris.isSafe(asset.uri(), options)) {
                warnings.add("Asset '" + asset.name() + "' has an unsafe URI and will not be loaded: " + asset.uri());
            }
        }
        return warnings;
    }

    private static void checkSize(String label, long size, int maxMb, int warnMb, List<String> warnings) {
        double sizeMb = size / MB;
        if (sizeMb > maxMb) {
            throw new CardImportException(String.format(Locale.ROOT,
                    "%s size (%.2fMB) exceeds maximum (%dMB)", label, sizeMb, maxMb), warnings);
        }
        if (sizeMb > warnMb) {
            warnings.add(String.format(Locale.ROOT,
                    "%s size (%.2fMB) is large (recommended: <%dMB)", label, sizeMb, warnMb));
        }
    }

    private static String notFoundMessage(String format) {
        return switch (format) {
            case "png" -> "No character card data found in PNG";
            case "charx" -> "CHARX card.json is not a v2 or v3 character card";
            default -> "Invalid card format: unable to detect v2 or v3 spec";
        };
    }

    private static String describe(String filename, String mimeType) {
        return mimeType != null ? mimeType : String.valueOf(filename);
    }
}
