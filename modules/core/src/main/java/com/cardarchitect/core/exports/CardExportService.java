package com.cardarchitect.core.exports;

import com.cardarchitect.core.assets.AssetResolutionService;
import com.cardarchitect.core.assets.CardAssetRecord;
import com.cardarchitect.formats.CardCodec;
import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.charx.CharxBuildResult;
import com.cardarchitect.formats.charx.CharxBuildValidation;
import com.cardarchitect.types.CardSpec;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.unchecked.Unchecked;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes cards out as PNG, CHARX or JSON.
 */
@ApplicationScoped
public class CardExportService {

    private static final Logger log = Logger.getLogger(CardExportService.class);

    private static final double MB = 1024.0 * 1024.0;

    @Inject
    CardCodec codec;

    @Inject
    AssetResolutionService assetResolution;

    @ConfigProperty(name = "cardarchitect.limits.max-png-size-mb", defaultValue = "4")
    int maxPngSizeMb;

    @ConfigProperty(name = "cardarchitect.limits.warn-png-size-mb", defaultValue = "2")
    int warnPngSizeMb;

    /**
     * Embeds the card into {@code baseImage}. Oversized output is reported as a warning only.
     *
     * @throws MalformedContainerException when the base image is not a PNG or has no IEND chunk
     */
    public PngExportResult exportPng(CardDocument card, byte[] baseImage) throws MalformedContainerException {
        CardSpec spec = codec.detectSpec(card).orElse(CardSpec.V2);
        byte[] png = codec.embedCard(baseImage, card, spec);

        List<String> warnings = new ArrayList<>();
        double sizeMb = png.length / MB;
        if (sizeMb > maxPngSizeMb) {
            warnings.add(String.format(Locale.ROOT,
                    "PNG size (%.2fMB) exceeds maximum (%dMB)", sizeMb, maxPngSizeMb));
        } else if (sizeMb > warnPngSizeMb) {
            warnings.add(String.format(Locale.ROOT,
                    "PNG size (%.2fMB) is large (recommended: <%dMB)", sizeMb, warnPngSizeMb));
        }

        log.infof("Exported %s card '%s' as PNG (%d bytes)", spec.label(), card.name(), png.length);
        return new PngExportResult(png, spec, warnings);
    }

    /**
     * Resolves the card's stored assets and packages everything into a CHARX archive.
     * Validation problems are logged; they do not stop the export.
     */
    public Uni<CharxBuildResult> exportCharx(CardDocument card, List<CardAssetRecord> assets) {
        return assetResolution.resolve(assets)
                .onItem().transform(Unchecked.function(resolved -> {
                    CharxBuildValidation validation = codec.validateCharxBuild(card, resolved);
                    for (String problem : validation.problems()) {
                        log.warnf("CHARX export of '%s': %s", card.name(), problem);
                    }
                    CharxBuildResult result = codec.buildCharx(card, resolved);
                    log.infof("Exported card '%s' as CHARX (%d assets, %d skipped, %d bytes)",
                            card.name(), result.assetCount(), result.skipped().size(), result.totalSize());
                    return result;
                }));
    }

    /**
     * Pretty-printed UTF-8 JSON.
     */
    public byte[] exportJson(CardDocument card) {
        return card.toPrettyJson().getBytes(StandardCharsets.UTF_8);
    }
}
