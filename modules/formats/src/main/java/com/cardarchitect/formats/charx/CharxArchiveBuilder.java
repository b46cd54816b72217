package com.cardarchitect.formats.charx;

import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.uri.UriSchemeResolver;
import com.cardarchitect.types.AssetType;
import com.cardarchitect.types.UriScheme;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Packages a card and its assets into a CHARX (ZIP) archive.
 *
 * <p>Layout: {@code card.json} at the root (pretty-printed), asset files under
 * {@code assets/{type}/{subtype}/{order}.{ext}} where {@code subtype} is the mimetype's subtype.
 * Descriptors of packaged assets get their {@code uri} rewritten to the matching
 * {@code embeded://} path. Assets that cannot be packaged are skipped and reported, never fatal.
 *
 * <p>Entries carry a fixed timestamp, so identical input produces identical archives.
 */
public class CharxArchiveBuilder {

    private static final Logger log = Logger.getLogger(CharxArchiveBuilder.class);

    public static final String CARD_ENTRY = "card.json";

    // 1980-01-01T00:00:00Z, the earliest DOS timestamp
    private static final long FIXED_ENTRY_TIME = 315532800000L;

    private final UriSchemeResolver uris;

    public CharxArchiveBuilder() {
        this(new UriSchemeResolver());
    }

    public CharxArchiveBuilder(UriSchemeResolver uris) {
        this.uris = uris;
    }

    /**
     * Builds the archive.
     *
     * @throws IOException only if writing the in-memory ZIP stream fails
     */
    public CharxBuildResult build(CardDocument card, List<ResolvedAsset> assets) throws IOException {
        log.debugf("Building CHARX for '%s' with %d assets", card.name(), assets.size());

        List<SkippedAsset> skipped = new ArrayList<>();
        List<ResolvedAsset> packaged = selectPackaged(assets, skipped);

        CardDocument transformed = rewriteAssetUris(card, packaged);

        List<ArchiveEntry> entries = new ArrayList<>();
        entries.add(new ArchiveEntry(CARD_ENTRY, transformed.toPrettyJson().getBytes(StandardCharsets.UTF_8)));
        long assetBytes = 0;
        for (ResolvedAsset asset : packaged) {
            entries.add(new ArchiveEntry(archivePath(asset), asset.content()));
            assetBytes += asset.size();
        }

        byte[] archive = writeZip(entries);
        List<String> paths = entries.stream().map(ArchiveEntry::path).toList();

        log.debugf("CHARX build complete: %d bytes, %d/%d assets bundled",
                archive.length, packaged.size(), assets.size());

        return new CharxBuildResult(archive, transformed, packaged.size(), archive.length, assetBytes, paths, skipped);
    }

    /**
     * Archive path an asset is written to.
     */
    public String archivePath(ResolvedAsset asset) {
        return uris.archivePath(asset.type().label(), asset.subtype(), asset.order(), asset.ext());
    }

    private List<ResolvedAsset> selectPackaged(List<ResolvedAsset> assets, List<SkippedAsset> skipped) {
        List<ResolvedAsset> packaged = new ArrayList<>();
        Set<String> seenPaths = new HashSet<>();

        for (ResolvedAsset asset : assets) {
            if (!uris.isStorageReference(asset.storageRef())) {
                log.debugf("Not packaging %s/%s: %s is not a local reference",
                        asset.type().label(), asset.name(), asset.storageRef());
                skipped.add(SkippedAsset.of(asset, SkippedAsset.Reason.NOT_LOCAL));
            } else if (!asset.hasContent()) {
                log.warnf("Skipping asset %s/%s: file %s unavailable",
                        asset.type().label(), asset.name(), asset.storageRef());
                skipped.add(SkippedAsset.of(asset, SkippedAsset.Reason.MISSING_FILE));
            } else if (!seenPaths.add(archivePath(asset))) {
                log.warnf("Skipping asset %s/%s: archive path %s already used",
                        asset.type().label(), asset.name(), archivePath(asset));
                skipped.add(SkippedAsset.of(asset, SkippedAsset.Reason.DUPLICATE_PATH));
            } else {
                packaged.add(asset);
            }
        }
        return packaged;
    }

    private CardDocument rewriteAssetUris(CardDocument card, List<ResolvedAsset> packaged) {
        ObjectNode root = card.node();
        JsonNode descriptors = root.path("data").path("assets");
        if (!descriptors.isArray()) {
            return CardDocument.of(root);
        }

        for (JsonNode node : descriptors) {
            if (!(node instanceof ObjectNode descriptor)) {
                continue;
            }
            UriScheme current = uris.parse(descriptor.path("uri").asText("")).scheme();
            if (current == UriScheme.CCDEFAULT || current == UriScheme.HTTP
                    || current == UriScheme.HTTPS || current == UriScheme.DATA) {
                continue;
            }
            AssetType type = AssetType.fromLabel(descriptor.path("type").asText(null));
            String name = descriptor.path("name").asText("");
            findPackaged(packaged, type, name)
                    .ifPresent(asset -> descriptor.put("uri", uris.embedUri(archivePath(asset))));
        }
        return CardDocument.of(root);
    }

    private static Optional<ResolvedAsset> findPackaged(List<ResolvedAsset> packaged, AssetType type, String name) {
        return packaged.stream().filter(a -> a.matches(type, name)).findFirst();
    }

    private static byte[] writeZip(List<ArchiveEntry> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(out)) {
            zos.setEncoding("UTF-8");
            for (ArchiveEntry entry : entries) {
                ZipArchiveEntry zipEntry = new ZipArchiveEntry(entry.path());
                zipEntry.setTime(FIXED_ENTRY_TIME);
                zipEntry.setSize(entry.bytes().length);
                zos.putArchiveEntry(zipEntry);
                zos.write(entry.bytes());
                zos.closeArchiveEntry();
            }
        }
        return out.toByteArray();
    }
}
