package com.cardarchitect.core.assets;

import com.cardarchitect.core.storage.AssetNotFoundException;
import com.cardarchitect.core.storage.AssetStorage;
import com.cardarchitect.core.storage.StorageException;
import com.cardarchitect.formats.charx.ResolvedAsset;
import com.cardarchitect.formats.uri.MediaTypes;
import com.cardarchitect.formats.uri.UriSchemeResolver;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Fetches the files behind a card's asset records for packaging.
 *
 * <p>Never fails for a single asset: a missing or unreadable file yields a content-less
 * {@link ResolvedAsset}, which the archive builder reports as skipped.
 */
@ApplicationScoped
public class AssetResolutionService {

    private static final Logger log = Logger.getLogger(AssetResolutionService.class);
    private static final Detector DETECTOR = new DefaultDetector();

    @Inject
    public AssetStorage storage;

    private final UriSchemeResolver uris = new UriSchemeResolver();

    /**
     * Resolves records in order.
     */
    public Uni<List<ResolvedAsset>> resolve(List<CardAssetRecord> records) {
        return Multi.createFrom().iterable(records)
                .onItem().transformToUniAndConcatenate(this::resolveOne)
                .collect().asList();
    }

    Uni<ResolvedAsset> resolveOne(CardAssetRecord record) {
        ResolvedAsset unresolved = toResolved(record, record.mimetype(), null);
        if (!uris.isStorageReference(record.url())) {
            return Uni.createFrom().item(unresolved);
        }
        return storage.read(record.url())
                .onItem().transform(bytes -> toResolved(record, mimetypeOf(record, bytes), bytes))
                .onFailure(AssetNotFoundException.class).recoverWithItem(e -> {
                    log.warnf("Asset file missing for %s/%s: %s", record.type().label(), record.name(), record.url());
                    return unresolved;
                })
                .onFailure(StorageException.class).recoverWithItem(e -> {
                    log.warnf(e, "Failed to read asset %s/%s from %s", record.type().label(), record.name(), record.url());
                    return unresolved;
                });
    }

    private static ResolvedAsset toResolved(CardAssetRecord record, String mimetype, byte[] content) {
        return new ResolvedAsset(record.type(), record.name(), record.ext(), record.order(), record.main(),
                mimetype, record.url(), content);
    }

    private static String mimetypeOf(CardAssetRecord record, byte[] bytes) {
        if (record.mimetype() != null && !record.mimetype().isBlank()) {
            return record.mimetype();
        }
        return detectMimetype(bytes, record.name() + "." + record.ext());
    }

    /**
     * Sniffs a mimetype from content and file name; falls back to the extension table.
     */
    static String detectMimetype(byte[] bytes, String filename) {
        try (InputStream stream = new ByteArrayInputStream(bytes)) {
            Metadata metadata = new Metadata();
            metadata.set("resourceName", filename);
            MediaType detected = DETECTOR.detect(stream, metadata);
            if (!MediaType.OCTET_STREAM.equals(detected)) {
                return detected.getBaseType().toString();
            }
        } catch (IOException e) {
            log.debugf("Mimetype detection failed for %s: %s", filename, e.getMessage());
        }
        int dot = filename.lastIndexOf('.');
        return MediaTypes.mimeFromExtension(dot >= 0 ? filename.substring(dot + 1) : null);
    }
}
