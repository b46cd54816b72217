package com.cardarchitect.core.assets;

import com.cardarchitect.core.storage.FilesystemAssetStorage;
import com.cardarchitect.formats.charx.ResolvedAsset;
import com.cardarchitect.types.AssetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AssetResolutionServiceTest {

    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0};

    @TempDir
    Path root;

    private AssetResolutionService service;

    @BeforeEach
    void setUp() {
        FilesystemAssetStorage storage = new FilesystemAssetStorage();
        storage.root = root.toString();
        service = new AssetResolutionService();
        service.storage = storage;
    }

    @Test
    void resolvesStoredFilesInOrder() throws Exception {
        Files.write(root.resolve("main.png"), PNG_MAGIC);
        Files.writeString(root.resolve("happy.png"), "smile");

        List<ResolvedAsset> resolved = service.resolve(List.of(
                new CardAssetRecord(AssetType.ICON, "main", "png", 0, true, "/storage/main.png", "image/png"),
                new CardAssetRecord(AssetType.EMOTION, "happy", "png", 1, false, "/storage/happy.png", "image/png")
        )).await().indefinitely();

        assertThat(resolved).extracting(ResolvedAsset::name).containsExactly("main", "happy");
        assertThat(resolved.get(0).content()).isEqualTo(PNG_MAGIC);
        assertThat(resolved).allMatch(ResolvedAsset::hasContent);
    }

    @Test
    void missingFileBecomesContentlessAsset() {
        List<ResolvedAsset> resolved = service.resolve(List.of(
                new CardAssetRecord(AssetType.BACKGROUND, "gone", "webp", 0, false, "/storage/gone.webp", null)
        )).await().indefinitely();

        assertThat(resolved).singleElement().satisfies(a -> {
            assertThat(a.hasContent()).isFalse();
            assertThat(a.storageRef()).isEqualTo("/storage/gone.webp");
        });
    }

    @Test
    void escapingReferenceBecomesContentlessAsset() {
        List<ResolvedAsset> resolved = service.resolve(List.of(
                new CardAssetRecord(AssetType.ICON, "evil", "png", 0, false, "/storage/../../secret.png", null)
        )).await().indefinitely();

        assertThat(resolved).singleElement().satisfies(a -> assertThat(a.hasContent()).isFalse());
    }

    @Test
    void remoteUrlsAreNotFetched() {
        List<ResolvedAsset> resolved = service.resolve(List.of(
                new CardAssetRecord(AssetType.BACKGROUND, "sky", "jpg", 0, false, "https://example.com/sky.jpg", null)
        )).await().indefinitely();

        assertThat(resolved).singleElement().satisfies(a -> {
            assertThat(a.hasContent()).isFalse();
            assertThat(a.storageRef()).isEqualTo("https://example.com/sky.jpg");
        });
    }

    @Test
    void sniffsMimetypeWhenNoneRecorded() throws Exception {
        Files.write(root.resolve("portrait.bin"), PNG_MAGIC);

        ResolvedAsset asset = service.resolveOne(
                new CardAssetRecord(AssetType.ICON, "portrait", "png", 0, true, "/storage/portrait.bin", null)
        ).await().indefinitely();

        assertThat(asset.mimetype()).isEqualTo("image/png");
    }

    @Test
    void detectionFallsBackToExtensionTable() {
        assertThat(AssetResolutionService.detectMimetype(new byte[]{1, 2, 3}, "bg.webp")).isEqualTo("image/webp");
    }
}
