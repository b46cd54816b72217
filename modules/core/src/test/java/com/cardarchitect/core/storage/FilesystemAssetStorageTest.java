package com.cardarchitect.core.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FilesystemAssetStorageTest {

    @TempDir
    Path root;

    private FilesystemAssetStorage storage;

    @BeforeEach
    void setUp() {
        storage = new FilesystemAssetStorage();
        storage.root = root.toString();
    }

    @Test
    void writeAndReadRoundTrip() {
        byte[] content = "portrait".getBytes(StandardCharsets.UTF_8);

        String ref = storage.write("icons/main.png", content).await().indefinitely();

        assertThat(ref).isEqualTo("/storage/icons/main.png");
        assertThat(storage.read(ref).await().indefinitely()).isEqualTo(content);
        assertThat(root.resolve("icons/main.png")).exists();
    }

    @Test
    void readAcceptsBareRelativePath() throws Exception {
        Files.writeString(root.resolve("bg.webp"), "bg");

        assertThat(storage.read("bg.webp").await().indefinitely())
                .isEqualTo("bg".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void existsReflectsFilePresence() throws Exception {
        assertThat(storage.exists("/storage/missing.png").await().indefinitely()).isFalse();

        Files.writeString(root.resolve("present.png"), "x");
        assertThat(storage.exists("/storage/present.png").await().indefinitely()).isTrue();
    }

    @Test
    void readMissingFileFailsWithNotFound() {
        assertThatThrownBy(() -> storage.read("/storage/nope.png").await().indefinitely())
                .isInstanceOf(AssetNotFoundException.class)
                .satisfies(e -> assertThat(((AssetNotFoundException) e).storageRef()).isEqualTo("/storage/nope.png"));
    }

    @Test
    void referencesEscapingRootAreRejected() {
        assertThatThrownBy(() -> storage.resolvePath("/storage/../../etc/passwd"))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("escapes");
        assertThatThrownBy(() -> storage.resolvePath("/storage/"))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> storage.resolvePath(" "))
                .isInstanceOf(StorageException.class);
    }

    @Test
    void deleteRemovesFileAndFailsWhenAbsent() throws Exception {
        Files.writeString(root.resolve("gone.png"), "x");

        storage.delete("/storage/gone.png").await().indefinitely();

        assertThat(root.resolve("gone.png")).doesNotExist();
        assertThatThrownBy(() -> storage.delete("/storage/gone.png").await().indefinitely())
                .isInstanceOf(AssetNotFoundException.class);
    }
}
