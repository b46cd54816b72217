package com.cardarchitect.core.storage;

import com.cardarchitect.formats.uri.UriSchemeResolver;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed AssetStorage.
 *
 * <p>Layout: {@code {root}/{file}}, addressed as {@code /storage/{file}}.
 * References that normalise to a path outside the root are rejected.
 */
@ApplicationScoped
public class FilesystemAssetStorage implements AssetStorage {

    @ConfigProperty(name = "cardarchitect.storage.root")
    public String root;

    Path rootPath() {
        return Path.of(root).toAbsolutePath().normalize();
    }

    Path resolvePath(String storageRef) {
        if (storageRef == null || storageRef.isBlank()) {
            throw new StorageException("Empty storage reference");
        }
        String relative = storageRef.startsWith(UriSchemeResolver.STORAGE_PREFIX)
                ? storageRef.substring(UriSchemeResolver.STORAGE_PREFIX.length())
                : storageRef;
        Path base = rootPath();
        Path path = base.resolve(relative).normalize();
        if (!path.startsWith(base) || path.equals(base)) {
            throw new StorageException("Storage reference escapes storage root: " + storageRef);
        }
        return path;
    }

    @Override
    public Uni<byte[]> read(String storageRef) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(storageRef);
            if (!Files.isRegularFile(path)) {
                throw new AssetNotFoundException(storageRef);
            }
            try {
                return Files.readAllBytes(path);
            } catch (IOException e) {
                throw new StorageException("Failed to read asset: " + storageRef, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String storageRef) {
        return Uni.createFrom().item(() -> Files.isRegularFile(resolvePath(storageRef)));
    }

    @Override
    public Uni<String> write(String filename, byte[] content) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(filename);
            try {
                Files.createDirectories(path.getParent());
                Path tmp = Files.createTempFile(path.getParent(), ".upload-", ".tmp");
                Files.write(tmp, content);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StorageException("Failed to write asset: " + filename, e);
            }
            return UriSchemeResolver.STORAGE_PREFIX + rootPath().relativize(path).toString().replace('\\', '/');
        });
    }

    @Override
    public Uni<Void> delete(String storageRef) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(storageRef);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new AssetNotFoundException(storageRef);
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete asset: " + storageRef, e);
            }
        });
    }
}
