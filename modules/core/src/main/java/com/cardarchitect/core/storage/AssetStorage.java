package com.cardarchitect.core.storage;

import io.smallrye.mutiny.Uni;

/**
 * Storage for uploaded card asset files.
 *
 * <p>References are the {@code /storage/{file}} paths recorded on card assets; a bare file
 * name is accepted as well.
 */
public interface AssetStorage {

    /**
     * Reads a stored file.
     *
     * @throws AssetNotFoundException if nothing is stored under the reference
     * @throws StorageException on I/O errors or references outside the storage root
     */
    Uni<byte[]> read(String storageRef);

    Uni<Boolean> exists(String storageRef);

    /**
     * Stores a file under the given name, replacing any previous content.
     *
     * @return the {@code /storage/...} reference for the stored file
     * @throws StorageException on I/O errors
     */
    Uni<String> write(String filename, byte[] content);

    /**
     * Deletes a stored file.
     *
     * @throws AssetNotFoundException if nothing is stored under the reference
     */
    Uni<Void> delete(String storageRef);
}
