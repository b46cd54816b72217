package com.cardarchitect.core.storage;

/**
 * Thrown when a read or delete targets an asset file that does not exist.
 */
public class AssetNotFoundException extends RuntimeException {

    private final String storageRef;

    public AssetNotFoundException(String storageRef) {
        super("Asset file not found: " + storageRef);
        this.storageRef = storageRef;
    }

    public String storageRef() {
        return storageRef;
    }
}
