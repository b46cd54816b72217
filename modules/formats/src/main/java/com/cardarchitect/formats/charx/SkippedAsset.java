package com.cardarchitect.formats.charx;

/**
 * An asset left out of a CHARX archive.
 */
public record SkippedAsset(String type, String name, String storageRef, Reason reason) {

    public enum Reason {
        /** Remote or default reference; nothing to package. */
        NOT_LOCAL,
        /** Local reference whose file storage could not supply. */
        MISSING_FILE,
        /** Another asset already claimed the same archive path. */
        DUPLICATE_PATH
    }

    static SkippedAsset of(ResolvedAsset asset, Reason reason) {
        return new SkippedAsset(asset.type().label(), asset.name(), asset.storageRef(), reason);
    }
}
