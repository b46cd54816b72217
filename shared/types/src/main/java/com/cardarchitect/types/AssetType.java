package com.cardarchitect.types;

/**
 * Logical role of an asset inside a card. Anything outside the known roles
 * (including {@code x-} prefixed custom types) collapses to {@link #OTHER}.
 */
public enum AssetType {
    ICON("icon"),
    BACKGROUND("background"),
    EMOTION("emotion"),
    USER_ICON("user_icon"),
    OTHER("other");

    private final String label;

    AssetType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AssetType fromLabel(String label) {
        if (label == null) return OTHER;
        for (AssetType t : values()) {
            if (t.label.equals(label)) return t;
        }
        return OTHER;
    }
}
