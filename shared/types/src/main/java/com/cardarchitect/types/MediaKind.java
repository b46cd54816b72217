package com.cardarchitect.types;

public enum MediaKind {
    IMAGE("image"),
    AUDIO("audio"),
    VIDEO("video"),
    OTHER("other");

    private final String label;

    MediaKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
