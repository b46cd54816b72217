package com.cardarchitect.types;

/**
 * Classification of an asset reference.
 *
 * <p>{@link #EMBEDED} keeps the archive ecosystem's {@code embeded} spelling as its label.
 */
public enum UriScheme {
    CCDEFAULT("ccdefault"),
    EMBEDED("embeded"),
    HTTPS("https"),
    HTTP("http"),
    DATA("data"),
    FILE("file"),
    INTERNAL("internal"),
    UNKNOWN("unknown");

    private final String label;

    UriScheme(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static UriScheme fromLabel(String label) {
        for (UriScheme s : values()) {
            if (s.label.equals(label)) return s;
        }
        throw new IllegalArgumentException("Unknown UriScheme label: " + label);
    }
}
