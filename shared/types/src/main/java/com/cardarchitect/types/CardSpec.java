package com.cardarchitect.types;

/**
 * Character card schema generation.
 */
public enum CardSpec {
    V2("v2", "chara_card_v2"),
    V3("v3", "chara_card_v3");

    private final String label;
    private final String discriminator;

    CardSpec(String label, String discriminator) {
        this.label = label;
        this.discriminator = discriminator;
    }

    public String label() {
        return label;
    }

    /** Value of the top-level {@code spec} field for wrapped cards of this generation. */
    public String discriminator() {
        return discriminator;
    }

    /**
     * PNG tEXt keyword this generation is embedded under.
     */
    public String pngKeyword() {
        return this == V3 ? "ccv3" : "chara";
    }

    public static CardSpec fromLabel(String label) {
        for (CardSpec s : values()) {
            if (s.label.equals(label)) return s;
        }
        throw new IllegalArgumentException("Unknown CardSpec label: " + label);
    }
}
