package com.cardarchitect.core.imports;

import java.util.List;

/**
 * An upload that cannot be imported as a card. Carries any warnings gathered before failing.
 */
public class CardImportException extends RuntimeException {

    private final List<String> warnings;

    public CardImportException(String message) {
        this(message, List.of(), null);
    }

    public CardImportException(String message, List<String> warnings) {
        this(message, warnings, null);
    }

    public CardImportException(String message, List<String> warnings, Throwable cause) {
        super(message, cause);
        this.warnings = List.copyOf(warnings);
    }

    public List<String> warnings() {
        return warnings;
    }
}
