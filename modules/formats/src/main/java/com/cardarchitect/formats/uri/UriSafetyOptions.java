package com.cardarchitect.formats.uri;

/**
 * Opt-ins for URI schemes that are unsafe to dereference by default.
 *
 * @param allowHttp accept plain {@code http://} references
 * @param allowFile accept {@code file://} references
 */
public record UriSafetyOptions(boolean allowHttp, boolean allowFile) {

    private static final UriSafetyOptions STRICT = new UriSafetyOptions(false, false);

    public static UriSafetyOptions strict() {
        return STRICT;
    }
}
