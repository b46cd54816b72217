package com.cardarchitect.formats.uri;

import com.cardarchitect.types.UriScheme;

import java.util.Optional;

/**
 * Classified asset reference. Which optional fields are set depends on the scheme:
 * {@code path} for embeded, file and internal; {@code url} for http(s);
 * {@code data}, {@code mimeType} and {@code encoding} for data URIs.
 */
public record ParsedUri(
        UriScheme scheme,
        String originalUri,
        String path,
        String url,
        String data,
        String mimeType,
        String encoding
) {

    static ParsedUri bare(UriScheme scheme, String originalUri) {
        return new ParsedUri(scheme, originalUri, null, null, null, null, null);
    }

    static ParsedUri withPath(UriScheme scheme, String originalUri, String path) {
        return new ParsedUri(scheme, originalUri, path, null, null, null, null);
    }

    static ParsedUri withUrl(UriScheme scheme, String originalUri, String url) {
        return new ParsedUri(scheme, originalUri, null, url, null, null, null);
    }

    public boolean isBase64() {
        return "base64".equals(encoding);
    }

    public Optional<String> pathOpt() {
        return Optional.ofNullable(path);
    }

    public Optional<String> urlOpt() {
        return Optional.ofNullable(url);
    }
}
