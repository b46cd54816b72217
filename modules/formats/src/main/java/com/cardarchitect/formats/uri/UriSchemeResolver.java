package com.cardarchitect.formats.uri;

import com.cardarchitect.types.AssetType;
import com.cardarchitect.types.UriScheme;
import org.apache.commons.codec.binary.Base64;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies asset references and converts between storage, archive and remote forms.
 *
 * <p>All methods are pure. {@link #parse(String)} is total: anything unrecognised is
 * {@link UriScheme#UNKNOWN}.
 */
public class UriSchemeResolver {

    /** Archive-relative prefix. The spelling is what CHARX consumers expect. */
    public static final String EMBED_PREFIX = "embeded://";
    public static final String CCDEFAULT_PREFIX = "ccdefault:";
    public static final String STORAGE_PREFIX = "/storage/";

    private static final String HTTPS_PREFIX = "https://";
    private static final String HTTP_PREFIX = "http://";
    private static final String DATA_PREFIX = "data:";
    private static final String FILE_PREFIX = "file://";

    private static final Pattern INTERNAL_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final Pattern DATA_URI = Pattern.compile("^data:([^;,]+)?(;base64)?,(.*)$", Pattern.DOTALL);

    /**
     * Classifies a reference. Checked in precedence order against the trimmed input.
     */
    public ParsedUri parse(String uri) {
        String original = uri == null ? "" : uri;
        String trimmed = original.trim();

        if (trimmed.startsWith(CCDEFAULT_PREFIX)) {
            return ParsedUri.bare(UriScheme.CCDEFAULT, original);
        }
        if (trimmed.startsWith(EMBED_PREFIX)) {
            return ParsedUri.withPath(UriScheme.EMBEDED, original, trimmed.substring(EMBED_PREFIX.length()));
        }
        if (trimmed.startsWith(HTTPS_PREFIX)) {
            return ParsedUri.withUrl(UriScheme.HTTPS, original, trimmed);
        }
        if (trimmed.startsWith(HTTP_PREFIX)) {
            return ParsedUri.withUrl(UriScheme.HTTP, original, trimmed);
        }
        if (trimmed.startsWith(DATA_PREFIX)) {
            return parseDataUri(original, trimmed);
        }
        if (trimmed.startsWith(FILE_PREFIX)) {
            return ParsedUri.withPath(UriScheme.FILE, original, trimmed.substring(FILE_PREFIX.length()));
        }
        if (INTERNAL_ID.matcher(trimmed).matches()) {
            return ParsedUri.withPath(UriScheme.INTERNAL, original, trimmed);
        }
        return ParsedUri.bare(UriScheme.UNKNOWN, original);
    }

    private static ParsedUri parseDataUri(String original, String trimmed) {
        Matcher m = DATA_URI.matcher(trimmed);
        if (!m.matches()) {
            // "data:" without a comma: still a data URI, just without parts
            return ParsedUri.bare(UriScheme.DATA, original);
        }
        String mimeType = m.group(1) != null ? m.group(1) : "text/plain";
        String encoding = m.group(2) != null ? "base64" : null;
        return new ParsedUri(UriScheme.DATA, original, null, null, m.group(3), mimeType, encoding);
    }

    /**
     * Whether a reference may be dereferenced. {@code http} and {@code file} need an explicit opt-in.
     */
    public boolean isSafe(String uri, UriSafetyOptions options) {
        return switch (parse(uri).scheme()) {
            case EMBEDED, CCDEFAULT, INTERNAL, DATA, HTTPS -> true;
            case HTTP -> options.allowHttp();
            case FILE -> options.allowFile();
            case UNKNOWN -> false;
        };
    }

    public boolean isSafe(String uri) {
        return isSafe(uri, UriSafetyOptions.strict());
    }

    /**
     * Archive URI for an internal asset: {@code embeded://assets/{type}/{mediaKind}/{index}.{ext}}.
     * The asset id does not appear in the result.
     */
    public String internalToEmbed(String assetId, AssetType type, String ext, int index) {
        String subdir = type == null ? AssetType.OTHER.label() : type.label();
        return EMBED_PREFIX + "assets/" + subdir + "/" + MediaTypes.mediaKind(ext).label() + "/" + index + "." + ext;
    }

    /**
     * Last path segment of an archive reference, or the whole path if it has no usable segment.
     */
    public String embedToInternal(String embedUri) {
        String path = embedUri.startsWith(EMBED_PREFIX) ? embedUri.substring(EMBED_PREFIX.length()) : embedUri;
        int slash = path.lastIndexOf('/');
        String last = slash >= 0 ? path.substring(slash + 1) : path;
        return last.isEmpty() ? path : last;
    }

    public String assetIdToUrl(String assetId, String baseUrl) {
        return (baseUrl == null ? "" : baseUrl) + "/assets/" + assetId;
    }

    /**
     * Best-effort file extension: from the path, else the URL without query, else a data URI's
     * mimetype. {@code unknown} when none applies.
     */
    public String extensionFromUri(String uri) {
        ParsedUri parsed = parse(uri);

        Optional<String> fromPath = parsed.pathOpt().flatMap(UriSchemeResolver::lastExtension);
        if (fromPath.isPresent()) return fromPath.get();

        Optional<String> fromUrl = parsed.urlOpt()
                .map(url -> url.split("\\?", 2)[0])
                .flatMap(UriSchemeResolver::lastExtension);
        if (fromUrl.isPresent()) return fromUrl.get();

        if (parsed.mimeType() != null) {
            return MediaTypes.extensionFromMime(parsed.mimeType());
        }
        return "unknown";
    }

    /**
     * Path of an asset inside a CHARX archive.
     */
    public String archivePath(String type, String subtype, int index, String ext) {
        return "assets/" + type + "/" + subtype + "/" + index + "." + ext;
    }

    public String embedUri(String archivePath) {
        return EMBED_PREFIX + archivePath;
    }

    /**
     * True for references into local asset storage ({@code /storage/...} paths and bare ids).
     */
    public boolean isStorageReference(String uri) {
        if (uri == null) return false;
        return uri.startsWith(STORAGE_PREFIX) || parse(uri).scheme() == UriScheme.INTERNAL;
    }

    /**
     * Payload bytes of a data URI.
     *
     * @return empty when the reference is not a well-formed data URI or the base64 is invalid
     */
    public Optional<byte[]> decodeDataUri(String uri) {
        ParsedUri parsed = parse(uri);
        if (parsed.scheme() != UriScheme.DATA || parsed.data() == null) {
            return Optional.empty();
        }
        if (parsed.isBase64()) {
            String payload = parsed.data().trim();
            if (!Base64.isBase64(payload)) {
                return Optional.empty();
            }
            return Optional.of(Base64.decodeBase64(payload));
        }
        try {
            return Optional.of(URLDecoder.decode(parsed.data().replace("+", "%2B"), StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> lastExtension(String path) {
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
