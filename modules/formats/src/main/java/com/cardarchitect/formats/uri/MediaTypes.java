package com.cardarchitect.formats.uri;

import com.cardarchitect.types.MediaKind;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fixed extension / mimetype / media-kind lookup tables for card assets.
 */
public final class MediaTypes {

    public static final String FALLBACK_MIME = "application/octet-stream";
    public static final String FALLBACK_EXTENSION = "bin";

    private static final Map<String, String> EXT_TO_MIME = Map.ofEntries(
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("webp", "image/webp"),
            Map.entry("gif", "image/gif"),
            Map.entry("avif", "image/avif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("webm", "video/webm")
    );

    // Only image types round-trip back to an extension.
    private static final Map<String, String> MIME_TO_EXT = Map.of(
            "image/png", "png",
            "image/jpeg", "jpg",
            "image/webp", "webp",
            "image/gif", "gif",
            "image/avif", "avif",
            "image/svg+xml", "svg"
    );

    private static final Set<String> IMAGE_EXTS = Set.of("png", "jpg", "jpeg", "webp", "gif", "avif", "bmp", "svg");
    private static final Set<String> AUDIO_EXTS = Set.of("mp3", "wav", "ogg", "flac", "m4a", "aac");
    private static final Set<String> VIDEO_EXTS = Set.of("mp4", "webm", "avi", "mov", "mkv");

    private MediaTypes() {
    }

    public static String mimeFromExtension(String ext) {
        if (ext == null) return FALLBACK_MIME;
        return EXT_TO_MIME.getOrDefault(ext.toLowerCase(Locale.ROOT), FALLBACK_MIME);
    }

    public static String extensionFromMime(String mimeType) {
        if (mimeType == null) return FALLBACK_EXTENSION;
        return MIME_TO_EXT.getOrDefault(mimeType, FALLBACK_EXTENSION);
    }

    public static MediaKind mediaKind(String ext) {
        if (ext == null) return MediaKind.OTHER;
        String lower = ext.toLowerCase(Locale.ROOT);
        if (IMAGE_EXTS.contains(lower)) return MediaKind.IMAGE;
        if (AUDIO_EXTS.contains(lower)) return MediaKind.AUDIO;
        if (VIDEO_EXTS.contains(lower)) return MediaKind.VIDEO;
        return MediaKind.OTHER;
    }

    /**
     * Subtype segment of a mimetype ({@code image/png} gives {@code png}), {@code bin} when absent.
     */
    public static String subtype(String mimeType) {
        if (mimeType == null) return FALLBACK_EXTENSION;
        int slash = mimeType.indexOf('/');
        if (slash < 0 || slash == mimeType.length() - 1) return FALLBACK_EXTENSION;
        return mimeType.substring(slash + 1);
    }
}
