package com.cardarchitect.formats.charx;

/**
 * One file destined for a CHARX archive. Paths always use forward slashes.
 */
public record ArchiveEntry(String path, byte[] bytes) {

    public ArchiveEntry {
        if (path.indexOf('\\') >= 0 || path.startsWith("/")) {
            throw new IllegalArgumentException("Archive paths must be relative with forward slashes: " + path);
        }
    }
}
