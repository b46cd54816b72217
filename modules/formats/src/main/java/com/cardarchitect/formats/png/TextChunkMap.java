package com.cardarchitect.formats.png;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword to text payload of a PNG's {@code tEXt} chunks.
 *
 * <p>Built once per extraction. When a keyword repeats, the later chunk wins, so a card
 * re-embedded in front of IEND shadows an older copy.
 */
public final class TextChunkMap {

    private final Map<String, String> entries;

    TextChunkMap(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static TextChunkMap of(Map<String, String> entries) {
        return new TextChunkMap(entries);
    }

    public Optional<String> get(String keyword) {
        return Optional.ofNullable(entries.get(keyword));
    }

    public boolean contains(String keyword) {
        return entries.containsKey(keyword);
    }

    public Set<String> keywords() {
        return entries.keySet();
    }
}
