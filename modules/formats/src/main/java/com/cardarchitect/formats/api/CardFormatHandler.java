package com.cardarchitect.formats.api;

import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.charx.CharxAsset;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handler instance bound to one uploaded container.
 */
public interface CardFormatHandler {

    /**
     * Short format key ("png", "charx", "json").
     */
    String formatKey();

    /**
     * Locates and decodes the card document carried by the container.
     *
     * @return the card, or empty when the container is well-formed but carries no card
     * @throws MalformedContainerException when the container bytes are corrupt
     */
    Optional<ExtractedCard> extractCard() throws MalformedContainerException;

    /**
     * Binary assets bundled alongside the card. Only archive formats have any.
     */
    default List<CharxAsset> extractAssets() throws MalformedContainerException {
        return List.of();
    }

    /**
     * Extracts format-specific metadata.
     */
    Map<String, Object> extractMetadata();
}
