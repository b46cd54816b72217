package com.cardarchitect.formats.card;

import com.cardarchitect.types.CardSpec;

/**
 * A card document located inside a container, with its detected schema generation.
 *
 * @param source where it came from: the PNG keyword, "card.json", or the upload filename
 */
public record ExtractedCard(CardDocument card, CardSpec spec, String source) {
}
