package com.cardarchitect.formats.registry;

import com.cardarchitect.formats.api.CardFormatHandler;
import com.cardarchitect.formats.api.CardFormatHandlerFactory;
import com.cardarchitect.formats.api.FileContext;
import com.cardarchitect.util.RawContainer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.Comparator;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Matches uploaded files to card format handlers.
 * All {@link CardFormatHandlerFactory} beans are discovered via CDI.
 */
@ApplicationScoped
public class CardFormatRegistry {

    /** Header size to read for detection. */
    private static final int HEADER_SIZE = 512;

    @Inject
    Instance<CardFormatHandlerFactory> factories;

    /**
     * Finds the best handler for the given container and context.
     * Matches a header against all registered factories and returns the highest-priority match.
     */
    public Optional<CardFormatHandler> findHandler(RawContainer container, FileContext context) {
        return findFactory(container, context).map(f -> f.createInstance(container, context));
    }

    public Optional<CardFormatHandlerFactory> findFactory(RawContainer container, FileContext context) {
        byte[] header = container.slice(0, Math.min(HEADER_SIZE, container.length()));
        String mimeType = context.detectedMimeType().orElse(null);
        String filename = context.filename();

        return StreamSupport.stream(factories.spliterator(), false)
                .filter(f -> f.getDetectionCriteria().matches(mimeType, filename, header))
                .max(Comparator.comparingInt(f -> f.getDetectionCriteria().priority()));
    }
}
