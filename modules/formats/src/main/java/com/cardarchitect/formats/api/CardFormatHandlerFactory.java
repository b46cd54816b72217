package com.cardarchitect.formats.api;

import com.cardarchitect.util.RawContainer;

/**
 * Factory for creating card container handler instances.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface CardFormatHandlerFactory {
    /**
     * Returns criteria for detecting when this handler should be used.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Creates a handler instance for the given container.
     *
     * @param container The uploaded file bytes
     * @param context   File context (filename, mimetype)
     */
    CardFormatHandler createInstance(RawContainer container, FileContext context);
}
