package com.cardarchitect.formats.api;

import java.io.IOException;

/**
 * The container bytes cannot be parsed: bad signature, truncated framing, a chunk that
 * overruns the buffer, an unreadable ZIP. No safe continuation exists.
 */
public class MalformedContainerException extends IOException {

    private final long offset;

    public MalformedContainerException(String message, long offset) {
        super(message + " (offset " + offset + ")");
        this.offset = offset;
    }

    public MalformedContainerException(String message, Throwable cause) {
        super(message, cause);
        this.offset = -1;
    }

    /**
     * Byte offset where the problem was detected, or -1 when not applicable.
     */
    public long offset() {
        return offset;
    }
}
