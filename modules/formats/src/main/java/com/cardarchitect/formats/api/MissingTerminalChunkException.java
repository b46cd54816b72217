package com.cardarchitect.formats.api;

/**
 * No {@code IEND} chunk could be located, so there is nowhere to splice a new chunk.
 * Only raised when writing; readers treat a missing IEND as end of stream.
 */
public class MissingTerminalChunkException extends MalformedContainerException {

    public MissingTerminalChunkException(long bufferLength) {
        super("PNG has no IEND chunk", bufferLength);
    }
}
