package com.userintel.common.signal;

import com.userintel.common.model.ResponseMode;

import java.time.Instant;

/**
 * Context that travels with a message into the extractor. Every field except
 * {@code timestamp} may be null.
 *
 * @param declaredMode response mode the user picked for this turn, if any
 */
public record MessageMetadata(
    String sessionId,
    String messageId,
    Instant timestamp,
    ResponseMode declaredMode
) {
    public static MessageMetadata at(Instant timestamp) {
        return new MessageMetadata(null, null, timestamp, null);
    }

    public static MessageMetadata of(String sessionId, String messageId, Instant timestamp) {
        return new MessageMetadata(sessionId, messageId, timestamp, null);
    }
}
