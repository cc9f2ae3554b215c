package com.userintel.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.payload.SignalPayload;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable observation extracted from one user message or session event.
 *
 * <p>Strength is clamped to [0, 1] at construction; callers never need to
 * validate it. {@code sessionId} and {@code messageId} are optional.
 */
public record Signal(
    @JsonProperty("signalType") SignalType signalType,
    @JsonProperty("strength")   double strength,
    @JsonProperty("sessionId")  String sessionId,
    @JsonProperty("messageId")  String messageId,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("payload")    SignalPayload payload
) {
    public Signal {
        Objects.requireNonNull(signalType, "signalType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
        if (!signalType.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("payload " + payload.getClass().getSimpleName()
                + " does not match signal type " + signalType);
        }
        strength = Double.isNaN(strength) ? 0.0 : Math.max(0.0, Math.min(1.0, strength));
    }

    @JsonProperty("category")
    public SignalCategory category() {
        return signalType.category();
    }

    /**
     * Typed payload accessor. Returns empty when this signal carries a
     * different payload type.
     */
    @JsonIgnore
    public <P extends SignalPayload> Optional<P> payloadAs(Class<P> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }
}
