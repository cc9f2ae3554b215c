package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Reaction to a previous response. {@code explicit} is false when the kind was inferred from tone. */
public record FeedbackPayload(
    @JsonProperty("kind")     FeedbackKind kind,
    @JsonProperty("explicit") boolean explicit
) implements SignalPayload {}
