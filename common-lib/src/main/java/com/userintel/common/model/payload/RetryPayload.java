package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What the user did with a response: accepted it, asked again, refined or abandoned. */
public record RetryPayload(
    @JsonProperty("action")        RetryAction action,
    @JsonProperty("attemptNumber") int attemptNumber
) implements SignalPayload {}
