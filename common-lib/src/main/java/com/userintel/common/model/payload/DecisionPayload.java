package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A decision the user mentioned, either already made or still open. */
public record DecisionPayload(
    @JsonProperty("decisionText") String decisionText,
    @JsonProperty("made")         boolean made
) implements SignalPayload {}
