package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.ResponseMode;

public record ModeSelectionPayload(
    @JsonProperty("mode") ResponseMode mode
) implements SignalPayload {}
