package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.SignalType;

import java.util.List;

/**
 * @param persisted  false for privacy tier A, where signals live only for the request
 * @param reflection present when the message made the profile eligible and a pass ran
 */
public record MessageIngestResult(
    @JsonProperty("signalTypes")    List<SignalType> signalTypes,
    @JsonProperty("persisted")      boolean persisted,
    @JsonProperty("insightsQueued") int insightsQueued,
    @JsonProperty("reflection")     ReflectionResult reflection
) {}
