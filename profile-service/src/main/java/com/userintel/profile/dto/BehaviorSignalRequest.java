package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mode selections use {@code mode}; retry patterns use {@code action} and
 * {@code attemptNumber}.
 */
public record BehaviorSignalRequest(
    @JsonProperty("sessionId")     String sessionId,
    @JsonProperty("mode")          String mode,
    @JsonProperty("action")        String action,
    @JsonProperty("attemptNumber") Integer attemptNumber
) {}
