package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionCloseResult(
    @JsonProperty("durationMinutes") double durationMinutes,
    @JsonProperty("insightsQueued")  int insightsQueued,
    @JsonProperty("reflection")      ReflectionResult reflection
) {}
