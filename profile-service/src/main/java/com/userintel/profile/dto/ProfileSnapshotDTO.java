package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.PrivacyTier;

import java.time.LocalDateTime;

public record ProfileSnapshotDTO(
    @JsonProperty("userId")           String userId,
    @JsonProperty("sessionCount")     int sessionCount,
    @JsonProperty("signalCount")      long signalCount,
    @JsonProperty("questionsAsked")   int questionsAsked,
    @JsonProperty("privacyTier")      PrivacyTier privacyTier,
    @JsonProperty("lastReflectionAt") LocalDateTime lastReflectionAt,
    @JsonProperty("nextReflectionAt") LocalDateTime nextReflectionAt
) {}
