package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** @param rating optional explicit feedback, 0–1 */
public record EngagementRequest(
    @JsonProperty("action") String action,
    @JsonProperty("rating") Double rating
) {}
