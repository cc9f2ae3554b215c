package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** A detector-produced insight. {@code activeGoals} feed the alignment bonus of the priority score. */
public record QueueInsightRequest(
    @JsonProperty("category")        String category,
    @JsonProperty("title")           String title,
    @JsonProperty("message")         String message,
    @JsonProperty("expandedContent") String expandedContent,
    @JsonProperty("trigger")         String trigger,
    @JsonProperty("minIdleSeconds")  Integer minIdleSeconds,
    @JsonProperty("contextTags")     List<String> contextTags,
    @JsonProperty("basePriority")    Double basePriority,
    @JsonProperty("confidence")      Double confidence,
    @JsonProperty("activeGoals")     List<String> activeGoals
) {}
