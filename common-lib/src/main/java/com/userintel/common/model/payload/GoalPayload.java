package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A goal the user mentioned. {@code timeframe} is null when none was stated. */
public record GoalPayload(
    @JsonProperty("goalText")  String goalText,
    @JsonProperty("timeframe") GoalTimeframe timeframe,
    @JsonProperty("progress")  boolean progress
) implements SignalPayload {}
