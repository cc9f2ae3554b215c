package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.payload.GoalTimeframe;

/** @param priority 1–10 */
public record TrackedGoal(
    @JsonProperty("goal")      String goal,
    @JsonProperty("timeframe") GoalTimeframe timeframe,
    @JsonProperty("priority")  int priority
) {}
