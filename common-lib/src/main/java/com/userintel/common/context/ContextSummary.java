package com.userintel.common.context;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What the conversational pipeline receives about the user for one turn. */
public record ContextSummary(
    @JsonProperty("shouldPersonalize") boolean shouldPersonalize,
    @JsonProperty("summary")           String summary,
    @JsonProperty("adapters")          BehaviorAdapters adapters,
    @JsonProperty("confidence")        double confidence
) {
    public static ContextSummary neutral(double confidence) {
        return new ContextSummary(false, "", BehaviorAdapters.NEUTRAL, confidence);
    }

    public static ContextSummary unknownUser() {
        return neutral(0.0);
    }
}
