package com.userintel.common.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.ResponseMode;

/**
 * Knobs the conversational pipeline turns based on the profile.
 *
 * @param suggestedMode       null when there is no opinion
 * @param verbosityMultiplier scales target answer length; 1.0 is neutral
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BehaviorAdapters(
    @JsonProperty("suggestedMode")       ResponseMode suggestedMode,
    @JsonProperty("verbosityMultiplier") double verbosityMultiplier,
    @JsonProperty("proactivityLevel")    double proactivityLevel,
    @JsonProperty("autonomyLevel")       double autonomyLevel
) {
    public static final BehaviorAdapters NEUTRAL = new BehaviorAdapters(null, 1.0, 0.5, 0.5);
}
