package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sophistication estimate for an interrogative message.
 *
 * @param complexity        0.0–1.0
 * @param topicDomain       coarse subject area, nullable
 * @param requiresExpertise true when complexity is high enough to imply domain knowledge
 * @param followUp          true when the question builds on an earlier one
 */
public record QuestionPayload(
    @JsonProperty("complexity")        double complexity,
    @JsonProperty("topicDomain")       String topicDomain,
    @JsonProperty("requiresExpertise") boolean requiresExpertise,
    @JsonProperty("followUp")          boolean followUp
) implements SignalPayload {}
