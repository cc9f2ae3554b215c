package com.userintel.common.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

/**
 * A domain whose confidence is too low to act on.
 *
 * @param priority base domain priority plus a boost that grows as confidence falls
 */
public record BeliefGap(
    @JsonProperty("domain")      BeliefDomain domain,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("priority")    double priority,
    @JsonProperty("description") String description
) {}
