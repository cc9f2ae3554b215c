package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

/** All rates are 0–1. Trust grows with session count and is capped below certainty. */
public record RelationshipState(
    @JsonProperty("trustMaturity")     double trustMaturity,
    @JsonProperty("autonomyTolerance") double autonomyTolerance,
    @JsonProperty("correctionRate")    double correctionRate,
    @JsonProperty("acceptanceRate")    double acceptanceRate,
    @JsonProperty("feedbackFrequency") double feedbackFrequency,
    @JsonProperty("sessionCount")      int sessionCount
) implements DomainValue {

    public static RelationshipState initial() {
        return new RelationshipState(0.1, 0.3, 0.1, 0.5, 0.1, 0);
    }

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.RELATIONSHIP_STATE;
    }
}
