package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

import java.util.List;

/**
 * @param hesitationPoints    open decisions the user keeps circling, most recent last
 * @param overAnalysisRate    share of mentioned decisions still open
 * @param decisionBacklogSize number of open decisions seen in the last pass
 */
public record DecisionFriction(
    @JsonProperty("hesitationPoints")    List<String> hesitationPoints,
    @JsonProperty("overAnalysisRate")    double overAnalysisRate,
    @JsonProperty("decisionBacklogSize") int decisionBacklogSize
) implements DomainValue {

    public DecisionFriction {
        hesitationPoints = hesitationPoints == null ? List.of() : List.copyOf(hesitationPoints);
    }

    public static DecisionFriction empty() {
        return new DecisionFriction(List.of(), 0.0, 0);
    }

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.DECISION_FRICTION;
    }
}
