package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

import java.util.List;

public record GoalsValues(
    @JsonProperty("activeGoals") List<TrackedGoal> activeGoals
) implements DomainValue {

    public GoalsValues {
        activeGoals = activeGoals == null ? List.of() : List.copyOf(activeGoals);
    }

    public static GoalsValues empty() {
        return new GoalsValues(List.of());
    }

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.GOALS_VALUES;
    }
}
