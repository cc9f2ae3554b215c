package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.domain.GoalsValues;
import com.userintel.common.model.domain.TrackedGoal;
import com.userintel.common.model.payload.GoalPayload;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Adds newly mentioned goals to the tracked list. Goals whose first
 * {@value #DEDUPE_PREFIX} characters match an existing goal are treated as the
 * same goal. Only the newest {@value #MAX_GOALS} are kept.
 */
public class GoalsValuesInferrer implements DomainInferrer<GoalsValues> {

    static final int DEDUPE_PREFIX = 20;
    static final int MAX_GOALS = 10;
    static final int DEFAULT_PRIORITY = 5;
    static final int REPEATED_THRESHOLD = 3;

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.GOALS_VALUES;
    }

    @Override
    public Class<GoalsValues> valueType() {
        return GoalsValues.class;
    }

    @Override
    public DimensionInference<GoalsValues> infer(GoalsValues existing, SignalAggregate signals, int sessionCount) {
        List<TrackedGoal> goals = new ArrayList<>(existing != null ? existing.activeGoals() : List.of());
        Set<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);

        List<GoalPayload> mentioned = signals.goals();
        if (!mentioned.isEmpty()) {
            sources.add(mentioned.size() >= REPEATED_THRESHOLD
                ? EvidenceSource.BEHAVIORAL_REPEATED
                : EvidenceSource.BEHAVIORAL_SINGLE);

            for (GoalPayload g : mentioned) {
                if (g.progress() || g.goalText() == null || g.goalText().isBlank()) continue;
                String key = prefix(g.goalText());
                boolean known = goals.stream().anyMatch(t -> prefix(t.goal()).equals(key));
                if (!known) {
                    goals.add(new TrackedGoal(g.goalText(), g.timeframe(), DEFAULT_PRIORITY));
                }
            }
            if (goals.size() > MAX_GOALS) {
                goals = new ArrayList<>(goals.subList(goals.size() - MAX_GOALS, goals.size()));
            }
        }
        return DimensionInference.fromSources(new GoalsValues(goals), sources);
    }

    private static String prefix(String goal) {
        String normalised = goal == null ? "" : goal.trim().toLowerCase(Locale.ROOT);
        return normalised.length() > DEDUPE_PREFIX ? normalised.substring(0, DEDUPE_PREFIX) : normalised;
    }
}
