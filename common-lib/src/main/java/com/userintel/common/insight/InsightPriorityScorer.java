package com.userintel.common.insight;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Bounded weighted score (1..10) for a freshly detected insight.
 *
 * <p>No Spring dependency. No I/O. Pure function.
 */
public final class InsightPriorityScorer {

    // ── weights ───────────────────────────────────────────────────────────────
    static final double RECENCY       = 0.25;
    static final double MAGNITUDE     = 0.30;
    static final double GOAL_ALIGN    = 0.20;
    static final double ACTIONABILITY = 0.15;
    static final double NOVELTY       = 0.10;

    /**
     * What the scorer knows about the user at queueing time.
     *
     * @param activeGoals            free-text goals currently tracked for the user
     * @param recentlyDelivered      categories surfaced recently in this session
     * @param averageRating          mean explicit rating for the draft's category, or null
     */
    public record ScoringContext(Collection<String> activeGoals,
                                 Set<InsightCategory> recentlyDelivered,
                                 Double averageRating) {
        public ScoringContext {
            activeGoals       = activeGoals == null ? List.of() : List.copyOf(activeGoals);
            recentlyDelivered = recentlyDelivered == null ? Set.of() : Set.copyOf(recentlyDelivered);
        }

        public static ScoringContext empty() {
            return new ScoringContext(List.of(), Set.of(), null);
        }
    }

    private InsightPriorityScorer() {}

    public static int score(InsightDraft draft, ScoringContext context) {
        ScoringContext ctx = context == null ? ScoringContext.empty() : context;

        double score = draft.basePriority();
        score += RECENCY * 2;
        score += MAGNITUDE * draft.category().magnitude();

        if (matchesGoal(draft.contextTags(), ctx.activeGoals())) {
            score += GOAL_ALIGN * 4;
        }
        score += (draft.confidence() - 0.5) * 2;

        if (draft.hasExpandedContent()) {
            score += ACTIONABILITY * 2;
        }
        if (ctx.recentlyDelivered().contains(draft.category())) {
            score -= NOVELTY * 2;
        }
        if (ctx.averageRating() != null) {
            score += ctx.averageRating() * 2;
        }
        return QueuedInsight.clampPriority((int) Math.round(score));
    }

    static boolean matchesGoal(List<String> tags, Collection<String> goals) {
        if (tags.isEmpty() || goals.isEmpty()) return false;
        for (String goal : goals) {
            if (goal == null) continue;
            String g = goal.toLowerCase(Locale.ROOT);
            for (String tag : tags) {
                if (!tag.isBlank() && g.contains(tag.toLowerCase(Locale.ROOT))) return true;
            }
        }
        return false;
    }
}
