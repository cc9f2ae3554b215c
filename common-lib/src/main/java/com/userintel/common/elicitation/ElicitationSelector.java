package com.userintel.common.elicitation;

import com.userintel.common.confidence.ConfidenceThresholds;
import com.userintel.common.model.BeliefDomain;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether to ask the user one direct question, and which.
 *
 * <h3>Onboarding path</h3>
 * Rules are checked in order and the first failing one ends the decision:
 * <ol>
 *   <li>never during the first session</li>
 *   <li>at most one question per session</li>
 *   <li>after {@value #ONBOARDING_CAP} questions onboarding is over</li>
 *   <li>candidates: phase ≤ {@code min(sessionCount − 1, 4)}, never asked,
 *       not skipped, domain currently a gap; highest priority wins</li>
 * </ol>
 *
 * <h3>Gap path</h3>
 * Once onboarding is over, a question may still be asked about the single
 * lowest-confidence domain, at most once per {@link #GAP_WINDOW}, and only
 * when that confidence is under {@link ConfidenceThresholds#ASK_BEFORE_ACTING}.
 *
 * <p>No Spring dependency. No I/O.
 */
public final class ElicitationSelector {

    public static final int ONBOARDING_CAP = 4;
    public static final int MAX_PHASE = 4;
    public static final Duration GAP_WINDOW = Duration.ofDays(7);

    private ElicitationSelector() {}

    public static ElicitationDecision shouldAsk(ElicitationProfile profile) {
        if (profile == null) {
            return ElicitationDecision.no("No profile");
        }
        if (profile.sessionCount() < 2) {
            return ElicitationDecision.no("First session - building trust");
        }
        if (profile.askedThisSession()) {
            return ElicitationDecision.no("Already asked a question this session");
        }
        if (profile.questionsAsked() >= ONBOARDING_CAP) {
            return selectGapQuestion(profile);
        }

        int phase = phaseFor(profile.sessionCount());
        Set<BeliefDomain> gaps = onboardingGaps(profile);

        return QuestionBank.QUESTIONS.stream()
            .filter(q -> q.phase() <= phase)
            .filter(q -> !profile.hasAsked(q.id()))
            .filter(q -> gaps.contains(q.domain()))
            .filter(q -> !q.shouldSkip(profile))
            .max(Comparator.comparingInt(ElicitationQuestion::priority))
            .map(q -> ElicitationDecision.ask(q, "Phase " + phase + " question available"))
            .orElseGet(() -> ElicitationDecision.no("No relevant questions for this phase"));
    }

    /** Onboarding phase for a session count: session 2 → phase 1, capped at {@value #MAX_PHASE}. */
    public static int phaseFor(int sessionCount) {
        return Math.max(0, Math.min(sessionCount - 1, MAX_PHASE));
    }

    // ── Gap path ───────────────────────────────────────────────────

    static ElicitationDecision selectGapQuestion(ElicitationProfile profile) {
        if (profile.lastResponseAt() != null && profile.now() != null
                && profile.lastResponseAt().isAfter(profile.now().minus(GAP_WINDOW))) {
            return ElicitationDecision.no("Onboarding complete - asked recently");
        }

        List<BeliefDomain> byConfidence = QuestionBank.coveredDomains().stream()
            .filter(d -> confidenceOrZero(profile, d) < ConfidenceThresholds.ASK_BEFORE_ACTING)
            .sorted(Comparator.comparingDouble(d -> confidenceOrZero(profile, d)))
            .toList();
        if (byConfidence.isEmpty()) {
            return ElicitationDecision.no("Onboarding complete - no significant gaps");
        }

        // only the weakest domain is eligible; no fallback to the next one
        BeliefDomain weakest = byConfidence.get(0);
        return QuestionBank.QUESTIONS.stream()
            .filter(q -> q.domain() == weakest)
            .filter(q -> !profile.hasAsked(q.id()))
            .filter(q -> !q.shouldSkip(profile))
            .max(Comparator.comparingInt(ElicitationQuestion::priority))
            .map(q -> ElicitationDecision.ask(q, "Significant gap in " + weakest))
            .orElseGet(() -> ElicitationDecision.no("Onboarding complete - infer the rest"));
    }

    // ── Helpers ────────────────────────────────────────────────────

    /** Domains with a question that are missing or below {@link ConfidenceThresholds#ACT_WITH_UNCERTAINTY}. */
    static Set<BeliefDomain> onboardingGaps(ElicitationProfile profile) {
        return QuestionBank.coveredDomains().stream()
            .filter(d -> {
                Double c = profile.confidenceOf(d);
                return c == null || c < ConfidenceThresholds.ACT_WITH_UNCERTAINTY;
            })
            .collect(Collectors.toSet());
    }

    private static double confidenceOrZero(ElicitationProfile profile, BeliefDomain domain) {
        Double c = profile.confidenceOf(domain);
        return c == null ? 0.0 : c;
    }
}
