package com.userintel.common.elicitation;

import com.userintel.common.model.BeliefDomain;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Everything the selector needs to know about one user, captured at one instant.
 *
 * @param askedQuestionIds   every question id ever recorded for the profile
 * @param askedThisSession   whether a question was already put to the user in the current session
 * @param lastResponseAt     when the most recent question was recorded; null if never
 * @param domainConfidences  decayed confidence per domain; absent means never inferred
 * @param knownName          a name or preferred name already on file; nullable
 */
public record ElicitationProfile(
    int sessionCount,
    int questionsAsked,
    Set<String> askedQuestionIds,
    boolean askedThisSession,
    Instant lastResponseAt,
    Map<BeliefDomain, Double> domainConfidences,
    String knownName,
    Instant now
) {
    public ElicitationProfile {
        askedQuestionIds  = askedQuestionIds == null ? Set.of() : Set.copyOf(askedQuestionIds);
        domainConfidences = domainConfidences == null ? Map.of() : Map.copyOf(domainConfidences);
    }

    public boolean hasAsked(String questionId) {
        return askedQuestionIds.contains(questionId);
    }

    /** Null when the domain has never been inferred. */
    public Double confidenceOf(BeliefDomain domain) {
        return domainConfidences.get(domain);
    }
}
