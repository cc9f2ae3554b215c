package com.userintel.common.elicitation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

import java.util.function.Predicate;

/**
 * One question in the onboarding bank.
 *
 * @param priority      higher is asked earlier among eligible questions
 * @param phase         1–4; the earliest onboarding phase the question belongs to
 * @param skipCondition true when the answer is already known; never null
 */
public record ElicitationQuestion(
    @JsonProperty("id")        String id,
    @JsonProperty("domain")    BeliefDomain domain,
    @JsonProperty("question")  String question,
    @JsonProperty("shortForm") String shortForm,
    @JsonProperty("priority")  int priority,
    @JsonProperty("phase")     int phase,
    @JsonIgnore Predicate<ElicitationProfile> skipCondition
) {
    public ElicitationQuestion {
        if (skipCondition == null) skipCondition = p -> false;
    }

    public boolean shouldSkip(ElicitationProfile profile) {
        return skipCondition.test(profile);
    }
}
