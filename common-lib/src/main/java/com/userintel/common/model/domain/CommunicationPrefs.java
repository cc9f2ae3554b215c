package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

/**
 * How the user wants to be answered.
 *
 * @param optionsVsRecommendation -1 (one recommendation) to 1 (several options)
 * @param proactivityTolerance    0 (never interrupt) to 1 (always proactive)
 */
public record CommunicationPrefs(
    @JsonProperty("verbosity")               Verbosity verbosity,
    @JsonProperty("preferredFormat")         ResponseFormat preferredFormat,
    @JsonProperty("optionsVsRecommendation") double optionsVsRecommendation,
    @JsonProperty("tonePreference")          TonePreference tonePreference,
    @JsonProperty("proactivityTolerance")    double proactivityTolerance
) implements DomainValue {

    public static final CommunicationPrefs DEFAULT = new CommunicationPrefs(
        Verbosity.MODERATE, ResponseFormat.MIXED, 0.0, TonePreference.EXPLORATORY, 0.5);

    public CommunicationPrefs withVerbosity(Verbosity v) {
        return new CommunicationPrefs(v, preferredFormat, optionsVsRecommendation, tonePreference, proactivityTolerance);
    }

    public CommunicationPrefs withPreferredFormat(ResponseFormat f) {
        return new CommunicationPrefs(verbosity, f, optionsVsRecommendation, tonePreference, proactivityTolerance);
    }

    public CommunicationPrefs withOptionsVsRecommendation(double o) {
        return new CommunicationPrefs(verbosity, preferredFormat, o, tonePreference, proactivityTolerance);
    }

    public CommunicationPrefs withTonePreference(TonePreference t) {
        return new CommunicationPrefs(verbosity, preferredFormat, optionsVsRecommendation, t, proactivityTolerance);
    }

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.COMMUNICATION_PREFS;
    }
}
