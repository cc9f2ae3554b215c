package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

import java.util.List;
import java.util.Map;

/** @param domainScores subject area → expertise level 0–1 */
public record ExpertiseCalibration(
    @JsonProperty("expertDomains")   List<String> expertDomains,
    @JsonProperty("learningDomains") List<String> learningDomains,
    @JsonProperty("domainScores")    Map<String, Double> domainScores,
    @JsonProperty("vocabularyLevel") VocabularyLevel vocabularyLevel
) implements DomainValue {

    public ExpertiseCalibration {
        expertDomains   = expertDomains == null ? List.of() : List.copyOf(expertDomains);
        learningDomains = learningDomains == null ? List.of() : List.copyOf(learningDomains);
        domainScores    = domainScores == null ? Map.of() : Map.copyOf(domainScores);
        if (vocabularyLevel == null) vocabularyLevel = VocabularyLevel.INTERMEDIATE;
    }

    public static ExpertiseCalibration empty() {
        return new ExpertiseCalibration(List.of(), List.of(), Map.of(), VocabularyLevel.INTERMEDIATE);
    }

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.EXPERTISE_CALIBRATION;
    }
}
