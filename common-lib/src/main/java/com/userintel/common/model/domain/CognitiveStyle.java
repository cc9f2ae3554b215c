package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

/**
 * Each axis runs from -1 to 1. No signal currently feeds this domain, so the
 * neutral value is the only one ever produced.
 */
public record CognitiveStyle(
    @JsonProperty("abstractVsConcrete")  double abstractVsConcrete,
    @JsonProperty("linearVsAssociative") double linearVsAssociative,
    @JsonProperty("verbalVsVisual")      double verbalVsVisual,
    @JsonProperty("reflectiveVsAction")  double reflectiveVsAction
) implements DomainValue {

    public static final CognitiveStyle NEUTRAL = new CognitiveStyle(0, 0, 0, 0);

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.COGNITIVE_STYLE;
    }
}
