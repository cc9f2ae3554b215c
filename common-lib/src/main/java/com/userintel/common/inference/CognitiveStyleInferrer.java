package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.domain.CognitiveStyle;

import java.util.Set;

/**
 * Placeholder. No signal reliably reveals cognitive style yet, so this always
 * returns the neutral value at a fixed low confidence with no sources.
 */
public class CognitiveStyleInferrer implements DomainInferrer<CognitiveStyle> {

    static final double PLACEHOLDER_CONFIDENCE = 0.3;

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.COGNITIVE_STYLE;
    }

    @Override
    public Class<CognitiveStyle> valueType() {
        return CognitiveStyle.class;
    }

    @Override
    public DimensionInference<CognitiveStyle> infer(CognitiveStyle existing, SignalAggregate signals, int sessionCount) {
        return new DimensionInference<>(BeliefDomain.COGNITIVE_STYLE, CognitiveStyle.NEUTRAL,
            PLACEHOLDER_CONFIDENCE, Set.of());
    }

    @Override
    public boolean hasSignalSource() {
        return false;
    }
}
