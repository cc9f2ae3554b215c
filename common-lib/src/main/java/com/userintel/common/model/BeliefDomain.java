package com.userintel.common.model;

import com.userintel.common.model.domain.BehavioralPatterns;
import com.userintel.common.model.domain.CognitiveStyle;
import com.userintel.common.model.domain.CommunicationPrefs;
import com.userintel.common.model.domain.DecisionFriction;
import com.userintel.common.model.domain.DomainValue;
import com.userintel.common.model.domain.ExpertiseCalibration;
import com.userintel.common.model.domain.GoalsValues;
import com.userintel.common.model.domain.IdentityContext;
import com.userintel.common.model.domain.RelationshipState;

/**
 * The fixed set of independent belief domains held about a user.
 *
 * <p>Each domain carries its stability tier, the monthly decay rate applied to
 * stored confidence, the concrete {@link DomainValue} type that represents it,
 * and the base priority used when the domain surfaces as an elicitation gap.
 */
public enum BeliefDomain {

    IDENTITY_CONTEXT(DomainTier.FOUNDATION, 0.10, IdentityContext.class, 10,
        "We don't know much about who you are yet"),
    GOALS_VALUES(DomainTier.FOUNDATION, 0.20, GoalsValues.class, 9,
        "We haven't learned your goals yet"),
    COGNITIVE_STYLE(DomainTier.STYLE, 0.15, CognitiveStyle.class, 6,
        "We're still learning how you think through problems"),
    COMMUNICATION_PREFS(DomainTier.STYLE, 0.20, CommunicationPrefs.class, 8,
        "We're still learning how you like responses"),
    EXPERTISE_CALIBRATION(DomainTier.STYLE, 0.30, ExpertiseCalibration.class, 7,
        "We don't know your areas of expertise yet"),
    BEHAVIORAL_PATTERNS(DomainTier.DYNAMICS, 0.40, BehavioralPatterns.class, 4,
        "We're still learning your working patterns"),
    RELATIONSHIP_STATE(DomainTier.DYNAMICS, 0.10, RelationshipState.class, 5,
        "We're still getting to know each other"),
    DECISION_FRICTION(DomainTier.DYNAMICS, 0.30, DecisionFriction.class, 3,
        "We haven't seen how you make decisions yet");

    private final DomainTier tier;
    private final double decayRate;
    private final Class<? extends DomainValue> valueType;
    private final int gapPriority;
    private final String gapDescription;

    BeliefDomain(DomainTier tier, double decayRate, Class<? extends DomainValue> valueType,
                 int gapPriority, String gapDescription) {
        this.tier           = tier;
        this.decayRate      = decayRate;
        this.valueType      = valueType;
        this.gapPriority    = gapPriority;
        this.gapDescription = gapDescription;
    }

    public DomainTier tier()                        { return tier; }
    public double decayRate()                       { return decayRate; }
    public Class<? extends DomainValue> valueType() { return valueType; }
    public int gapPriority()                        { return gapPriority; }
    public String gapDescription()                  { return gapDescription; }
}
