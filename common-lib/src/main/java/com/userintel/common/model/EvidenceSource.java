package com.userintel.common.model;

/**
 * Kind of evidence that contributed to a belief, with the base confidence that
 * kind of evidence carries on its own.
 */
public enum EvidenceSource {
    /** The user stated it directly ("I prefer detailed responses"). */
    EXPLICIT_PKV(1.0),
    /** Answer to an elicitation question. */
    ELICITATION(0.95),
    /** Behaviour observed at least a threshold number of times. */
    BEHAVIORAL_REPEATED(0.8),
    /** Writing style derived from uploaded documents. */
    DOC_STYLE(0.6),
    /** Behaviour observed once or a handful of times. */
    BEHAVIORAL_SINGLE(0.5);

    private final double baseConfidence;

    EvidenceSource(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public double baseConfidence() {
        return baseConfidence;
    }
}
