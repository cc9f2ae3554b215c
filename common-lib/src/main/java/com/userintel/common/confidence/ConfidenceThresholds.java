package com.userintel.common.confidence;

/**
 * Decision thresholds applied to (decayed) belief confidence.
 */
public final class ConfidenceThresholds {

    /** At or above: use the belief without hedging. */
    public static final double ACT_WITHOUT_ASKING = 0.8;

    /** At or above: use the belief but phrase tentatively. Below: the domain is a gap. */
    public static final double ACT_WITH_UNCERTAINTY = 0.6;

    /** At or above: worth persisting on first sight. Below: a significant gap. */
    public static final double ASK_BEFORE_ACTING = 0.4;

    /** Below: the belief is ignored entirely. */
    public static final double TREAT_AS_UNKNOWN = 0.3;

    private ConfidenceThresholds() {}
}
