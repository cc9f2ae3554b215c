package com.userintel.common.insight;

/**
 * Raised when an insight is moved along an edge its lifecycle does not allow,
 * e.g. engaging an insight that was never delivered.
 */
public class InsightTransitionException extends IllegalStateException {

    private final String insightId;
    private final InsightState from;
    private final InsightState to;

    public InsightTransitionException(String insightId, InsightState from, InsightState to) {
        super("Invalid insight transition " + from + " -> " + to + " for " + insightId);
        this.insightId = insightId;
        this.from      = from;
        this.to        = to;
    }

    public String getInsightId()  { return insightId; }
    public InsightState getFrom() { return from; }
    public InsightState getTo()   { return to; }
}
