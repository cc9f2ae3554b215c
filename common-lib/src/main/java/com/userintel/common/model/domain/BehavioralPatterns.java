package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.ResponseMode;

import java.util.EnumMap;
import java.util.Map;

/**
 * @param preferredSessionTime    "morning", "afternoon", "evening" or "night"; nullable
 * @param typicalSessionLength    minutes
 * @param modeDistribution        share of each response mode, sums to 1
 * @param averageLatencyTolerance seconds
 */
public record BehavioralPatterns(
    @JsonProperty("preferredSessionTime")    String preferredSessionTime,
    @JsonProperty("typicalSessionLength")    double typicalSessionLength,
    @JsonProperty("modeDistribution")        Map<ResponseMode, Double> modeDistribution,
    @JsonProperty("retryRate")               double retryRate,
    @JsonProperty("refinementRate")          double refinementRate,
    @JsonProperty("averageLatencyTolerance") double averageLatencyTolerance
) implements DomainValue {

    public BehavioralPatterns {
        modeDistribution = modeDistribution == null ? defaultModes() : Map.copyOf(modeDistribution);
    }

    public static BehavioralPatterns defaults() {
        return new BehavioralPatterns(null, 15, defaultModes(), 0.1, 0.1, 10);
    }

    public static Map<ResponseMode, Double> defaultModes() {
        Map<ResponseMode, Double> modes = new EnumMap<>(ResponseMode.class);
        modes.put(ResponseMode.QUICK, 0.25);
        modes.put(ResponseMode.THOUGHTFUL, 0.5);
        modes.put(ResponseMode.CONTEMPLATE, 0.2);
        modes.put(ResponseMode.COUNCIL, 0.05);
        return modes;
    }

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.BEHAVIORAL_PATTERNS;
    }
}
