package com.userintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A discrete fact about the user, keyed by {@code (factType, key)}.
 * Explicit facts come from direct statements or elicitation answers and take
 * precedence over inferred domain values.
 */
public record KnownFact(
    @JsonProperty("domain")   BeliefDomain domain,
    @JsonProperty("factType") String factType,
    @JsonProperty("key")      String key,
    @JsonProperty("value")    String value,
    @JsonProperty("source")   EvidenceSource source,
    @JsonProperty("explicit") boolean explicit
) {
    public static KnownFact elicited(BeliefDomain domain, String factType, String key, String value) {
        return new KnownFact(domain, factType, key, value, EvidenceSource.ELICITATION, true);
    }

    /** Explicit facts are always fully confident; inferred ones carry their source's base confidence. */
    public double confidence() {
        return explicit ? 1.0 : source.baseConfidence();
    }
}
