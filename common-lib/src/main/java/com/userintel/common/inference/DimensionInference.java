package com.userintel.common.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.confidence.ConfidenceModel;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.domain.DomainValue;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of inferring one domain in one reflection pass.
 *
 * @param confidence merged from {@code sources}, rounded to two decimals
 * @param sources    evidence kinds actually used for this domain in this pass
 */
public record DimensionInference<V extends DomainValue>(
    @JsonProperty("domain")     BeliefDomain domain,
    @JsonProperty("value")      V value,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("sources")    Set<EvidenceSource> sources
) {
    public DimensionInference {
        confidence = ConfidenceModel.round(confidence);
        sources = sources == null || sources.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(sources));
    }

    /** Confidence merged from the given evidence kinds. */
    public static <V extends DomainValue> DimensionInference<V> fromSources(
            V value, Collection<EvidenceSource> sources) {
        return new DimensionInference<>(value.domain(), value,
            ConfidenceModel.mergeSources(sources), sources == null ? Set.of() : Set.copyOf(sources));
    }

    public boolean hasSource(EvidenceSource source) {
        return sources.contains(source);
    }

    public boolean isExplicit() {
        return sources.contains(EvidenceSource.EXPLICIT_PKV) || sources.contains(EvidenceSource.ELICITATION);
    }
}
