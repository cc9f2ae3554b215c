package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.Signal;
import com.userintel.common.model.domain.DomainValue;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Runs every registered domain rule over one signal batch.
 *
 * <p>Each domain sees only the signals whose type feeds it, plus its own
 * stored value. Domains never read each other's results, so the order of
 * evaluation is irrelevant. The result always holds an entry for every
 * {@link BeliefDomain}, even for an empty batch.
 */
public class DimensionInferenceEngine {

    private final DomainInferrerRegistry registry;

    public DimensionInferenceEngine(DomainInferrerRegistry registry) {
        this.registry = registry;
    }

    public DimensionInferenceEngine() {
        this(DomainInferrerRegistry.defaults());
    }

    /**
     * @param signals        unprocessed batch; may be empty
     * @param sessionCount   sessions the user has had so far
     * @param existingValues stored value per domain; missing domains have none
     */
    public Map<BeliefDomain, DimensionInference<?>> inferAll(Collection<Signal> signals, int sessionCount,
                                                             Map<BeliefDomain, ? extends DomainValue> existingValues) {
        Map<BeliefDomain, ? extends DomainValue> existing = existingValues != null ? existingValues : Map.of();
        Map<BeliefDomain, DimensionInference<?>> results = new EnumMap<>(BeliefDomain.class);
        for (BeliefDomain domain : BeliefDomain.values()) {
            SignalAggregate aggregate = SignalAggregator.aggregate(signals, domain);
            results.put(domain, run(registry.get(domain), existing.get(domain), aggregate, sessionCount));
        }
        return Collections.unmodifiableMap(results);
    }

    /** Domains that at least one signal of the batch feeds. */
    public Set<BeliefDomain> domainsWithEvidence(Collection<Signal> signals) {
        Set<BeliefDomain> fed = EnumSet.noneOf(BeliefDomain.class);
        for (BeliefDomain domain : BeliefDomain.values()) {
            if (!SignalAggregator.aggregate(signals, domain).isEmpty()) fed.add(domain);
        }
        return fed;
    }

    public boolean hasSignalSource(BeliefDomain domain) {
        return registry.get(domain).hasSignalSource();
    }

    private static <V extends DomainValue> DimensionInference<V> run(DomainInferrer<V> inferrer, DomainValue existing,
                                                                     SignalAggregate aggregate, int sessionCount) {
        V typed = inferrer.valueType().isInstance(existing) ? inferrer.valueType().cast(existing) : null;
        return inferrer.infer(typed, aggregate, sessionCount);
    }
}
