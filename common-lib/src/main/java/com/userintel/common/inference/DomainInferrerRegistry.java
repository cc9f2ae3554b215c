package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One {@link DomainInferrer} per {@link BeliefDomain}. Construction fails if
 * any domain is missing or registered twice.
 */
public final class DomainInferrerRegistry {

    private final Map<BeliefDomain, DomainInferrer<?>> inferrers;

    public DomainInferrerRegistry(Collection<? extends DomainInferrer<?>> all) {
        Map<BeliefDomain, DomainInferrer<?>> map = new EnumMap<>(BeliefDomain.class);
        for (DomainInferrer<?> inferrer : all) {
            if (map.put(inferrer.domain(), inferrer) != null) {
                throw new IllegalArgumentException("Duplicate inferrer for domain " + inferrer.domain());
            }
        }
        for (BeliefDomain d : BeliefDomain.values()) {
            if (!map.containsKey(d)) {
                throw new IllegalArgumentException("No inferrer registered for domain " + d);
            }
        }
        this.inferrers = Collections.unmodifiableMap(map);
    }

    /** Registry with the built-in rule for every domain. */
    public static DomainInferrerRegistry defaults() {
        return new DomainInferrerRegistry(List.of(
            new IdentityContextInferrer(),
            new GoalsValuesInferrer(),
            new CognitiveStyleInferrer(),
            new CommunicationPrefsInferrer(),
            new ExpertiseCalibrationInferrer(),
            new BehavioralPatternsInferrer(),
            new RelationshipStateInferrer(),
            new DecisionFrictionInferrer()
        ));
    }

    public DomainInferrer<?> get(BeliefDomain domain) {
        return inferrers.get(domain);
    }

    public Collection<DomainInferrer<?>> all() {
        return inferrers.values();
    }
}
