package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.domain.DomainValue;

/**
 * Value-update rule for one belief domain.
 *
 * <p>{@code signals} contains only signals whose type feeds this domain.
 * {@code existing} is the currently stored value, or null when the domain has
 * never been inferred. Implementations are pure and never return null.
 *
 * @param <V> the domain's value type
 */
public interface DomainInferrer<V extends DomainValue> {

    BeliefDomain domain();

    Class<V> valueType();

    DimensionInference<V> infer(V existing, SignalAggregate signals, int sessionCount);

    /**
     * False for a domain with no real evidence source yet. Such an inferrer
     * returns a fixed placeholder and callers may surface that fact.
     */
    default boolean hasSignalSource() {
        return true;
    }
}
