package com.userintel.common.context;

import com.userintel.common.confidence.ConfidenceModel;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.domain.DomainValue;

import java.time.Instant;

/**
 * A persisted belief as read back from storage, before decay is applied.
 *
 * @param lastDecayedAt last time decay was folded into {@code confidence}
 */
public record StoredBelief(BeliefDomain domain,
                           DomainValue value,
                           double confidence,
                           double decayRate,
                           Instant lastDecayedAt) {

    public double decayedConfidence(Instant now) {
        return ConfidenceModel.decay(confidence, decayRate, lastDecayedAt, now);
    }
}
