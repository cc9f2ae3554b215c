package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.domain.RelationshipState;
import com.userintel.common.model.payload.FeedbackKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Trust grows by {@value #TRUST_PER_SESSION} per session from
 * {@value #BASE_TRUST}, capped at {@value #MAX_TRUST}. With enough feedback,
 * correction and acceptance rates are recomputed and autonomy tolerance is
 * nudged up for consistently satisfied users or down for frustrated ones.
 */
public class RelationshipStateInferrer implements DomainInferrer<RelationshipState> {

    static final double BASE_TRUST = 0.1;
    static final double TRUST_PER_SESSION = 0.05;
    static final double MAX_TRUST = 0.9;
    static final int MIN_FEEDBACK = 3;

    static final double AUTONOMY_STEP = 0.2;
    static final double AUTONOMY_CEILING = 0.8;
    static final double AUTONOMY_FLOOR = 0.2;

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.RELATIONSHIP_STATE;
    }

    @Override
    public Class<RelationshipState> valueType() {
        return RelationshipState.class;
    }

    @Override
    public DimensionInference<RelationshipState> infer(RelationshipState existing, SignalAggregate signals,
                                                       int sessionCount) {
        RelationshipState base = existing != null ? existing : RelationshipState.initial();
        double trust = base.trustMaturity();
        double autonomy = base.autonomyTolerance();
        double correctionRate = base.correctionRate();
        double acceptanceRate = base.acceptanceRate();
        double feedbackFrequency = base.feedbackFrequency();
        Set<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);

        int sessions = Math.max(0, sessionCount);
        if (sessions >= 1) {
            trust = trustFor(sessions);
            sources.add(EvidenceSource.BEHAVIORAL_SINGLE);
        }

        long corrections  = signals.feedbackCount(FeedbackKind.CORRECTION);
        long praises      = signals.feedbackCount(FeedbackKind.PRAISE);
        long frustrations = signals.feedbackCount(FeedbackKind.FRUSTRATION);
        long acceptances  = signals.feedbackCount(FeedbackKind.ACCEPTANCE);
        long total = corrections + praises + frustrations + acceptances;

        if (total >= MIN_FEEDBACK) {
            sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
            correctionRate = (double) corrections / total;
            acceptanceRate = (double) (praises + acceptances) / total;

            if (acceptanceRate > 0.7 && correctionRate < 0.2) {
                autonomy = Math.min(autonomy + AUTONOMY_STEP, AUTONOMY_CEILING);
            }
            if ((double) frustrations / total > 0.3) {
                autonomy = Math.max(autonomy - AUTONOMY_STEP, AUTONOMY_FLOOR);
            }
            feedbackFrequency = Math.min(1.0, (double) total / Math.max(signals.styleCount(), 1));
        }

        return DimensionInference.fromSources(new RelationshipState(trust, autonomy, correctionRate,
            acceptanceRate, feedbackFrequency, sessions), sources);
    }

    /** Monotonic in session count. */
    public static double trustFor(int sessionCount) {
        return Math.min(BASE_TRUST + Math.max(0, sessionCount) * TRUST_PER_SESSION, MAX_TRUST);
    }
}
