package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.domain.DecisionFriction;
import com.userintel.common.model.payload.DecisionPayload;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Open decisions become hesitation points (newest {@value #MAX_HESITATION_POINTS}
 * kept). Once enough decisions have been mentioned, the share still open is
 * the over-analysis rate.
 */
public class DecisionFrictionInferrer implements DomainInferrer<DecisionFriction> {

    static final int MAX_HESITATION_POINTS = 10;
    static final int MIN_DECISIONS = 3;

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.DECISION_FRICTION;
    }

    @Override
    public Class<DecisionFriction> valueType() {
        return DecisionFriction.class;
    }

    @Override
    public DimensionInference<DecisionFriction> infer(DecisionFriction existing, SignalAggregate signals,
                                                      int sessionCount) {
        DecisionFriction base = existing != null ? existing : DecisionFriction.empty();
        List<String> hesitation = new ArrayList<>(base.hesitationPoints());
        double overAnalysis = base.overAnalysisRate();
        int backlog = base.decisionBacklogSize();
        Set<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);

        List<DecisionPayload> decisions = signals.decisions();
        List<String> pending = decisions.stream()
            .filter(d -> !d.made())
            .map(DecisionPayload::decisionText)
            .toList();

        if (!pending.isEmpty()) {
            sources.add(EvidenceSource.BEHAVIORAL_SINGLE);
            for (String p : pending) {
                if (!hesitation.contains(p)) hesitation.add(p);
            }
            if (hesitation.size() > MAX_HESITATION_POINTS) {
                hesitation = new ArrayList<>(hesitation.subList(
                    hesitation.size() - MAX_HESITATION_POINTS, hesitation.size()));
            }
            backlog = pending.size();
        }

        if (decisions.size() >= MIN_DECISIONS) {
            sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
            overAnalysis = (double) pending.size() / decisions.size();
        }

        return DimensionInference.fromSources(new DecisionFriction(hesitation, overAnalysis, backlog), sources);
    }
}
