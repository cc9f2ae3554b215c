package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.domain.IdentityContext;
import com.userintel.common.model.payload.PreferenceKey;

import java.util.EnumSet;
import java.util.Set;

/** Identity is taken only from what the user states; nothing is guessed. */
public class IdentityContextInferrer implements DomainInferrer<IdentityContext> {

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.IDENTITY_CONTEXT;
    }

    @Override
    public Class<IdentityContext> valueType() {
        return IdentityContext.class;
    }

    @Override
    public DimensionInference<IdentityContext> infer(IdentityContext existing, SignalAggregate signals, int sessionCount) {
        IdentityContext value = existing != null ? existing : IdentityContext.empty();
        Set<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);

        String name = signals.latestPreference(PreferenceKey.NAME);
        if (name != null) {
            value = value.withName(name);
            sources.add(EvidenceSource.EXPLICIT_PKV);
        }
        String preferred = signals.latestPreference(PreferenceKey.PREFERRED_NAME);
        if (preferred != null) {
            value = value.withPreferredName(preferred);
            sources.add(EvidenceSource.EXPLICIT_PKV);
        }
        String role = signals.latestPreference(PreferenceKey.ROLE);
        if (role != null) {
            value = value.withRole(role);
            sources.add(EvidenceSource.EXPLICIT_PKV);
        }
        return DimensionInference.fromSources(value, sources);
    }
}
