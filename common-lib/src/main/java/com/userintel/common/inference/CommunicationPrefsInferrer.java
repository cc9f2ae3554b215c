package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.domain.CommunicationPrefs;
import com.userintel.common.model.domain.ResponseFormat;
import com.userintel.common.model.domain.TonePreference;
import com.userintel.common.model.domain.Verbosity;
import com.userintel.common.model.payload.MessageTone;
import com.userintel.common.model.payload.PreferenceKey;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stated verbosity and format preferences win outright. Without one in the
 * batch, at least {@value #MIN_STYLE_SIGNALS} style signals are needed before
 * message length, list usage and tone are read as preferences.
 */
public class CommunicationPrefsInferrer implements DomainInferrer<CommunicationPrefs> {

    static final int MIN_STYLE_SIGNALS = 3;

    /** Average words per message below which the user is read as concise. */
    static final double CONCISE_WORDS = 20;

    /** Average words per message above which the user is read as detailed. */
    static final double DETAILED_WORDS = 80;

    static final double BULLET_RATE = 0.5;

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.COMMUNICATION_PREFS;
    }

    @Override
    public Class<CommunicationPrefs> valueType() {
        return CommunicationPrefs.class;
    }

    @Override
    public DimensionInference<CommunicationPrefs> infer(CommunicationPrefs existing, SignalAggregate signals,
                                                        int sessionCount) {
        CommunicationPrefs value = existing != null ? existing : CommunicationPrefs.DEFAULT;
        Set<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);

        // ── Explicit statements ────────────────────────────────────
        String verbosity = signals.latestPreference(PreferenceKey.VERBOSITY);
        if (verbosity != null) {
            value = value.withVerbosity("concise".equals(verbosity) ? Verbosity.CONCISE : Verbosity.DETAILED);
            sources.add(EvidenceSource.EXPLICIT_PKV);
        }
        if ("bullets".equals(signals.latestPreference(PreferenceKey.FORMAT))) {
            value = value.withPreferredFormat(ResponseFormat.BULLETS);
            sources.add(EvidenceSource.EXPLICIT_PKV);
        }
        if (!sources.isEmpty()) {
            return DimensionInference.fromSources(value, sources);
        }

        // ── Behavioural reading ────────────────────────────────────
        if (signals.styleCount() >= MIN_STYLE_SIGNALS) {
            double avgWords = signals.averageWordCount();
            if (avgWords < CONCISE_WORDS) {
                value = value.withVerbosity(Verbosity.CONCISE);
            } else if (avgWords > DETAILED_WORDS) {
                value = value.withVerbosity(Verbosity.DETAILED);
            }
            if (signals.structuredRate() > BULLET_RATE) {
                value = value.withPreferredFormat(ResponseFormat.BULLETS);
            }
            MessageTone tone = signals.dominantTone();
            if (tone == MessageTone.CASUAL) {
                value = value.withTonePreference(TonePreference.SUPPORTIVE);
            } else if (tone == MessageTone.TECHNICAL || tone == MessageTone.FORMAL) {
                value = value.withTonePreference(TonePreference.DIRECTIVE);
            }
            sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
        }
        return DimensionInference.fromSources(value, sources);
    }
}
