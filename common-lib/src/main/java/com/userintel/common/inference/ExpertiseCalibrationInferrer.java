package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.domain.ExpertiseCalibration;
import com.userintel.common.model.domain.VocabularyLevel;
import com.userintel.common.model.payload.PreferenceKey;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stated expert and learning areas are recorded directly. Without a statement
 * in the batch, repeated questions and sustained technical vocabulary move the
 * vocabulary level and per-area scores.
 */
public class ExpertiseCalibrationInferrer implements DomainInferrer<ExpertiseCalibration> {

    static final int MIN_QUESTIONS = 3;
    static final int MIN_DOMAIN_QUESTIONS = 2;
    static final int MIN_STYLE_SIGNALS = 5;

    static final double EXPERT_SCORE = 0.9;
    static final double LEARNING_SCORE = 0.3;
    static final double NEUTRAL_SCORE = 0.5;

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.EXPERTISE_CALIBRATION;
    }

    @Override
    public Class<ExpertiseCalibration> valueType() {
        return ExpertiseCalibration.class;
    }

    @Override
    public DimensionInference<ExpertiseCalibration> infer(ExpertiseCalibration existing, SignalAggregate signals,
                                                          int sessionCount) {
        ExpertiseCalibration base = existing != null ? existing : ExpertiseCalibration.empty();
        List<String> expert = new ArrayList<>(base.expertDomains());
        List<String> learning = new ArrayList<>(base.learningDomains());
        Map<String, Double> scores = new LinkedHashMap<>(base.domainScores());
        VocabularyLevel vocabulary = base.vocabularyLevel();
        Set<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);

        // ── Explicit statements ────────────────────────────────────
        for (String area : signals.preferenceValues(PreferenceKey.EXPERT_IN)) {
            addOnce(expert, area);
            scores.put(area, EXPERT_SCORE);
            sources.add(EvidenceSource.EXPLICIT_PKV);
        }
        for (String area : signals.preferenceValues(PreferenceKey.LEARNING)) {
            addOnce(learning, area);
            scores.put(area, LEARNING_SCORE);
            sources.add(EvidenceSource.EXPLICIT_PKV);
        }

        if (sources.isEmpty()) {
            // ── Question sophistication ────────────────────────────
            if (signals.questions().size() >= MIN_QUESTIONS) {
                sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
                double avg = signals.averageComplexity();
                if (avg > 0.7) {
                    vocabulary = VocabularyLevel.ADVANCED;
                } else if (avg > 0.5) {
                    vocabulary = VocabularyLevel.INTERMEDIATE;
                }

                boolean expertiseHeavy = signals.expertiseRequiredRate() > 0.5;
                for (Map.Entry<String, Integer> e : signals.questionDomains().entrySet()) {
                    if (e.getValue() < MIN_DOMAIN_QUESTIONS) continue;
                    String area = e.getKey();
                    double current = scores.getOrDefault(area, NEUTRAL_SCORE);
                    if (expertiseHeavy) {
                        scores.put(area, Math.min(current + 0.2, EXPERT_SCORE));
                        addOnce(expert, area);
                    } else {
                        scores.put(area, Math.max(current - 0.1, LEARNING_SCORE));
                        addOnce(learning, area);
                    }
                }
            }

            // ── Technical vocabulary ───────────────────────────────
            if (signals.styleCount() >= MIN_STYLE_SIGNALS && signals.technicalRate() > 0.6) {
                sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
                if (vocabulary != VocabularyLevel.EXPERT) {
                    vocabulary = VocabularyLevel.ADVANCED;
                }
            }
        }

        return DimensionInference.fromSources(
            new ExpertiseCalibration(expert, learning, scores, vocabulary), sources);
    }

    private static void addOnce(List<String> list, String value) {
        if (value != null && !value.isBlank() && !list.contains(value)) {
            list.add(value);
        }
    }
}
