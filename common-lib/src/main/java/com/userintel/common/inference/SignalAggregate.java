package com.userintel.common.inference;

import com.userintel.common.model.ResponseMode;
import com.userintel.common.model.payload.DecisionPayload;
import com.userintel.common.model.payload.FeedbackKind;
import com.userintel.common.model.payload.FeedbackPayload;
import com.userintel.common.model.payload.GoalPayload;
import com.userintel.common.model.payload.MessageStylePayload;
import com.userintel.common.model.payload.MessageTone;
import com.userintel.common.model.payload.PreferenceKey;
import com.userintel.common.model.payload.PreferencePayload;
import com.userintel.common.model.payload.QuestionPayload;
import com.userintel.common.model.payload.RetryAction;
import com.userintel.common.model.payload.RetryPayload;
import com.userintel.common.model.payload.SessionTimingPayload;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rollup of one signal batch, split by payload kind, in arrival order.
 * Derived statistics are computed on demand.
 */
public record SignalAggregate(
    List<MessageStylePayload> styles,
    List<FeedbackPayload> feedback,
    List<PreferencePayload> preferences,
    List<QuestionPayload> questions,
    List<GoalPayload> goals,
    List<DecisionPayload> decisions,
    List<ResponseMode> modeSelections,
    List<RetryPayload> retries,
    List<SessionTimingPayload> sessionTimings
) {

    public static SignalAggregate empty() {
        return new SignalAggregate(List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(), List.of());
    }

    /** True when no signal in the batch feeds this rollup. */
    public boolean isEmpty() {
        return styles.isEmpty() && feedback.isEmpty() && preferences.isEmpty() && questions.isEmpty()
            && goals.isEmpty() && decisions.isEmpty() && modeSelections.isEmpty()
            && retries.isEmpty() && sessionTimings.isEmpty();
    }

    // ── Message style ──────────────────────────────────────────────

    public int styleCount() {
        return styles.size();
    }

    public double averageWordCount() {
        return styles.stream().mapToInt(MessageStylePayload::wordCount).average().orElse(0.0);
    }

    public double structuredRate() {
        return rate(styles.stream().filter(MessageStylePayload::hasStructure).count(), styles.size());
    }

    public double technicalRate() {
        return rate(styles.stream().filter(MessageStylePayload::hasTechnicalTerms).count(), styles.size());
    }

    /** Most frequent tone; ties go to the tone seen first. Null without style data. */
    public MessageTone dominantTone() {
        Map<MessageTone, Long> counts = new LinkedHashMap<>();
        for (MessageStylePayload s : styles) {
            counts.merge(s.tone(), 1L, Long::sum);
        }
        return counts.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(null);
    }

    // ── Feedback ───────────────────────────────────────────────────

    public long feedbackCount(FeedbackKind kind) {
        return feedback.stream().filter(f -> f.kind() == kind).count();
    }

    // ── Preferences ────────────────────────────────────────────────

    /** Stated values for {@code key}, in order. */
    public List<String> preferenceValues(PreferenceKey key) {
        return preferences.stream()
            .filter(p -> p.key() == key)
            .map(PreferencePayload::value)
            .toList();
    }

    /** Most recently stated value for {@code key}, or null. */
    public String latestPreference(PreferenceKey key) {
        List<String> values = preferenceValues(key);
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }

    public boolean hasPreference(PreferenceKey... keys) {
        for (PreferenceKey k : keys) {
            if (preferences.stream().anyMatch(p -> p.key() == k)) return true;
        }
        return false;
    }

    // ── Questions ──────────────────────────────────────────────────

    public double averageComplexity() {
        return questions.stream().mapToDouble(QuestionPayload::complexity).average().orElse(0.0);
    }

    /** Share of questions that implied domain expertise. */
    public double expertiseRequiredRate() {
        return rate(questions.stream().filter(QuestionPayload::requiresExpertise).count(), questions.size());
    }

    /** Question count per recognised subject area, in first-seen order. */
    public Map<String, Integer> questionDomains() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (QuestionPayload q : questions) {
            if (q.topicDomain() != null) counts.merge(q.topicDomain(), 1, Integer::sum);
        }
        return counts;
    }

    // ── Behaviour ──────────────────────────────────────────────────

    public Map<ResponseMode, Integer> modeCounts() {
        Map<ResponseMode, Integer> counts = new EnumMap<>(ResponseMode.class);
        for (ResponseMode m : modeSelections) {
            if (m != null) counts.merge(m, 1, Integer::sum);
        }
        return counts;
    }

    public double retryActionRate(RetryAction action) {
        return rate(retries.stream().filter(r -> r.action() == action).count(), retries.size());
    }

    /** Mean duration of closed sessions, or 0 when none closed. */
    public double averageSessionMinutes() {
        return sessionTimings.stream()
            .mapToDouble(SessionTimingPayload::durationMinutes)
            .filter(d -> d > 0)
            .average()
            .orElse(0.0);
    }

    /** Most frequent start hour, lowest hour on ties; -1 without data. */
    public int mostCommonStartHour() {
        Map<Integer, Long> counts = new LinkedHashMap<>();
        sessionTimings.stream()
            .sorted(Comparator.comparingInt(SessionTimingPayload::hourOfDay))
            .forEach(t -> counts.merge(t.hourOfDay(), 1L, Long::sum));
        return counts.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(-1);
    }

    private static double rate(long part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }
}
