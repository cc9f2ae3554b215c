package com.userintel.common.pattern;

import com.userintel.common.model.ResponseMode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rolling per-user behaviour baseline that pattern breaks are measured against.
 * Mutated only through {@link PatternBreakDetector}.
 */
public final class BehaviorBaseline {

    /** Most recent distinct topics remembered. */
    static final int MAX_TOPICS = 5;

    private int observations;
    private double averageWordCount;
    private final Map<ResponseMode, Integer> modeCounts = new EnumMap<>(ResponseMode.class);
    private int sessions;
    private double averageSessionMinutes;
    private final Deque<String> topTopics = new ArrayDeque<>();

    void recordMessage(int wordCount, ResponseMode mode, String topic) {
        observations++;
        averageWordCount = (averageWordCount * (observations - 1) + Math.max(0, wordCount)) / observations;
        if (mode != null) modeCounts.merge(mode, 1, Integer::sum);
        if (topic != null && !topic.isBlank() && !topTopics.contains(topic)) {
            topTopics.addLast(topic);
            if (topTopics.size() > MAX_TOPICS) topTopics.removeFirst();
        }
    }

    void recordSession(double minutes) {
        sessions++;
        averageSessionMinutes = (averageSessionMinutes * (sessions - 1) + Math.max(0, minutes)) / sessions;
    }

    /** Most used mode so far; ties resolve towards the faster mode. Null without data. */
    public ResponseMode preferredMode() {
        ResponseMode best = null;
        int bestCount = 0;
        for (ResponseMode mode : ResponseMode.values()) {
            int count = modeCounts.getOrDefault(mode, 0);
            if (count > bestCount) {
                best      = mode;
                bestCount = count;
            }
        }
        return best;
    }

    public double modeShare(ResponseMode mode) {
        int total = totalModes();
        return total == 0 ? 0.0 : (double) modeCounts.getOrDefault(mode, 0) / total;
    }

    public int totalModes() {
        int total = 0;
        for (int c : modeCounts.values()) total += c;
        return total;
    }

    public int observations()            { return observations; }
    public double averageWordCount()     { return averageWordCount; }
    public int sessions()                { return sessions; }
    public double averageSessionMinutes() { return averageSessionMinutes; }
    public List<String> topTopics()      { return List.copyOf(topTopics); }
}
