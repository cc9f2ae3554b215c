package com.userintel.common.insight;

import java.util.EnumMap;
import java.util.Map;

/**
 * Shown / engaged counters and explicit ratings per insight category.
 * The engaged-to-shown ratio breaks priority ties between candidates.
 */
public final class CategoryEngagement {

    /** Rate assumed for a category that has never been shown. */
    public static final double DEFAULT_RATE = 0.5;

    private final Map<InsightCategory, int[]> counters = new EnumMap<>(InsightCategory.class);
    private final Map<InsightCategory, double[]> ratings = new EnumMap<>(InsightCategory.class);

    public void recordShown(InsightCategory category) {
        counters.computeIfAbsent(category, c -> new int[2])[0]++;
    }

    public void recordEngaged(InsightCategory category) {
        counters.computeIfAbsent(category, c -> new int[2])[1]++;
    }

    public void recordRating(InsightCategory category, double rating) {
        double[] sumAndCount = ratings.computeIfAbsent(category, c -> new double[2]);
        sumAndCount[0] += Math.max(-1.0, Math.min(1.0, rating));
        sumAndCount[1] += 1;
    }

    public int shown(InsightCategory category) {
        int[] c = counters.get(category);
        return c == null ? 0 : c[0];
    }

    public int engaged(InsightCategory category) {
        int[] c = counters.get(category);
        return c == null ? 0 : c[1];
    }

    public double engagementRate(InsightCategory category) {
        int shown = shown(category);
        return shown == 0 ? DEFAULT_RATE : (double) engaged(category) / shown;
    }

    /** Mean explicit rating in [-1, 1], or null without any rating. */
    public Double averageRating(InsightCategory category) {
        double[] sumAndCount = ratings.get(category);
        return sumAndCount == null || sumAndCount[1] == 0 ? null : sumAndCount[0] / sumAndCount[1];
    }

    public Map<InsightCategory, Map<String, Number>> snapshot() {
        Map<InsightCategory, Map<String, Number>> out = new EnumMap<>(InsightCategory.class);
        for (InsightCategory category : InsightCategory.values()) {
            out.put(category, Map.of(
                "shown",   shown(category),
                "engaged", engaged(category),
                "rate",    engagementRate(category)));
        }
        return out;
    }
}
