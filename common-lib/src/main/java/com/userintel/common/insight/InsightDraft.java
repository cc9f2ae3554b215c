package com.userintel.common.insight;

import java.util.List;
import java.util.Objects;

/**
 * A candidate insight produced by a detector, before it is scored and queued.
 *
 * @param basePriority  starting score for the priority scorer (detectors use 8 for high, 5 for medium)
 * @param confidence    how sure the detector is, 0..1
 * @param minIdleSeconds idle time required before an {@link InsightTrigger#IDLE} insight may surface
 * @param contextTags   lower-case tags matched against goals and the current topic
 */
public record InsightDraft(
    InsightCategory category,
    String title,
    String message,
    String expandedContent,
    InsightTrigger trigger,
    int minIdleSeconds,
    List<String> contextTags,
    double basePriority,
    double confidence
) {
    public static final double DEFAULT_BASE_PRIORITY = 5.0;

    public InsightDraft {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(trigger, "trigger");
        title          = title == null ? "" : title;
        message        = message == null ? "" : message;
        contextTags    = contextTags == null ? List.of() : List.copyOf(contextTags);
        minIdleSeconds = Math.max(0, minIdleSeconds);
        if (!(basePriority > 0)) basePriority = DEFAULT_BASE_PRIORITY;
        confidence     = Double.isNaN(confidence) ? 0.5 : Math.max(0.0, Math.min(1.0, confidence));
    }

    public boolean hasExpandedContent() {
        return expandedContent != null && !expandedContent.isBlank();
    }
}
