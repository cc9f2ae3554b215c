package com.userintel.common.pattern;

import com.userintel.common.insight.InsightCategory;

/** Behaviour dimension a pattern break was observed on, and the insight kind it becomes. */
public enum BreakDimension {
    RESPONSE_MODE("response_mode", InsightCategory.CONTRADICTION),
    MESSAGE_LENGTH("message_length", InsightCategory.CLARIFY),
    SESSION_DURATION("session_duration", InsightCategory.NEXT_STEP),
    TOPIC("topic_category", InsightCategory.RECALL);

    private final String tag;
    private final InsightCategory category;

    BreakDimension(String tag, InsightCategory category) {
        this.tag      = tag;
        this.category = category;
    }

    public String tag()                { return tag; }
    public InsightCategory category()  { return category; }
}
