package com.userintel.common.model;

/** Coarse grouping of signal types, used for storage partitioning and audit. */
public enum SignalCategory {
    MESSAGE_STYLE,
    FEEDBACK,
    PREFERENCE_STATEMENT,
    QUESTION_SOPHISTICATION,
    GOAL_REFERENCE,
    DECISION_MENTION,
    MODE_SELECTION,
    RETRY_PATTERN,
    SESSION_TIMING
}
