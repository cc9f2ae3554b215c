package com.userintel.common.insight;

/** Live estimate of how absorbed the user currently is. */
public enum EngagementLevel {
    DEEP,
    ACTIVE,
    IDLE,
    AWAY
}
