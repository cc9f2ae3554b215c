package com.userintel.common.insight;

/**
 * ON surfaces proactively, QUIET only surfaces high-priority insights,
 * OFF never surfaces.
 */
public enum BubbleMode {
    ON,
    QUIET,
    OFF
}
