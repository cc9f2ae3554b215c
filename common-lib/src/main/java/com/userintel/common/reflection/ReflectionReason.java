package com.userintel.common.reflection;

/** Why a reflection pass ran, or was allowed to run. */
public enum ReflectionReason {
    /** Enough unprocessed signals piled up. */
    SIGNAL_THRESHOLD,
    /** The scheduled next reflection time has passed. */
    SCHEDULE_DUE,
    /** Over a day since the last pass and something new arrived. */
    STALE_WITH_SIGNALS,
    /** Never reflected and a handful of signals exist. */
    FIRST_RUN,
    SESSION_CLOSE,
    DECISION_CLUSTER,
    MANUAL
}
