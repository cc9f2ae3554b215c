package com.userintel.common.model;

/**
 * Stability tier of a belief domain. The tier fixes how quickly confidence in
 * a stored belief erodes when no fresh evidence arrives.
 */
public enum DomainTier {
    /** Slow-moving facts about the person (identity, long-term goals). */
    FOUNDATION,
    /** How the person likes to communicate and learn. */
    STYLE,
    /** Behaviour that shifts week to week. */
    DYNAMICS
}
