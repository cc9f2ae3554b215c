package com.userintel.common.model;

/**
 * Per-profile consent level for durable inference.
 *
 * <ul>
 *   <li>{@code A}: session-only. Signals are extracted for the live session but
 *       never persisted and the profile is never reflected.</li>
 *   <li>{@code B}: behavioural signals persisted and reflected.</li>
 *   <li>{@code C}: B plus document-derived style evidence.</li>
 * </ul>
 */
public enum PrivacyTier {
    A, B, C;

    public boolean allowsDurableInference() {
        return this != A;
    }

    /** Unknown or null values resolve to the default tier {@code B}. */
    public static PrivacyTier fromString(String value) {
        if (value == null) return B;
        try {
            return PrivacyTier.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return B;
        }
    }
}
