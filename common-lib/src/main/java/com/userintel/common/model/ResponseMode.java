package com.userintel.common.model;

/** Response depth a user can pick for a turn. */
public enum ResponseMode {
    QUICK, THOUGHTFUL, CONTEMPLATE, COUNCIL;

    /** Lenient parse; returns null for unknown values. */
    public static ResponseMode fromString(String value) {
        if (value == null) return null;
        for (ResponseMode m : values()) {
            if (m.name().equalsIgnoreCase(value.trim())) return m;
        }
        return null;
    }
}
