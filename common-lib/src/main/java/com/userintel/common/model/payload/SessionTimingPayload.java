package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * When a session happened and how long it lasted.
 *
 * @param hourOfDay       0–23 in the user's zone
 * @param dayOfWeek       1 (Monday) – 7 (Sunday)
 * @param durationMinutes session length, 0 when the session is still open
 */
public record SessionTimingPayload(
    @JsonProperty("hourOfDay")       int hourOfDay,
    @JsonProperty("dayOfWeek")       int dayOfWeek,
    @JsonProperty("durationMinutes") double durationMinutes
) implements SignalPayload {}
