package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param durationMinutes only read on close; when absent the duration is
 *                        measured from the session start seen by this process
 * @param timezone        IANA zone used for the session-timing signal; UTC when absent
 */
public record SessionRequest(
    @JsonProperty("sessionId")       String sessionId,
    @JsonProperty("durationMinutes") Double durationMinutes,
    @JsonProperty("timezone")        String timezone
) {}
