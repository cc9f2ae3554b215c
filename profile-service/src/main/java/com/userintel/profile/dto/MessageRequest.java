package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** @param mode response mode the user picked for this turn; optional */
public record MessageRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("messageId") String messageId,
    @JsonProperty("text")      String text,
    @JsonProperty("mode")      String mode
) {}
