package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NextInsightRequest(
    @JsonProperty("trigger")            String trigger,
    @JsonProperty("idleSeconds")        Long idleSeconds,
    @JsonProperty("currentTopic")       String currentTopic,
    @JsonProperty("conversationActive") boolean conversationActive,
    @JsonProperty("focusMode")          boolean focusMode
) {}
