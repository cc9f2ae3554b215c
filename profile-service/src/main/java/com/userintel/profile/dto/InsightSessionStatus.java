package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.insight.EngagementLevel;
import com.userintel.common.insight.InsightCategory;
import com.userintel.common.insight.QueuedInsight;

import java.util.Map;

public record InsightSessionStatus(
    @JsonProperty("sessionId")            String sessionId,
    @JsonProperty("pending")              int pending,
    @JsonProperty("activeInsight")        QueuedInsight activeInsight,
    @JsonProperty("engagementLevel")      EngagementLevel engagementLevel,
    @JsonProperty("idleSeconds")          long idleSeconds,
    @JsonProperty("deliveredThisSession") int deliveredThisSession,
    @JsonProperty("budgetUsed")           int budgetUsed,
    @JsonProperty("categoryEngagement")   Map<InsightCategory, Map<String, Number>> categoryEngagement
) {}
