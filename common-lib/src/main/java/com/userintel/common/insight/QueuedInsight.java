package com.userintel.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * An insight sitting in a session's queue. Content is fixed at creation;
 * only the lifecycle moves, and only along {@link InsightState} edges.
 */
public final class QueuedInsight {

    private final String id;
    private final InsightCategory category;
    private final String title;
    private final String message;
    private final String expandedContent;
    private final int priority;
    private final InsightTrigger trigger;
    private final int minIdleSeconds;
    private final List<String> contextTags;
    private final Instant createdAt;
    private final Instant expiresAt;

    private InsightState state = InsightState.PENDING;
    private Instant deliveredAt;
    private Instant engagedAt;
    private Instant dismissedAt;
    private EngagementAction engagementAction;
    private Double feedbackRating;

    QueuedInsight(String id, InsightDraft draft, int priority, Instant createdAt) {
        this.id              = id;
        this.category        = draft.category();
        this.title           = draft.title();
        this.message         = draft.message();
        this.expandedContent = draft.expandedContent();
        this.priority        = clampPriority(priority);
        this.trigger         = draft.trigger();
        this.minIdleSeconds  = draft.minIdleSeconds();
        this.contextTags     = draft.contextTags();
        this.createdAt       = createdAt;
        this.expiresAt       = createdAt.plus(draft.category().ttl());
    }

    static int clampPriority(int priority) {
        return Math.max(1, Math.min(10, priority));
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    void markDelivered(Instant now) {
        transition(InsightState.DELIVERED);
        this.deliveredAt = now;
    }

    void markExpired() {
        transition(InsightState.EXPIRED);
    }

    void resolve(EngagementAction action, Double rating, Instant now) {
        transition(action.resultingState());
        this.engagementAction = action;
        if (action == EngagementAction.EXPAND || action == EngagementAction.ACT) {
            this.engagedAt = now;
        } else if (action == EngagementAction.DISMISS) {
            this.dismissedAt = now;
        }
        if (rating != null) {
            this.feedbackRating = Math.max(-1.0, Math.min(1.0, rating));
        }
    }

    private void transition(InsightState next) {
        if (!state.canTransitionTo(next)) {
            throw new InsightTransitionException(id, state, next);
        }
        this.state = next;
    }

    public boolean isExpired(Instant now) {
        return state == InsightState.EXPIRED || !expiresAt.isAfter(now);
    }

    public boolean isPending() {
        return state == InsightState.PENDING;
    }

    // ── accessors ─────────────────────────────────────────────────────────────

    @JsonProperty("id")               public String getId()                   { return id; }
    @JsonProperty("category")         public InsightCategory getCategory()    { return category; }
    @JsonProperty("title")            public String getTitle()                { return title; }
    @JsonProperty("message")          public String getMessage()              { return message; }
    @JsonProperty("expandedContent")  public String getExpandedContent()      { return expandedContent; }
    @JsonProperty("priority")         public int getPriority()                { return priority; }
    @JsonProperty("trigger")          public InsightTrigger getTrigger()      { return trigger; }
    @JsonProperty("minIdleSeconds")   public int getMinIdleSeconds()          { return minIdleSeconds; }
    @JsonProperty("contextTags")      public List<String> getContextTags()    { return contextTags; }
    @JsonProperty("createdAt")        public Instant getCreatedAt()           { return createdAt; }
    @JsonProperty("expiresAt")        public Instant getExpiresAt()           { return expiresAt; }
    @JsonProperty("state")            public InsightState getState()          { return state; }
    @JsonProperty("deliveredAt")      public Instant getDeliveredAt()         { return deliveredAt; }
    @JsonProperty("engagedAt")        public Instant getEngagedAt()           { return engagedAt; }
    @JsonProperty("dismissedAt")      public Instant getDismissedAt()         { return dismissedAt; }
    @JsonProperty("engagementType")   public EngagementAction getEngagementAction() { return engagementAction; }
    @JsonProperty("feedbackRating")   public Double getFeedbackRating()       { return feedbackRating; }
}
