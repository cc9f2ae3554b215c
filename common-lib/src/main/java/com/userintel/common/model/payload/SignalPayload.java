package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Type-specific body of a {@link com.userintel.common.model.Signal}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MessageStylePayload.class,  name = "message_style"),
    @JsonSubTypes.Type(value = FeedbackPayload.class,      name = "feedback"),
    @JsonSubTypes.Type(value = PreferencePayload.class,    name = "preference"),
    @JsonSubTypes.Type(value = QuestionPayload.class,      name = "question"),
    @JsonSubTypes.Type(value = GoalPayload.class,          name = "goal"),
    @JsonSubTypes.Type(value = DecisionPayload.class,      name = "decision"),
    @JsonSubTypes.Type(value = ModeSelectionPayload.class, name = "mode_selection"),
    @JsonSubTypes.Type(value = RetryPayload.class,         name = "retry"),
    @JsonSubTypes.Type(value = SessionTimingPayload.class, name = "session_timing")
})
public interface SignalPayload {
}
