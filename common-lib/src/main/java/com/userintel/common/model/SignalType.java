package com.userintel.common.model;

import com.userintel.common.model.payload.DecisionPayload;
import com.userintel.common.model.payload.FeedbackPayload;
import com.userintel.common.model.payload.GoalPayload;
import com.userintel.common.model.payload.MessageStylePayload;
import com.userintel.common.model.payload.ModeSelectionPayload;
import com.userintel.common.model.payload.PreferencePayload;
import com.userintel.common.model.payload.QuestionPayload;
import com.userintel.common.model.payload.RetryPayload;
import com.userintel.common.model.payload.SessionTimingPayload;
import com.userintel.common.model.payload.SignalPayload;

import java.util.EnumSet;
import java.util.Set;

/**
 * Every kind of signal the platform understands.
 *
 * <p>A signal contributes to exactly the domains its type maps to here; the
 * inference engine routes by this mapping and nothing else.
 */
public enum SignalType {

    MESSAGE_STYLE(SignalCategory.MESSAGE_STYLE, MessageStylePayload.class,
        EnumSet.of(BeliefDomain.COMMUNICATION_PREFS, BeliefDomain.EXPERTISE_CALIBRATION,
                   BeliefDomain.RELATIONSHIP_STATE)),
    FEEDBACK(SignalCategory.FEEDBACK, FeedbackPayload.class,
        EnumSet.of(BeliefDomain.RELATIONSHIP_STATE)),
    PREFERENCE_STATEMENT(SignalCategory.PREFERENCE_STATEMENT, PreferencePayload.class,
        EnumSet.of(BeliefDomain.COMMUNICATION_PREFS, BeliefDomain.EXPERTISE_CALIBRATION,
                   BeliefDomain.IDENTITY_CONTEXT)),
    QUESTION_SOPHISTICATION(SignalCategory.QUESTION_SOPHISTICATION, QuestionPayload.class,
        EnumSet.of(BeliefDomain.EXPERTISE_CALIBRATION)),
    GOAL_REFERENCE(SignalCategory.GOAL_REFERENCE, GoalPayload.class,
        EnumSet.of(BeliefDomain.GOALS_VALUES)),
    DECISION_MENTION(SignalCategory.DECISION_MENTION, DecisionPayload.class,
        EnumSet.of(BeliefDomain.DECISION_FRICTION)),
    MODE_SELECTION(SignalCategory.MODE_SELECTION, ModeSelectionPayload.class,
        EnumSet.of(BeliefDomain.BEHAVIORAL_PATTERNS)),
    RETRY_PATTERN(SignalCategory.RETRY_PATTERN, RetryPayload.class,
        EnumSet.of(BeliefDomain.BEHAVIORAL_PATTERNS)),
    SESSION_TIMING(SignalCategory.SESSION_TIMING, SessionTimingPayload.class,
        EnumSet.of(BeliefDomain.BEHAVIORAL_PATTERNS));

    private final SignalCategory category;
    private final Class<? extends SignalPayload> payloadType;
    private final Set<BeliefDomain> domains;

    SignalType(SignalCategory category, Class<? extends SignalPayload> payloadType,
               Set<BeliefDomain> domains) {
        this.category    = category;
        this.payloadType = payloadType;
        this.domains     = domains;
    }

    public SignalCategory category()                  { return category; }
    public Class<? extends SignalPayload> payloadType() { return payloadType; }

    public Set<BeliefDomain> domains() {
        return EnumSet.copyOf(domains);
    }

    public boolean feeds(BeliefDomain domain) {
        return domains.contains(domain);
    }
}
