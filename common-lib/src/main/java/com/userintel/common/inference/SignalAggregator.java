package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.ResponseMode;
import com.userintel.common.model.Signal;
import com.userintel.common.model.payload.DecisionPayload;
import com.userintel.common.model.payload.FeedbackPayload;
import com.userintel.common.model.payload.GoalPayload;
import com.userintel.common.model.payload.MessageStylePayload;
import com.userintel.common.model.payload.ModeSelectionPayload;
import com.userintel.common.model.payload.PreferencePayload;
import com.userintel.common.model.payload.QuestionPayload;
import com.userintel.common.model.payload.RetryPayload;
import com.userintel.common.model.payload.SessionTimingPayload;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits a signal batch into a {@link SignalAggregate}.
 */
public final class SignalAggregator {

    private SignalAggregator() {}

    public static SignalAggregate aggregate(Collection<Signal> signals) {
        return aggregate(signals, null);
    }

    /**
     * Aggregates only the signals whose type feeds {@code domain}; a null domain
     * keeps every signal.
     */
    public static SignalAggregate aggregate(Collection<Signal> signals, BeliefDomain domain) {
        if (signals == null || signals.isEmpty()) {
            return SignalAggregate.empty();
        }
        List<MessageStylePayload> styles = new ArrayList<>();
        List<FeedbackPayload> feedback = new ArrayList<>();
        List<PreferencePayload> preferences = new ArrayList<>();
        List<QuestionPayload> questions = new ArrayList<>();
        List<GoalPayload> goals = new ArrayList<>();
        List<DecisionPayload> decisions = new ArrayList<>();
        List<ResponseMode> modes = new ArrayList<>();
        List<RetryPayload> retries = new ArrayList<>();
        List<SessionTimingPayload> timings = new ArrayList<>();

        for (Signal s : signals) {
            if (s == null || (domain != null && !s.signalType().feeds(domain))) continue;

            if (s.payload() instanceof MessageStylePayload p)        styles.add(p);
            else if (s.payload() instanceof FeedbackPayload p)       feedback.add(p);
            else if (s.payload() instanceof PreferencePayload p)     preferences.add(p);
            else if (s.payload() instanceof QuestionPayload p)       questions.add(p);
            else if (s.payload() instanceof GoalPayload p)           goals.add(p);
            else if (s.payload() instanceof DecisionPayload p)       decisions.add(p);
            else if (s.payload() instanceof ModeSelectionPayload p)  modes.add(p.mode());
            else if (s.payload() instanceof RetryPayload p)          retries.add(p);
            else if (s.payload() instanceof SessionTimingPayload p)  timings.add(p);
        }
        return new SignalAggregate(List.copyOf(styles), List.copyOf(feedback), List.copyOf(preferences),
            List.copyOf(questions), List.copyOf(goals), List.copyOf(decisions),
            modes.stream().filter(m -> m != null).toList(), List.copyOf(retries), List.copyOf(timings));
    }
}
