package com.userintel.common.signal;

import com.userintel.common.model.ResponseMode;
import com.userintel.common.model.Signal;
import com.userintel.common.model.SignalType;
import com.userintel.common.model.payload.ModeSelectionPayload;
import com.userintel.common.model.payload.RetryAction;
import com.userintel.common.model.payload.RetryPayload;
import com.userintel.common.model.payload.SessionTimingPayload;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Factories for signals that come from session events rather than message text.
 */
public final class BehaviorSignals {

    static final double MODE_STRENGTH          = 0.6;
    static final double RETRY_ACCEPT_STRENGTH  = 0.5;
    static final double RETRY_STRENGTH         = 0.7;
    static final double SESSION_TIMING_STRENGTH = 0.5;

    private BehaviorSignals() {}

    public static Signal modeSelection(ResponseMode mode, String sessionId, Instant at) {
        return new Signal(SignalType.MODE_SELECTION, MODE_STRENGTH, sessionId, null, at,
            new ModeSelectionPayload(mode));
    }

    /** Accepting a response is weaker evidence than pushing back on it. */
    public static Signal retry(RetryAction action, int attemptNumber, String sessionId, Instant at) {
        double strength = action == RetryAction.ACCEPT ? RETRY_ACCEPT_STRENGTH : RETRY_STRENGTH;
        return new Signal(SignalType.RETRY_PATTERN, strength, sessionId, null, at,
            new RetryPayload(action, Math.max(1, attemptNumber)));
    }

    /**
     * @param start           session start
     * @param zone            user's zone, used for hour-of-day and weekday
     * @param durationMinutes 0 when the session is still open
     */
    public static Signal sessionTiming(Instant start, ZoneId zone, double durationMinutes,
                                       String sessionId, Instant at) {
        ZonedDateTime local = start.atZone(zone);
        DayOfWeek day = local.getDayOfWeek();
        return new Signal(SignalType.SESSION_TIMING, SESSION_TIMING_STRENGTH, sessionId, null, at,
            new SessionTimingPayload(local.getHour(), day.getValue(), Math.max(0.0, durationMinutes)));
    }
}
