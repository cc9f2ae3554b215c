package com.userintel.common.pattern;

import com.userintel.common.insight.InsightDraft;
import com.userintel.common.insight.InsightTrigger;

import java.util.List;
import java.util.Optional;

/**
 * Turns a pattern break into user-facing insight copy.
 * Low-significance breaks produce nothing.
 */
public final class InsightDrafts {

    static final double HIGH_BASE   = 8.0;
    static final double MEDIUM_BASE = 5.0;
    static final int MIN_IDLE_SECONDS = 30;

    private InsightDrafts() {}

    public static Optional<InsightDraft> fromBreak(PatternBreak pb) {
        if (pb == null || !pb.worthSurfacing()) return Optional.empty();

        String title;
        String message;
        String expanded;
        switch (pb.dimension()) {
            case RESPONSE_MODE -> {
                title    = "Different thinking mode";
                message  = "You usually go with " + pb.expected() + " mode, this time " + pb.actual() + ". Approaching this one differently?";
                expanded = "Most of your questions use " + pb.expected() + " mode, but you picked " + pb.actual()
                    + " here. That can mean the problem needs a different depth than usual. Want to talk through what changed?";
            }
            case MESSAGE_LENGTH -> {
                title    = pb.above() ? "Going deeper" : "Keeping it short";
                message  = pb.above()
                    ? "Your questions are longer than usual. Working through something complex?"
                    : "Short and direct today. Focused on quick wins?";
                expanded = pb.above()
                    ? "Your recent questions carry a lot more detail than your usual ones. Happy to slow down and go through it step by step."
                    : "Your questions are much shorter than usual. If you are short on time, say so and answers will stay brief.";
            }
            case SESSION_DURATION -> {
                title    = pb.above() ? "Long working session" : "Quick check-in";
                message  = pb.above()
                    ? "That session ran well past your usual length. Want to capture where you got to?"
                    : "Shorter session than usual. Anything left open?";
                expanded = pb.above()
                    ? "Sessions this long often end with decisions worth writing down. A short summary of what was settled can be drafted for you."
                    : "Short sessions are sometimes all that is needed. If something deserves a longer look, it can be picked up next time.";
            }
            case TOPIC -> {
                title    = "New territory";
                message  = "You're asking about " + pb.actual() + ", which is new for us.";
                expanded = "Your questions usually centre on " + pb.expected() + ". This one is about " + pb.actual()
                    + ". It may be worth connecting it to the goals you are already tracking.";
            }
            default -> throw new IllegalStateException("Unhandled dimension " + pb.dimension());
        }

        return Optional.of(new InsightDraft(
            pb.dimension().category(), title, message, expanded,
            InsightTrigger.IDLE, MIN_IDLE_SECONDS, List.of(pb.dimension().tag()),
            pb.significance() == Significance.HIGH ? HIGH_BASE : MEDIUM_BASE,
            0.5));
    }
}
