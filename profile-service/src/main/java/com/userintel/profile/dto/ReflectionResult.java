package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.inference.BeliefGap;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.reflection.ReflectionReason;

import java.util.List;

/**
 * Outcome of one reflection attempt for one user. Failures are carried in
 * {@code errors}; a result is never thrown.
 *
 * @param ran              false when the pass was skipped or failed before writing
 * @param domainsUpdated   domains whose value was replaced in this pass
 * @param gaps             elicitation-gap candidates after the pass
 */
public record ReflectionResult(
    @JsonProperty("userId")           String userId,
    @JsonProperty("reason")           ReflectionReason reason,
    @JsonProperty("ran")              boolean ran,
    @JsonProperty("signalsProcessed") int signalsProcessed,
    @JsonProperty("domainsUpdated")   List<BeliefDomain> domainsUpdated,
    @JsonProperty("gaps")             List<BeliefGap> gaps,
    @JsonProperty("skipReason")       String skipReason,
    @JsonProperty("errors")           List<String> errors
) {
    public static ReflectionResult skipped(String userId, String why) {
        return new ReflectionResult(userId, null, false, 0, List.of(), List.of(), why, List.of());
    }

    public static ReflectionResult failed(String userId, ReflectionReason reason, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ReflectionResult(userId, reason, false, 0, List.of(), List.of(), null,
            List.of(userId + ": " + message));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
