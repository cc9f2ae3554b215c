package com.userintel.common.elicitation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Zero or one question, with the rule that decided it. */
public record ElicitationDecision(
    @JsonProperty("ask")      boolean ask,
    @JsonProperty("question") ElicitationQuestion question,
    @JsonProperty("reason")   String reason
) {
    public static ElicitationDecision no(String reason) {
        return new ElicitationDecision(false, null, reason);
    }

    public static ElicitationDecision ask(ElicitationQuestion question, String reason) {
        return new ElicitationDecision(true, question, reason);
    }
}
