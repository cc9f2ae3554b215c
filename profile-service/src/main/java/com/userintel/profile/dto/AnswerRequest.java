package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A blank or missing {@code response} records the question as skipped. */
public record AnswerRequest(
    @JsonProperty("questionId") String questionId,
    @JsonProperty("response")   String response
) {}
