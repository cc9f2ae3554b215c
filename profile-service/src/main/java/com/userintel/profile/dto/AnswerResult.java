package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.KnownFact;

import java.util.List;

public record AnswerResult(
    @JsonProperty("recorded") boolean recorded,
    @JsonProperty("skipped")  boolean skipped,
    @JsonProperty("facts")    List<KnownFact> facts,
    @JsonProperty("reason")   String reason
) {
    public static AnswerResult notRecorded(String reason) {
        return new AnswerResult(false, false, List.of(), reason);
    }
}
