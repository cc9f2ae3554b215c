package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Low-information description of how a message was written. Emitted for
 * every message so that style averages always have data.
 */
public record MessageStylePayload(
    @JsonProperty("wordCount")         int wordCount,
    @JsonProperty("sentenceCount")     int sentenceCount,
    @JsonProperty("hasStructure")      boolean hasStructure,
    @JsonProperty("hasTechnicalTerms") boolean hasTechnicalTerms,
    @JsonProperty("questionCount")     int questionCount,
    @JsonProperty("tone")              MessageTone tone
) implements SignalPayload {

    public double avgWordsPerSentence() {
        return sentenceCount > 0 ? (double) wordCount / sentenceCount : wordCount;
    }
}
