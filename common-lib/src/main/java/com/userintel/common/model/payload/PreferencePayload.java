package com.userintel.common.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A preference or fact the user stated outright, as a key/value pair. */
public record PreferencePayload(
    @JsonProperty("key")   PreferenceKey key,
    @JsonProperty("value") String value
) implements SignalPayload {}
