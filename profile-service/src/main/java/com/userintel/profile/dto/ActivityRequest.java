package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ActivityRequest(
    @JsonProperty("type")       String type,
    @JsonProperty("charsTyped") int charsTyped
) {}
