package com.userintel.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PrivacyTierRequest(@JsonProperty("tier") String tier) {}
