package com.userintel.common.model.domain;

public enum TonePreference {
    DIRECTIVE, EXPLORATORY, SUPPORTIVE
}
