package com.userintel.common.model.domain;

public enum Verbosity {
    CONCISE, MODERATE, DETAILED
}
