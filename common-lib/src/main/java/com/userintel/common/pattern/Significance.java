package com.userintel.common.pattern;

public enum Significance {
    LOW,
    MEDIUM,
    HIGH
}
