package com.userintel.common.model.domain;

public enum ResponseFormat {
    BULLETS, PROSE, MIXED
}
