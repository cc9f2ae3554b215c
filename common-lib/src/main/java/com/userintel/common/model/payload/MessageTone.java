package com.userintel.common.model.payload;

public enum MessageTone {
    FORMAL, CASUAL, TECHNICAL, MIXED
}
