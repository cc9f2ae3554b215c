package com.userintel.common.model.payload;

public enum FeedbackKind {
    CORRECTION, PRAISE, FRUSTRATION, ACCEPTANCE, REJECTION
}
