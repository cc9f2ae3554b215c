package com.userintel.common.model.payload;

public enum RetryAction {
    RETRY, REFINE, ABORT, ACCEPT
}
