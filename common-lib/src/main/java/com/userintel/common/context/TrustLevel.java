package com.userintel.common.context;

public enum TrustLevel {
    NEW,
    DEVELOPING,
    ESTABLISHED;

    static TrustLevel of(double trustMaturity) {
        if (trustMaturity > 0.7) return ESTABLISHED;
        if (trustMaturity > 0.3) return DEVELOPING;
        return NEW;
    }
}
