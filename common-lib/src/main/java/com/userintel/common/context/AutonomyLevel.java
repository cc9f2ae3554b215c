package com.userintel.common.context;

public enum AutonomyLevel {
    LOW(0.3),
    MEDIUM(0.5),
    HIGH(0.8);

    private final double adapterValue;

    AutonomyLevel(double adapterValue) {
        this.adapterValue = adapterValue;
    }

    public double adapterValue() { return adapterValue; }

    static AutonomyLevel of(double autonomyTolerance) {
        if (autonomyTolerance > 0.7) return HIGH;
        if (autonomyTolerance > 0.4) return MEDIUM;
        return LOW;
    }
}
