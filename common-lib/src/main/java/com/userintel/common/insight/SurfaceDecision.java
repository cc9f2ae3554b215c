package com.userintel.common.insight;

/** Outcome of the engagement/budget gate, with the reason when it refuses. */
public record SurfaceDecision(boolean canSurface, String reason) {

    public static SurfaceDecision allow() {
        return new SurfaceDecision(true, null);
    }

    public static SurfaceDecision allow(String reason) {
        return new SurfaceDecision(true, reason);
    }

    public static SurfaceDecision deny(String reason) {
        return new SurfaceDecision(false, reason);
    }
}
