package com.userintel.scheduler.strategy;

import com.userintel.common.reflection.BatchReflectionSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SweepTempoStrategyTest {

    @Test
    @DisplayName("call failed → fallback interval")
    void callFailed() {
        assertEquals(SweepTempoStrategy.FALLBACK_INTERVAL, SweepTempoStrategy.resolve(null, 50));
    }

    @Test
    @DisplayName("nothing eligible → idle interval")
    void nothingEligible() {
        assertEquals(SweepTempoStrategy.IDLE_INTERVAL,
            SweepTempoStrategy.resolve(BatchReflectionSummary.empty(), 50));
    }

    @Test
    @DisplayName("limit filled → backlog interval")
    void limitFilled() {
        BatchReflectionSummary full = new BatchReflectionSummary(50, 48, 1, 1, List.of("u9: timeout"));
        assertEquals(SweepTempoStrategy.BACKLOG_INTERVAL, SweepTempoStrategy.resolve(full, 50));
    }

    @Test
    @DisplayName("partial sweep → steady interval")
    void partial() {
        BatchReflectionSummary partial = new BatchReflectionSummary(12, 10, 0, 2, List.of());
        assertEquals(SweepTempoStrategy.STEADY_INTERVAL, SweepTempoStrategy.resolve(partial, 50));
    }

    @Test
    @DisplayName("every profile failed → fallback, even when the limit was filled")
    void allFailed() {
        BatchReflectionSummary broken = new BatchReflectionSummary(50, 0, 50, 0, List.of("u1: connection reset"));
        assertEquals(SweepTempoStrategy.FALLBACK_INTERVAL, SweepTempoStrategy.resolve(broken, 50));
    }
}
