package com.perptrader.backend.service.context;

import com.perptrader.backend.model.DecisionRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AgentStateTest {

    private static final Instant START = Instant.parse("2025-01-15T00:00:00Z");

    @Test
    void nextCycle_shouldCountFromOne() {
        AgentState state = new AgentState(START);

        assertEquals(1, state.nextCycle());
        assertEquals(2, state.nextCycle());
        assertEquals(90, state.runtimeMinutes(START.plus(Duration.ofMinutes(90))));
    }

    @Test
    void isRiskPaused_shouldHoldUntilDeadline() {
        AgentState state = new AgentState(START);
        state.pauseUntil(START.plus(Duration.ofMinutes(60)));

        assertTrue(state.isRiskPaused(START.plus(Duration.ofMinutes(59))));
        assertEquals(Duration.ofMinutes(15), state.remainingPause(START.plus(Duration.ofMinutes(45))));
        assertFalse(state.isRiskPaused(START.plus(Duration.ofMinutes(60))));
        assertEquals(Duration.ZERO, state.remainingPause(START.plus(Duration.ofMinutes(61))));
    }

    @Test
    void resetDailyIfDue_shouldResetOnlyAfterTwentyFourHours() {
        AgentState state = new AgentState(START);
        state.setDayStartEquity(1000.0);
        state.setDailyPnl(-50);

        assertFalse(state.resetDailyIfDue(START.plus(Duration.ofHours(24))));
        assertEquals(1000.0, state.getDayStartEquity());

        Instant later = START.plus(Duration.ofHours(24)).plusSeconds(1);
        assertTrue(state.resetDailyIfDue(later));
        assertNull(state.getDayStartEquity());
        assertEquals(0.0, state.getDailyPnl());
        assertEquals(later, state.getLastResetTime());
    }

    @Test
    void firstSeen_shouldKeepEarliestSightingUntilForgotten() {
        AgentState state = new AgentState(START);

        assertEquals(1000L, state.firstSeen("BTCUSDT_long", 1000L));
        assertEquals(1000L, state.firstSeen("BTCUSDT_long", 5000L));
        state.firstSeen("ETHUSDT_short", 2000L);

        state.forgetPositionsExcept(Set.of("ETHUSDT_short"));

        assertEquals(Set.of("ETHUSDT_short"), state.getPositionFirstSeen().keySet());
        assertEquals(6000L, state.firstSeen("BTCUSDT_long", 6000L));
    }

    @Test
    void markClose_shouldTrackCooldownsAndLossStreak() {
        AgentState state = new AgentState(START);
        Instant t1 = START.plusSeconds(60);
        Instant t2 = START.plusSeconds(120);

        state.markClose(-2.5, -25, t1);
        state.markClose(-0.5, -5, t2);

        assertEquals(t1.toString(), state.getLastStopTime());
        assertNull(state.getLastTakeProfitTime());
        assertEquals(2, state.getConsecutiveLossesCount());

        state.markClose(3.0, 30, t2);
        assertEquals(t2.toString(), state.getLastTakeProfitTime());
        assertEquals(0, state.getConsecutiveLossesCount());

        state.markClose(0, 0, t2);
        assertEquals(0, state.getConsecutiveLossesCount());
    }

    @Test
    void markEntry_shouldRecordEntryTimeAndFirstSeen() {
        AgentState state = new AgentState(START);
        Instant t = START.plusSeconds(300);

        state.markEntry("SOLUSDT_long", t);

        assertEquals(t.toString(), state.getLastEnterTime());
        assertEquals(t.toEpochMilli(), state.getPositionFirstSeen().get("SOLUSDT_long"));
    }

    @Test
    void restoreFrom_shouldRoundTripThroughJournalRecord() {
        AgentState state = new AgentState(START);
        state.setLastEnterTime("2025-01-15T01:00:00Z");
        state.setConsecutiveLossesCount(3);
        state.setDailyLossPercent(4.2);
        DecisionRecord record = new DecisionRecord();
        state.writeTo(record);
        record.setLastStopTime("");

        AgentState restored = new AgentState(START);
        restored.restoreFrom(record);

        assertEquals("2025-01-15T01:00:00Z", restored.getLastEnterTime());
        assertNull(restored.getLastStopTime());
        assertEquals(3, restored.getConsecutiveLossesCount());
        assertEquals(4.2, record.getDailyLossPercent());
    }
}
