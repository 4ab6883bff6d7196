package com.perptrader.backend.service.context;

import com.perptrader.backend.model.DecisionRecord;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state an agent carries from one cycle to the next. Written only by the agent's own
 * thread; the status endpoints read it concurrently.
 */
@Data
public class AgentState {

    static final Duration DAY = Duration.ofHours(24);

    private final Instant startTime;
    private volatile int callCount;

    private volatile String lastEnterTime;
    private volatile String lastStopTime;
    private volatile String lastTakeProfitTime;
    private volatile int consecutiveLossesCount;
    private volatile double dailyLossPercent;

    /** Equity at the start of the current 24 h window; null until the first context build. */
    private volatile Double dayStartEquity;
    private volatile double dailyPnl;
    private volatile Instant lastResetTime;
    private volatile double peakEquity;
    private volatile Instant stopUntil;
    /** Set once the journal has been read back after a start. */
    private volatile boolean restored;

    // Key: SYMBOL_side, Value: epoch millis of first sighting
    private final Map<String, Long> positionFirstSeen = new ConcurrentHashMap<>();

    public AgentState(Instant startTime) {
        this.startTime = startTime;
        this.lastResetTime = startTime;
    }

    public int nextCycle() {
        return ++callCount;
    }

    public long runtimeMinutes(Instant now) {
        return Duration.between(startTime, now).toMinutes();
    }

    public boolean isRiskPaused(Instant now) {
        return stopUntil != null && now.isBefore(stopUntil);
    }

    public Duration remainingPause(Instant now) {
        return isRiskPaused(now) ? Duration.between(now, stopUntil) : Duration.ZERO;
    }

    public void pauseUntil(Instant until) {
        this.stopUntil = until;
    }

    /**
     * Starts a new daily window when 24 h have passed since the last one.
     *
     * @return true when the window was reset
     */
    public boolean resetDailyIfDue(Instant now) {
        if (Duration.between(lastResetTime, now).compareTo(DAY) <= 0) {
            return false;
        }
        dailyPnl = 0;
        dayStartEquity = null;
        lastResetTime = now;
        return true;
    }

    /**
     * Records the first sighting of a position and returns when it was first seen.
     */
    public long firstSeen(String positionKey, long nowMillis) {
        return positionFirstSeen.computeIfAbsent(positionKey, key -> nowMillis);
    }

    public void forgetPositionsExcept(Set<String> openKeys) {
        positionFirstSeen.keySet().retainAll(openKeys);
    }

    public void markEntry(String positionKey, Instant now) {
        positionFirstSeen.put(positionKey, now.toEpochMilli());
        lastEnterTime = now.toString();
    }

    /**
     * Applies the outcome of a close: cooldown timestamps for clear losses and wins,
     * and the consecutive loss streak.
     */
    public void markClose(double pnlPercent, double realizedPnl, Instant now) {
        if (pnlPercent < -1.0) {
            lastStopTime = now.toString();
        } else if (pnlPercent > 1.0) {
            lastTakeProfitTime = now.toString();
        }
        if (realizedPnl < 0) {
            consecutiveLossesCount++;
        } else if (realizedPnl > 0) {
            consecutiveLossesCount = 0;
        }
    }

    /** Reloads the cooldown and streak fields persisted in a journal record. */
    public void restoreFrom(DecisionRecord record) {
        this.lastEnterTime = emptyToNull(record.getLastEnterTime());
        this.lastStopTime = emptyToNull(record.getLastStopTime());
        this.lastTakeProfitTime = emptyToNull(record.getLastTakeProfitTime());
        this.consecutiveLossesCount = record.getConsecutiveLossesCount();
    }

    public void writeTo(DecisionRecord record) {
        record.setLastEnterTime(lastEnterTime);
        record.setLastStopTime(lastStopTime);
        record.setLastTakeProfitTime(lastTakeProfitTime);
        record.setConsecutiveLossesCount(consecutiveLossesCount);
        record.setDailyLossPercent(dailyLossPercent);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
