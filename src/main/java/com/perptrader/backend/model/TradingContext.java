package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of everything the model sees in one cycle. Built fresh and thrown away each cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingContext {
    private Instant currentTime;
    private int callCount;
    private long runtimeMinutes;
    private AccountInfo account;
    @Builder.Default
    private List<PositionInfo> positions = new ArrayList<>();
    @Builder.Default
    private List<CandidateCoin> candidateCoins = new ArrayList<>();
    @Builder.Default
    private Map<String, MarketSnapshot> marketSnapshots = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, OpenInterestTopEntry> oiTopData = new LinkedHashMap<>();
    private PerformanceSummary performance;
    private int btcEthLeverage;
    private int altcoinLeverage;
    private String shortInterval;

    private String lastEnterTime;
    private String lastStopTime;
    private String lastTakeProfitTime;
    private int consecutiveLossesCount;
    private double dailyLossPercent;

    public boolean isCandidate(String symbol) {
        return candidateCoins.stream().anyMatch(coin -> coin.getSymbol().equals(symbol));
    }
}
