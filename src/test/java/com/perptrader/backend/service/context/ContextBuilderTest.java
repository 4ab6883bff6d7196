package com.perptrader.backend.service.context;

import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.exception.ExchangeException;
import com.perptrader.backend.model.CandidateCoin;
import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.model.ExchangeBalance;
import com.perptrader.backend.model.ExchangePosition;
import com.perptrader.backend.model.MarketSnapshot;
import com.perptrader.backend.model.MergedCoinPool;
import com.perptrader.backend.model.OpenInterest;
import com.perptrader.backend.model.OpenInterestTopEntry;
import com.perptrader.backend.model.PerformanceSummary;
import com.perptrader.backend.model.PositionInfo;
import com.perptrader.backend.model.PositionSide;
import com.perptrader.backend.model.TradingContext;
import com.perptrader.backend.service.exchange.Trader;
import com.perptrader.backend.service.journal.DecisionLogger;
import com.perptrader.backend.service.market.MarketSnapshotProvider;
import com.perptrader.backend.service.pool.CoinPoolProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ContextBuilderTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    private Trader trader;
    @Mock
    private CoinPoolProvider coinPoolProvider;
    @Mock
    private MarketSnapshotProvider marketSnapshotProvider;
    @Mock
    private DecisionLogger decisionLogger;

    private final Map<String, MarketSnapshot> snapshots = new HashMap<>();
    private AgentConfig config;
    private AgentState state;
    private ContextBuilder contextBuilder;

    @BeforeEach
    void setUp() {
        config = new AgentConfig();
        config.setId("a");
        config.setInitialBalance(1000);
        config.setScanIntervalMinutes(3);
        config.setBtcEthLeverage(10);
        config.setAltcoinLeverage(5);
        state = new AgentState(NOW.minusSeconds(3600));
        contextBuilder = new ContextBuilder(config, trader, coinPoolProvider, marketSnapshotProvider,
                decisionLogger, new TraderProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        snapshots.put("BTCUSDT", snapshot("BTCUSDT", 97000, null));
        lenient().when(marketSnapshotProvider.getSnapshot(anyString(), eq("3m")))
                .thenAnswer(invocation -> {
                    MarketSnapshot snapshot = snapshots.get((String) invocation.getArgument(0));
                    if (snapshot == null) {
                        throw new ExchangeException("binance", "no klines");
                    }
                    return snapshot;
                });
        lenient().when(decisionLogger.getLatestRecords(1)).thenReturn(List.of());
        lenient().when(decisionLogger.analyzePerformance(20)).thenReturn(PerformanceSummary.builder().sharpeRatio(0.3).build());
        lenient().when(coinPoolProvider.getMergedPool(anyInt())).thenReturn(new MergedCoinPool());
        lenient().when(trader.getBalance()).thenReturn(balance(1000, 800, 50));
        lenient().when(trader.getPositions()).thenReturn(List.of());
    }

    private static MarketSnapshot snapshot(String symbol, double price, Double openInterestUsd) {
        return MarketSnapshot.builder()
                .symbol(symbol)
                .currentPrice(price)
                .openInterest(openInterestUsd == null ? null : new OpenInterest(openInterestUsd / price, openInterestUsd / price))
                .build();
    }

    private static ExchangeBalance balance(double wallet, double available, double unrealized) {
        return ExchangeBalance.builder()
                .totalWalletBalance(wallet)
                .availableBalance(available)
                .totalUnrealizedProfit(unrealized)
                .build();
    }

    private static MergedCoinPool pool(String... symbols) {
        Map<String, Set<String>> sources = new LinkedHashMap<>();
        for (String symbol : symbols) {
            sources.put(symbol, new LinkedHashSet<>(Set.of(CandidateCoin.SOURCE_AI500)));
        }
        return MergedCoinPool.builder()
                .allSymbols(List.of(symbols))
                .symbolSources(sources)
                .oiTopEntries(List.of(OpenInterestTopEntry.builder().symbol(symbols[0]).rank(1).build()))
                .build();
    }

    @Test
    void build_shouldComputeAccountFiguresFromBalanceAndPositions() {
        when(trader.getPositions()).thenReturn(List.of(ExchangePosition.builder()
                .symbol("SOLUSDT").side(PositionSide.LONG).positionAmt(10).entryPrice(100).markPrice(105)
                .unrealizedProfit(50).leverage(5).build()));
        snapshots.put("SOLUSDT", snapshot("SOLUSDT", 105, 50_000_000.0));

        TradingContext ctx = contextBuilder.build(state);

        assertEquals(NOW, ctx.getCurrentTime());
        assertEquals(60, ctx.getRuntimeMinutes());
        assertEquals(1050.0, ctx.getAccount().getTotalEquity(), 1e-9);
        assertEquals(50.0, ctx.getAccount().getTotalPnl(), 1e-9);
        assertEquals(5.0, ctx.getAccount().getTotalPnlPct(), 1e-9);
        assertEquals(210.0, ctx.getAccount().getMarginUsed(), 1e-9);
        assertEquals(20.0, ctx.getAccount().getMarginUsedPct(), 1e-9);
        assertEquals(1, ctx.getAccount().getPositionCount());

        PositionInfo sol = ctx.getPositions().get(0);
        assertEquals(5.0, sol.getUnrealizedPnlPct(), 1e-9);
        assertEquals(NOW.toEpochMilli(), sol.getFirstSeenTime());
        assertEquals("3m", ctx.getShortInterval());
        assertEquals(10, ctx.getBtcEthLeverage());
        assertEquals(0.3, ctx.getPerformance().getSharpeRatio());
    }

    @Test
    void build_shouldDropThinCandidatesButKeepHeldSymbols() {
        when(coinPoolProvider.getMergedPool(anyInt())).thenReturn(pool("THINUSDT", "EDGEUSDT"));
        when(trader.getPositions()).thenReturn(List.of(ExchangePosition.builder()
                .symbol("HELDUSDT").side(PositionSide.SHORT).positionAmt(100).entryPrice(1).markPrice(1).leverage(3).build()));
        snapshots.put("THINUSDT", snapshot("THINUSDT", 2, 14_990_000.0));
        snapshots.put("EDGEUSDT", snapshot("EDGEUSDT", 2, 15_000_000.0));
        snapshots.put("HELDUSDT", snapshot("HELDUSDT", 1, 1_000_000.0));

        TradingContext ctx = contextBuilder.build(state);

        assertEquals(List.of("HELDUSDT", "EDGEUSDT", "BTCUSDT"), List.copyOf(ctx.getMarketSnapshots().keySet()));
        assertEquals(1, ctx.getCandidateCoins().size());
        assertFalse(ctx.isCandidate("THINUSDT"));
        assertTrue(ctx.isCandidate("EDGEUSDT"));
        assertTrue(ctx.getOiTopData().containsKey("THINUSDT"));
    }

    @Test
    void build_shouldSkipSymbolsWhoseMarketDataFails() {
        when(coinPoolProvider.getMergedPool(anyInt())).thenReturn(pool("GHOSTUSDT"));

        TradingContext ctx = contextBuilder.build(state);

        assertEquals(Set.of("BTCUSDT"), ctx.getMarketSnapshots().keySet());
        assertFalse(ctx.isCandidate("GHOSTUSDT"));
        assertTrue(ctx.getCandidateCoins().isEmpty());
    }

    @Test
    void build_shouldKeepHeldCandidateEvenWithoutMarketData() {
        when(coinPoolProvider.getMergedPool(anyInt())).thenReturn(pool("HELDUSDT", "GHOSTUSDT"));
        when(trader.getPositions()).thenReturn(List.of(ExchangePosition.builder()
                .symbol("HELDUSDT").side(PositionSide.LONG).positionAmt(1).entryPrice(10).markPrice(10).leverage(3).build()));

        TradingContext ctx = contextBuilder.build(state);

        assertFalse(ctx.getMarketSnapshots().containsKey("HELDUSDT"));
        assertTrue(ctx.isCandidate("HELDUSDT"));
        assertFalse(ctx.isCandidate("GHOSTUSDT"));
    }

    @Test
    void build_shouldContinueWithoutCandidatesWhenPoolFails() {
        when(coinPoolProvider.getMergedPool(anyInt())).thenThrow(new IllegalStateException("pool down"));
        when(decisionLogger.analyzePerformance(20)).thenThrow(new IllegalStateException("disk error"));

        TradingContext ctx = contextBuilder.build(state);

        assertTrue(ctx.getCandidateCoins().isEmpty());
        assertEquals(Set.of("BTCUSDT"), ctx.getMarketSnapshots().keySet());
        assertNull(ctx.getPerformance());
    }

    @Test
    void build_shouldFailWhenBalanceUnavailable() {
        when(trader.getBalance()).thenThrow(new ExchangeException("binance", "401 Unauthorized"));

        assertThrows(ExchangeException.class, () -> contextBuilder.build(state));
        verify(coinPoolProvider, never()).getMergedPool(anyInt());
    }

    @Test
    void build_shouldPurgeFirstSeenOfClosedPositions() {
        state.firstSeen("GONEUSDT_long", 1L);
        state.firstSeen("SOLUSDT_long", 42L);
        when(trader.getPositions()).thenReturn(List.of(ExchangePosition.builder()
                .symbol("SOLUSDT").side(PositionSide.LONG).positionAmt(1).entryPrice(100).markPrice(100).leverage(5).build()));

        TradingContext ctx = contextBuilder.build(state);

        assertEquals(42L, ctx.getPositions().get(0).getFirstSeenTime());
        assertEquals(Set.of("SOLUSDT_long"), state.getPositionFirstSeen().keySet());
    }

    @Test
    void build_shouldRestoreCooldownStateFromJournal() {
        DecisionRecord last = new DecisionRecord();
        last.setLastEnterTime("2025-01-15T09:55:00Z");
        last.setConsecutiveLossesCount(2);
        when(decisionLogger.getLatestRecords(1)).thenReturn(List.of(last));

        TradingContext ctx = contextBuilder.build(state);

        assertEquals("2025-01-15T09:55:00Z", ctx.getLastEnterTime());
        assertEquals(2, ctx.getConsecutiveLossesCount());
        assertTrue(state.isRestored());
    }

    @Test
    void build_shouldRestoreFromJournalOnlyOnce() {
        DecisionRecord last = new DecisionRecord();
        last.setConsecutiveLossesCount(2);
        when(decisionLogger.getLatestRecords(1)).thenReturn(List.of(last));

        contextBuilder.build(state);
        state.setConsecutiveLossesCount(0);
        TradingContext ctx = contextBuilder.build(state);

        assertEquals(0, ctx.getConsecutiveLossesCount());
        verify(decisionLogger, times(1)).getLatestRecords(1);
    }

    @Test
    void build_shouldRetryRestoreAfterJournalReadFailure() {
        when(decisionLogger.getLatestRecords(1))
                .thenThrow(new IllegalStateException("disk error"))
                .thenReturn(List.of());

        contextBuilder.build(state);
        assertFalse(state.isRestored());

        contextBuilder.build(state);
        assertTrue(state.isRestored());
        verify(decisionLogger, times(2)).getLatestRecords(1);
    }

    @Test
    void build_shouldTrackDailyLossFromDayStartEquity() {
        contextBuilder.build(state);
        assertEquals(1050.0, state.getDayStartEquity());
        assertEquals(1050.0, state.getPeakEquity());

        when(trader.getBalance()).thenReturn(balance(945, 900, 0));
        TradingContext ctx = contextBuilder.build(state);

        assertEquals(10.0, ctx.getDailyLossPercent(), 1e-9);
        assertEquals(-105.0, state.getDailyPnl(), 1e-9);
        assertEquals(1050.0, state.getPeakEquity());
    }

    @Test
    void currentPositions_shouldNotRecordFirstSightings() {
        when(trader.getPositions()).thenReturn(List.of(ExchangePosition.builder()
                .symbol("ETHUSDT").side(PositionSide.SHORT).positionAmt(1).entryPrice(3000).markPrice(2900).build()));

        List<PositionInfo> positions = contextBuilder.currentPositions(state);

        assertEquals(0L, positions.get(0).getFirstSeenTime());
        assertEquals(10, positions.get(0).getLeverage());
        assertFalse(state.getPositionFirstSeen().containsKey("ETHUSDT_short"));
    }

    @Test
    void isIlliquid_shouldIgnoreUnknownOpenInterest() {
        assertFalse(ContextBuilder.isIlliquid(snapshot("X", 1, null), 15_000_000));
        assertFalse(ContextBuilder.isIlliquid(snapshot("X", 0, 1.0), 15_000_000));
    }
}
