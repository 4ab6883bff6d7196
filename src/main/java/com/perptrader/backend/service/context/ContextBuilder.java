package com.perptrader.backend.service.context;

import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.model.AccountInfo;
import com.perptrader.backend.model.CandidateCoin;
import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.model.ExchangeBalance;
import com.perptrader.backend.model.ExchangePosition;
import com.perptrader.backend.model.MarketSnapshot;
import com.perptrader.backend.model.MergedCoinPool;
import com.perptrader.backend.model.OpenInterestTopEntry;
import com.perptrader.backend.model.PerformanceSummary;
import com.perptrader.backend.model.PositionInfo;
import com.perptrader.backend.model.TradingContext;
import com.perptrader.backend.service.exchange.Trader;
import com.perptrader.backend.service.journal.DecisionLogger;
import com.perptrader.backend.service.market.KlineIntervals;
import com.perptrader.backend.service.market.MarketSnapshotProvider;
import com.perptrader.backend.service.pool.CoinPoolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the per-cycle {@link TradingContext} for one agent. Only the balance and position
 * calls are fatal; everything else degrades.
 */
public class ContextBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ContextBuilder.class);

    static final String MARKET_REFERENCE_SYMBOL = "BTCUSDT";
    static final int DEFAULT_LEVERAGE = 10;

    private final AgentConfig config;
    private final Trader trader;
    private final CoinPoolProvider coinPoolProvider;
    private final MarketSnapshotProvider marketSnapshotProvider;
    private final DecisionLogger decisionLogger;
    private final TraderProperties properties;
    private final Clock clock;
    private final String shortInterval;

    public ContextBuilder(AgentConfig config, Trader trader, CoinPoolProvider coinPoolProvider,
                          MarketSnapshotProvider marketSnapshotProvider, DecisionLogger decisionLogger,
                          TraderProperties properties, Clock clock) {
        this.config = config;
        this.trader = trader;
        this.coinPoolProvider = coinPoolProvider;
        this.marketSnapshotProvider = marketSnapshotProvider;
        this.decisionLogger = decisionLogger;
        this.properties = properties;
        this.clock = clock;
        this.shortInterval = KlineIntervals.forScanMinutes(config.getScanIntervalMinutes());
    }

    public TradingContext build(AgentState state) {
        Instant now = clock.instant();
        restoreState(state);

        ExchangeBalance balance = trader.getBalance();
        List<ExchangePosition> exchangePositions = trader.getPositions();
        double totalEquity = balance.totalEquity();

        List<PositionInfo> positions = new ArrayList<>();
        Set<String> openKeys = new HashSet<>();
        double totalMarginUsed = 0;
        for (ExchangePosition position : exchangePositions) {
            String key = PositionInfo.positionKey(position.getSymbol(), position.getSide());
            PositionInfo info = toPositionInfo(position, state.firstSeen(key, now.toEpochMilli()));
            positions.add(info);
            openKeys.add(info.positionKey());
            totalMarginUsed += info.getMarginUsed();
        }
        state.forgetPositionsExcept(openKeys);

        List<CandidateCoin> candidates = new ArrayList<>();
        Map<String, OpenInterestTopEntry> oiTopData = new LinkedHashMap<>();
        loadCandidates(candidates, oiTopData);

        Map<String, MarketSnapshot> snapshots = loadSnapshots(positions, candidates);
        dropUnanalyzedCandidates(candidates, positions, snapshots);

        double initialBalance = config.getInitialBalance();
        double totalPnl = totalEquity - initialBalance;
        double totalPnlPct = initialBalance > 0 ? totalPnl / initialBalance * 100 : 0;
        double marginUsedPct = totalEquity > 0 ? totalMarginUsed / totalEquity * 100 : 0;

        AccountInfo account = AccountInfo.builder()
                .totalEquity(totalEquity)
                .availableBalance(balance.getAvailableBalance())
                .totalPnl(totalPnl)
                .totalPnlPct(totalPnlPct)
                .marginUsed(totalMarginUsed)
                .marginUsedPct(marginUsedPct)
                .positionCount(positions.size())
                .build();

        updateDailyFigures(state, totalEquity, totalPnlPct);

        return TradingContext.builder()
                .currentTime(now)
                .callCount(state.getCallCount())
                .runtimeMinutes(state.runtimeMinutes(now))
                .account(account)
                .positions(positions)
                .candidateCoins(candidates)
                .marketSnapshots(snapshots)
                .oiTopData(oiTopData)
                .performance(loadPerformance())
                .btcEthLeverage(config.getBtcEthLeverage())
                .altcoinLeverage(config.getAltcoinLeverage())
                .shortInterval(shortInterval)
                .lastEnterTime(state.getLastEnterTime())
                .lastStopTime(state.getLastStopTime())
                .lastTakeProfitTime(state.getLastTakeProfitTime())
                .consecutiveLossesCount(state.getConsecutiveLossesCount())
                .dailyLossPercent(state.getDailyLossPercent())
                .build();
    }

    /**
     * Reloads cooldowns and the loss streak from the journal once per agent lifetime. A failed
     * read is retried on the next cycle.
     */
    private void restoreState(AgentState state) {
        if (state.isRestored()) {
            return;
        }
        try {
            List<DecisionRecord> latest = decisionLogger.getLatestRecords(1);
            state.setRestored(true);
            if (latest.isEmpty()) {
                return;
            }
            state.restoreFrom(latest.get(latest.size() - 1));
            logger.info("Restored trading state from journal (last entry: {}, consecutive losses: {})",
                    state.getLastEnterTime() == null ? "null" : state.getLastEnterTime(),
                    state.getConsecutiveLossesCount());
        } catch (RuntimeException e) {
            logger.warn("Failed to restore trading state from journal: {}", e.getMessage());
        }
    }

    /**
     * Live positions as the status surface shows them, without touching first-seen bookkeeping.
     */
    public List<PositionInfo> currentPositions(AgentState state) {
        List<PositionInfo> positions = new ArrayList<>();
        for (ExchangePosition position : trader.getPositions()) {
            String key = PositionInfo.positionKey(position.getSymbol(), position.getSide());
            positions.add(toPositionInfo(position, state.getPositionFirstSeen().getOrDefault(key, 0L)));
        }
        return positions;
    }

    static PositionInfo toPositionInfo(ExchangePosition position, long firstSeenTime) {
        double quantity = Math.abs(position.getPositionAmt());
        int leverage = position.getLeverage() > 0 ? position.getLeverage() : DEFAULT_LEVERAGE;
        double marginUsed = quantity * position.getMarkPrice() / leverage;

        return PositionInfo.builder()
                .symbol(position.getSymbol())
                .side(position.getSide())
                .entryPrice(position.getEntryPrice())
                .markPrice(position.getMarkPrice())
                .quantity(quantity)
                .leverage(leverage)
                .unrealizedPnl(position.getUnrealizedProfit())
                .unrealizedPnlPct(position.pnlPercent())
                .liquidationPrice(position.getLiquidationPrice())
                .marginUsed(marginUsed)
                .firstSeenTime(firstSeenTime)
                .build();
    }

    private void loadCandidates(List<CandidateCoin> candidates, Map<String, OpenInterestTopEntry> oiTopData) {
        int limit = properties.getCoinPool().getAi500Limit();
        MergedCoinPool pool;
        try {
            pool = coinPoolProvider.getMergedPool(limit);
        } catch (RuntimeException e) {
            logger.warn("Candidate pool unavailable, continuing without candidates: {}", e.getMessage());
            return;
        }
        for (String symbol : pool.getAllSymbols()) {
            Set<String> sources = pool.getSymbolSources().get(symbol);
            candidates.add(new CandidateCoin(symbol, sources == null ? new LinkedHashSet<>() : new LinkedHashSet<>(sources)));
        }
        for (OpenInterestTopEntry entry : pool.getOiTopEntries()) {
            oiTopData.put(entry.getSymbol(), entry);
        }
        logger.info("Merged candidate pool: top {} scored + open interest ranking = {} candidates", limit, candidates.size());
    }

    /**
     * Snapshots for held symbols, candidates and the market reference. Thin markets are dropped
     * unless a position is held in them.
     */
    Map<String, MarketSnapshot> loadSnapshots(List<PositionInfo> positions, List<CandidateCoin> candidates) {
        Set<String> positionSymbols = new LinkedHashSet<>();
        positions.forEach(p -> positionSymbols.add(p.getSymbol()));

        Set<String> symbols = new LinkedHashSet<>(positionSymbols);
        candidates.forEach(c -> symbols.add(c.getSymbol()));
        symbols.add(MARKET_REFERENCE_SYMBOL);

        Map<String, MarketSnapshot> snapshots = new LinkedHashMap<>();
        double minOpenInterestUsd = properties.getMinOpenInterestUsd();
        for (String symbol : symbols) {
            try {
                MarketSnapshot snapshot = marketSnapshotProvider.getSnapshot(symbol, shortInterval);
                if (!positionSymbols.contains(symbol) && isIlliquid(snapshot, minOpenInterestUsd)) {
                    logger.info("Skipping {}: open interest value {}M USD below {}M USD",
                            symbol, String.format("%.2f", snapshot.openInterestValueUsd() / 1_000_000),
                            String.format("%.0f", minOpenInterestUsd / 1_000_000));
                    continue;
                }
                snapshots.put(symbol, snapshot);
            } catch (RuntimeException e) {
                logger.error("Failed to load market data for {}: {}", symbol, e.getMessage());
            }
        }
        return snapshots;
    }

    /**
     * Candidates the model was not shown (thin market or failed market data) leave the
     * allow-list, so they cannot be opened this cycle. Held symbols stay.
     */
    static void dropUnanalyzedCandidates(List<CandidateCoin> candidates, List<PositionInfo> positions,
                                         Map<String, MarketSnapshot> snapshots) {
        Set<String> held = new HashSet<>();
        positions.forEach(p -> held.add(p.getSymbol()));
        candidates.removeIf(coin -> !snapshots.containsKey(coin.getSymbol()) && !held.contains(coin.getSymbol()));
    }

    static boolean isIlliquid(MarketSnapshot snapshot, double minOpenInterestUsd) {
        if (snapshot.getOpenInterest() == null || snapshot.getCurrentPrice() <= 0) {
            return false;
        }
        return snapshot.openInterestValueUsd() < minOpenInterestUsd;
    }

    private void updateDailyFigures(AgentState state, double totalEquity, double totalPnlPct) {
        if (state.getDayStartEquity() == null) {
            state.setDayStartEquity(totalEquity);
        }
        double dayStart = state.getDayStartEquity();
        state.setDailyPnl(totalEquity - dayStart);
        state.setPeakEquity(Math.max(state.getPeakEquity(), Math.max(totalEquity, config.getInitialBalance())));

        double lossPct = dayStart > 0 ? state.getDailyPnl() / dayStart * 100 : totalPnlPct;
        state.setDailyLossPercent(Math.abs(Math.min(0, lossPct)));
    }

    private PerformanceSummary loadPerformance() {
        try {
            return decisionLogger.analyzePerformance(properties.getPerformanceWindow());
        } catch (RuntimeException e) {
            logger.warn("Failed to analyze recent performance: {}", e.getMessage());
            return null;
        }
    }
}
