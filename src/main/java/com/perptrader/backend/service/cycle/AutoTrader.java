package com.perptrader.backend.service.cycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.exception.AIUnavailableException;
import com.perptrader.backend.exception.MalformedResponseException;
import com.perptrader.backend.exception.ValidationRejectedException;
import com.perptrader.backend.model.AccountOverview;
import com.perptrader.backend.model.AccountSnapshot;
import com.perptrader.backend.model.CandidateCoin;
import com.perptrader.backend.model.CycleState;
import com.perptrader.backend.model.Decision;
import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.model.ExchangeBalance;
import com.perptrader.backend.model.FullDecision;
import com.perptrader.backend.model.PositionInfo;
import com.perptrader.backend.model.PositionSnapshot;
import com.perptrader.backend.model.TradeAction;
import com.perptrader.backend.model.TraderStatus;
import com.perptrader.backend.model.TradingContext;
import com.perptrader.backend.service.ai.AIDecisionClient;
import com.perptrader.backend.service.context.AgentState;
import com.perptrader.backend.service.context.ContextBuilder;
import com.perptrader.backend.service.decision.CompiledPrompt;
import com.perptrader.backend.service.decision.DecisionParser;
import com.perptrader.backend.service.decision.DecisionScheduler;
import com.perptrader.backend.service.decision.DecisionValidator;
import com.perptrader.backend.service.decision.PromptCompiler;
import com.perptrader.backend.service.exchange.Trader;
import com.perptrader.backend.service.execution.DecisionExecutor;
import com.perptrader.backend.service.journal.DecisionLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One autonomous agent. Each cycle walks
 * Idle, RiskPaused or BuildingContext, AwaitingAI, Validating, Executing, Recording and back to Idle,
 * and writes exactly one journal record whatever happens along the way.
 */
public class AutoTrader implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(AutoTrader.class);
    private static final String RULE = "=".repeat(70);
    private static final String THIN_RULE = "-".repeat(70);

    private final AgentConfig config;
    private final AgentState state;
    private final Trader trader;
    private final ContextBuilder contextBuilder;
    private final PromptCompiler promptCompiler;
    private final AIDecisionClient aiClient;
    private final DecisionParser decisionParser;
    private final DecisionValidator decisionValidator;
    private final DecisionScheduler decisionScheduler;
    private final DecisionExecutor decisionExecutor;
    private final DecisionLogger decisionLogger;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile CycleState cycleState = CycleState.IDLE;
    private volatile boolean running;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);

    public AutoTrader(AgentConfig config, AgentState state, Trader trader, ContextBuilder contextBuilder,
                      PromptCompiler promptCompiler, AIDecisionClient aiClient, DecisionParser decisionParser,
                      DecisionValidator decisionValidator, DecisionScheduler decisionScheduler,
                      DecisionExecutor decisionExecutor, DecisionLogger decisionLogger,
                      ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.state = state;
        this.trader = trader;
        this.contextBuilder = contextBuilder;
        this.promptCompiler = promptCompiler;
        this.aiClient = aiClient;
        this.decisionParser = decisionParser;
        this.decisionValidator = decisionValidator;
        this.decisionScheduler = decisionScheduler;
        this.decisionExecutor = decisionExecutor;
        this.decisionLogger = decisionLogger;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Runs a cycle immediately, then one every scan interval until {@link #stop()} is called.
     * Does nothing unless {@link #prepareStart()} was called first.
     * A failed cycle is logged and the loop carries on.
     */
    @Override
    public void run() {
        if (!running) {
            logger.info("[{}] Stopped before the loop started", config.displayName());
            return;
        }
        logger.info("[{}] AI-driven trading agent started", config.displayName());
        logger.info("[{}] Initial balance: {} USDT, scan interval: {} minutes",
                config.displayName(), String.format("%.2f", config.getInitialBalance()), config.getScanIntervalMinutes());

        while (running) {
            try {
                runCycle();
            } catch (RuntimeException e) {
                logger.error("[{}] Cycle failed: {}", config.displayName(), e.getMessage(), e);
            }
            if (!running) {
                break;
            }
            try {
                if (stopSignal.await(config.getScanIntervalMinutes(), TimeUnit.MINUTES)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        running = false;
        logger.info("[{}] Trading agent stopped", config.displayName());
    }

    /**
     * Arms the loop. Called before the agent's thread starts, so a {@link #stop()} issued in
     * between is not lost.
     */
    public void prepareStart() {
        stopSignal = new CountDownLatch(1);
        running = true;
    }

    /** Asks the loop to finish; an in-flight cycle runs to completion first. */
    public void stop() {
        running = false;
        stopSignal.countDown();
        logger.info("[{}] Stop requested", config.displayName());
    }

    /**
     * Runs a single cycle unless one is already in flight for this agent.
     *
     * @return false when the cycle was skipped because another one is running
     */
    public boolean runCycle() {
        if (!cycleLock.tryLock()) {
            logger.warn("[{}] Previous cycle still running, skipping", config.displayName());
            return false;
        }
        DecisionRecord record = DecisionRecord.builder().success(true).build();
        try {
            executeCycle(record);
            return true;
        } catch (RuntimeException e) {
            record.fail("Cycle failed: " + e.getMessage());
            throw e;
        } finally {
            saveRecord(record);
            cycleState = CycleState.IDLE;
            cycleLock.unlock();
        }
    }

    private void executeCycle(DecisionRecord record) {
        int cycle = state.nextCycle();
        Instant now = clock.instant();
        record.setTimestamp(now);

        logger.info(RULE);
        logger.info("[{}] {} - AI decision cycle #{}", config.displayName(), now, cycle);
        logger.info(RULE);

        if (state.isRiskPaused(now)) {
            cycleState = CycleState.RISK_PAUSED;
            long remaining = Math.round(state.remainingPause(now).toSeconds() / 60.0);
            logger.info("Risk control: trading paused, {} minutes remaining", remaining);
            record.fail(String.format("Risk control pause active, %d minutes remaining", remaining));
            return;
        }
        if (state.resetDailyIfDue(now)) {
            logger.info("Daily PnL reset");
        }

        cycleState = CycleState.BUILDING_CONTEXT;
        TradingContext ctx;
        try {
            ctx = contextBuilder.build(state);
        } catch (RuntimeException e) {
            record.fail("Failed to build trading context: " + e.getMessage());
            throw e;
        }
        snapshotContext(record, ctx);
        logger.info("Account equity: {} USDT | available: {} USDT | positions: {}",
                String.format("%.2f", ctx.getAccount().getTotalEquity()),
                String.format("%.2f", ctx.getAccount().getAvailableBalance()), ctx.getAccount().getPositionCount());

        String breach = riskLimitBreach(ctx);
        if (breach != null) {
            cycleState = CycleState.RISK_PAUSED;
            state.pauseUntil(now.plus(Duration.ofMinutes(config.getStopTradingMinutes())));
            logger.warn("Risk limit breached ({}), pausing trading for {} minutes", breach, config.getStopTradingMinutes());
            record.fail(String.format("Risk limit breached (%s), trading paused for %d minutes",
                    breach, config.getStopTradingMinutes()));
            return;
        }

        cycleState = CycleState.AWAITING_AI;
        logger.info("Requesting AI analysis and decisions...");
        CompiledPrompt prompt = promptCompiler.compile(ctx);
        record.setInputPrompt(prompt.getUserPrompt());
        FullDecision decision;
        try {
            String response = aiClient.call(prompt.getSystemPrompt(), prompt.getUserPrompt());
            decision = decisionParser.parse(response);
        } catch (AIUnavailableException e) {
            logger.error("AI call failed: {}", e.getMessage());
            record.fail("Failed to get AI decision: " + e.getMessage());
            return;
        } catch (MalformedResponseException e) {
            record.setCotTrace(e.getReasoningTrace());
            logTrace("AI reasoning (response could not be parsed)", e.getReasoningTrace());
            logger.error("AI response could not be parsed: {}", e.getMessage());
            record.fail("Failed to get AI decision: " + e.getMessage());
            return;
        }
        decision.setUserPrompt(prompt.getUserPrompt());
        record.setCotTrace(decision.getReasoningTrace());
        record.setDecisionJson(toJson(decision.getDecisions()));
        logTrace("AI reasoning", decision.getReasoningTrace());
        logDecisions(decision.getDecisions());

        cycleState = CycleState.VALIDATING;
        try {
            decisionValidator.validate(decision.getDecisions(), ctx.getAccount().getTotalEquity(),
                    ctx.getBtcEthLeverage(), ctx.getAltcoinLeverage());
        } catch (ValidationRejectedException e) {
            logger.error("Decision validation failed: {}", e.getMessage());
            record.fail("Decision validation failed: " + e.getMessage());
            return;
        }

        cycleState = CycleState.EXECUTING;
        List<Decision> ordered = decisionScheduler.sort(decision.getDecisions());
        logger.info("Execution order (closes first, then opens):");
        for (int i = 0; i < ordered.size(); i++) {
            logger.info("  [{}] {} {}", i + 1, ordered.get(i).getSymbol(), ordered.get(i).getAction());
        }
        decisionExecutor.executeAll(ordered, ctx, record);
    }

    private void saveRecord(DecisionRecord record) {
        cycleState = CycleState.RECORDING;
        state.writeTo(record);
        try {
            decisionLogger.logDecision(record);
        } catch (RuntimeException e) {
            logger.warn("Failed to save decision record: {}", e.getMessage());
        }
    }

    private static void snapshotContext(DecisionRecord record, TradingContext ctx) {
        record.setAccountState(AccountSnapshot.of(ctx.getAccount()));
        for (PositionInfo position : ctx.getPositions()) {
            record.getPositions().add(PositionSnapshot.of(position));
        }
        for (CandidateCoin coin : ctx.getCandidateCoins()) {
            record.getCandidateCoins().add(coin.getSymbol());
        }
    }

    /**
     * @return a description of the first configured limit that is breached, or null
     */
    String riskLimitBreach(TradingContext ctx) {
        if (config.getMaxDailyLoss() > 0 && state.getDailyLossPercent() >= config.getMaxDailyLoss()) {
            return String.format("daily loss %.2f%% >= %.2f%%", state.getDailyLossPercent(), config.getMaxDailyLoss());
        }
        double peak = state.getPeakEquity();
        if (config.getMaxDrawdown() > 0 && peak > 0) {
            double drawdown = (peak - ctx.getAccount().getTotalEquity()) / peak * 100;
            if (drawdown >= config.getMaxDrawdown()) {
                return String.format("drawdown %.2f%% >= %.2f%%", drawdown, config.getMaxDrawdown());
            }
        }
        return null;
    }

    private String toJson(List<Decision> decisions) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(decisions);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize decisions: {}", e.getMessage());
            return null;
        }
    }

    private static void logTrace(String title, String trace) {
        logger.info(THIN_RULE);
        logger.info("{}:", title);
        logger.info(THIN_RULE);
        logger.info("{}", trace);
        logger.info(THIN_RULE);
    }

    private static void logDecisions(List<Decision> decisions) {
        logger.info("AI decisions ({}):", decisions.size());
        for (int i = 0; i < decisions.size(); i++) {
            Decision d = decisions.get(i);
            logger.info("  [{}] {}: {} - {}", i + 1, d.getSymbol(), d.getAction(), d.getReasoning());
            TradeAction action = d.tradeAction();
            if (action != null && action.isOpen()) {
                logger.info("      leverage: {}x | size: {} USDT | stop loss: {} | take profit: {}",
                        d.getLeverage(), String.format("%.2f", d.getPositionSizeUsd()),
                        String.format("%.4f", d.getStopLoss()), String.format("%.4f", d.getTakeProfit()));
            }
        }
    }

    public TraderStatus getStatus() {
        Instant now = clock.instant();
        return TraderStatus.builder()
                .traderId(config.getId())
                .traderName(config.displayName())
                .aiModel(config.getAiModel())
                .exchange(trader.getName())
                .running(running)
                .cycleState(cycleState)
                .startTime(state.getStartTime())
                .runtimeMinutes(state.runtimeMinutes(now))
                .callCount(state.getCallCount())
                .initialBalance(config.getInitialBalance())
                .scanInterval(config.getScanIntervalMinutes() + "m")
                .stopUntil(state.getStopUntil())
                .lastResetTime(state.getLastResetTime())
                .aiProvider(aiClient.getProviderName())
                .build();
    }

    /**
     * Live account figures straight from the exchange.
     */
    public AccountOverview getAccountOverview() {
        ExchangeBalance balance = trader.getBalance();
        List<PositionInfo> positions = contextBuilder.currentPositions(state);

        double totalEquity = balance.totalEquity();
        double marginUsed = positions.stream().mapToDouble(PositionInfo::getMarginUsed).sum();
        double positionPnl = positions.stream().mapToDouble(PositionInfo::getUnrealizedPnl).sum();
        double initialBalance = config.getInitialBalance();
        double totalPnl = totalEquity - initialBalance;

        return AccountOverview.builder()
                .totalEquity(totalEquity)
                .walletBalance(balance.getTotalWalletBalance())
                .unrealizedProfit(balance.getTotalUnrealizedProfit())
                .availableBalance(balance.getAvailableBalance())
                .totalPnl(totalPnl)
                .totalPnlPct(initialBalance > 0 ? totalPnl / initialBalance * 100 : 0)
                .totalUnrealizedPnl(positionPnl)
                .initialBalance(initialBalance)
                .dailyPnl(state.getDailyPnl())
                .positionCount(positions.size())
                .marginUsed(marginUsed)
                .marginUsedPct(totalEquity > 0 ? marginUsed / totalEquity * 100 : 0)
                .build();
    }

    public List<PositionInfo> getPositions() {
        return contextBuilder.currentPositions(state);
    }

    public String getId() {
        return config.getId();
    }

    public String getName() {
        return config.displayName();
    }

    public String getAiModel() {
        return config.getAiModel();
    }

    public DecisionLogger getDecisionLogger() {
        return decisionLogger;
    }

    public boolean isRunning() {
        return running;
    }

    public CycleState getCycleState() {
        return cycleState;
    }

    AgentState getState() {
        return state;
    }
}
