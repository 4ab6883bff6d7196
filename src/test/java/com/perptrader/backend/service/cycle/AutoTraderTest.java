package com.perptrader.backend.service.cycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.config.AppConfig;
import com.perptrader.backend.exception.AIUnavailableException;
import com.perptrader.backend.exception.ExchangeException;
import com.perptrader.backend.model.AccountInfo;
import com.perptrader.backend.model.CandidateCoin;
import com.perptrader.backend.model.CycleState;
import com.perptrader.backend.model.Decision;
import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.model.MarketSnapshot;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class AutoTraderTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");
    private static final String GOOD_RESPONSE = "ETH is trending up with rising open interest.\n"
            + "[{\"symbol\":\"ETHUSDT\",\"action\":\"open_long\",\"leverage\":5,\"position_size_usd\":1000,"
            + "\"stop_loss\":3000,\"take_profit\":3300,\"confidence\":80,\"reasoning\":\"breakout\"},"
            + "{\"symbol\":\"BTCUSDT\",\"action\":\"close_short\",\"reasoning\":\"target reached\"}]";

    @Mock
    private Trader trader;
    @Mock
    private ContextBuilder contextBuilder;
    @Mock
    private PromptCompiler promptCompiler;
    @Mock
    private AIDecisionClient aiClient;
    @Mock
    private DecisionExecutor decisionExecutor;
    @Mock
    private DecisionLogger decisionLogger;

    private AgentConfig config;
    private AgentState state;
    private TradingContext ctx;
    private AutoTrader autoTrader;

    @BeforeEach
    void setUp() {
        config = new AgentConfig();
        config.setId("deepseek_binance");
        config.setName("DeepSeek Binance");
        config.setInitialBalance(1000);
        config.setScanIntervalMinutes(3);
        config.setBtcEthLeverage(10);
        config.setAltcoinLeverage(5);
        config.setStopTradingMinutes(60);
        state = new AgentState(NOW.minus(Duration.ofHours(1)));

        ObjectMapper objectMapper = new AppConfig().objectMapper();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        autoTrader = new AutoTrader(config, state, trader, contextBuilder, promptCompiler, aiClient,
                new DecisionParser(objectMapper, clock), new DecisionValidator(0.2), new DecisionScheduler(),
                decisionExecutor, decisionLogger, objectMapper, clock);

        Map<String, MarketSnapshot> snapshots = new LinkedHashMap<>();
        snapshots.put("ETHUSDT", MarketSnapshot.builder().symbol("ETHUSDT").currentPrice(3060).build());
        ctx = TradingContext.builder()
                .currentTime(NOW)
                .account(AccountInfo.builder().totalEquity(1000).availableBalance(900).build())
                .candidateCoins(List.of(new CandidateCoin("ETHUSDT", new LinkedHashSet<>(Set.of(CandidateCoin.SOURCE_AI500)))))
                .marketSnapshots(snapshots)
                .btcEthLeverage(10)
                .altcoinLeverage(5)
                .build();
    }

    private DecisionRecord savedRecord() {
        ArgumentCaptor<DecisionRecord> captor = ArgumentCaptor.forClass(DecisionRecord.class);
        verify(decisionLogger).logDecision(captor.capture());
        return captor.getValue();
    }

    private void stubUpToAi() {
        when(contextBuilder.build(state)).thenReturn(ctx);
        when(promptCompiler.compile(ctx)).thenReturn(new CompiledPrompt("system", "user prompt"));
    }

    @Test
    void runCycle_shouldExecuteSortedDecisionsAndRecordOnce() {
        stubUpToAi();
        when(aiClient.call("system", "user prompt")).thenReturn(GOOD_RESPONSE);
        state.setLastEnterTime("2025-01-15T09:30:00Z");

        assertTrue(autoTrader.runCycle());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Decision>> ordered = ArgumentCaptor.forClass(List.class);
        verify(decisionExecutor).executeAll(ordered.capture(), eq(ctx), any(DecisionRecord.class));
        assertEquals("close_short", ordered.getValue().get(0).getAction());
        assertEquals("open_long", ordered.getValue().get(1).getAction());

        DecisionRecord record = savedRecord();
        assertTrue(record.isSuccess());
        assertNull(record.getErrorMessage());
        assertEquals(NOW, record.getTimestamp());
        assertEquals("user prompt", record.getInputPrompt());
        assertEquals("ETH is trending up with rising open interest.", record.getCotTrace());
        assertTrue(record.getDecisionJson().contains("\"position_size_usd\" : 1000.0"), record.getDecisionJson());
        assertEquals(1000.0, record.getAccountState().getTotalBalance());
        assertEquals(List.of("ETHUSDT"), record.getCandidateCoins());
        assertEquals("2025-01-15T09:30:00Z", record.getLastEnterTime());
        assertEquals(1, state.getCallCount());
        assertEquals(CycleState.IDLE, autoTrader.getCycleState());
    }

    @Test
    void runCycle_shouldRecordRiskPauseWithoutBuildingContext() {
        state.pauseUntil(NOW.plus(Duration.ofMinutes(30)));

        autoTrader.runCycle();

        DecisionRecord record = savedRecord();
        assertFalse(record.isSuccess());
        assertEquals("Risk control pause active, 30 minutes remaining", record.getErrorMessage());
        verifyNoInteractions(contextBuilder, aiClient, decisionExecutor);
    }

    @Test
    void runCycle_shouldRecordAndRethrowContextFailure() {
        when(contextBuilder.build(state)).thenThrow(new ExchangeException("binance", "account unavailable"));

        assertThrows(ExchangeException.class, () -> autoTrader.runCycle());

        DecisionRecord record = savedRecord();
        assertEquals("Failed to build trading context: [binance] account unavailable", record.getErrorMessage());
        assertEquals(CycleState.IDLE, autoTrader.getCycleState());
    }

    @Test
    void runCycle_shouldMarkRecordFailedOnUnexpectedError() {
        stubUpToAi();
        when(aiClient.call("system", "user prompt")).thenThrow(new IllegalStateException("connection pool shut down"));

        assertThrows(IllegalStateException.class, () -> autoTrader.runCycle());

        DecisionRecord record = savedRecord();
        assertFalse(record.isSuccess());
        assertEquals("Cycle failed: connection pool shut down", record.getErrorMessage());
        assertEquals("user prompt", record.getInputPrompt());
        verifyNoInteractions(decisionExecutor);
        assertEquals(CycleState.IDLE, autoTrader.getCycleState());
    }

    @Test
    void runCycle_shouldPauseWhenDailyLossLimitIsHit() {
        config.setMaxDailyLoss(5);
        state.setDailyLossPercent(6);
        when(contextBuilder.build(state)).thenReturn(ctx);

        autoTrader.runCycle();

        DecisionRecord record = savedRecord();
        assertEquals("Risk limit breached (daily loss 6.00% >= 5.00%), trading paused for 60 minutes", record.getErrorMessage());
        assertTrue(state.isRiskPaused(NOW.plus(Duration.ofMinutes(59))));
        assertFalse(state.isRiskPaused(NOW.plus(Duration.ofMinutes(60))));
        assertEquals(6.0, record.getDailyLossPercent());
        verifyNoInteractions(aiClient);
    }

    @Test
    void riskLimitBreach_shouldMeasureDrawdownFromPeakEquity() {
        config.setMaxDrawdown(20);
        state.setPeakEquity(1250);

        assertEquals("drawdown 20.00% >= 20.00%", autoTrader.riskLimitBreach(ctx));

        state.setPeakEquity(1200);
        assertNull(autoTrader.riskLimitBreach(ctx));
    }

    @Test
    void runCycle_shouldRecordAiFailure() {
        stubUpToAi();
        when(aiClient.call("system", "user prompt"))
                .thenThrow(new AIUnavailableException("AI call failed after 3 attempts: timeout", 3, new RuntimeException("timeout")));

        autoTrader.runCycle();

        DecisionRecord record = savedRecord();
        assertEquals("Failed to get AI decision: AI call failed after 3 attempts: timeout", record.getErrorMessage());
        assertEquals("user prompt", record.getInputPrompt());
        verifyNoInteractions(decisionExecutor);
    }

    @Test
    void runCycle_shouldKeepReasoningWhenResponseHasNoJson() {
        stubUpToAi();
        when(aiClient.call("system", "user prompt")).thenReturn("  Market is choppy, nothing to do.  ");

        autoTrader.runCycle();

        DecisionRecord record = savedRecord();
        assertFalse(record.isSuccess());
        assertTrue(record.getErrorMessage().startsWith("Failed to get AI decision: "), record.getErrorMessage());
        assertEquals("Market is choppy, nothing to do.", record.getCotTrace());
        verifyNoInteractions(decisionExecutor);
    }

    @Test
    void runCycle_shouldPlaceNoOrdersWhenValidationFails() {
        stubUpToAi();
        when(aiClient.call("system", "user prompt")).thenReturn("Going big.\n"
                + "[{\"symbol\":\"ETHUSDT\",\"action\":\"open_long\",\"leverage\":50,\"position_size_usd\":1000,"
                + "\"stop_loss\":3000,\"take_profit\":3300}]");

        autoTrader.runCycle();

        DecisionRecord record = savedRecord();
        assertTrue(record.getErrorMessage().startsWith("Decision validation failed: Decision #1 rejected: leverage"),
                record.getErrorMessage());
        assertEquals("Going big.", record.getCotTrace());
        verify(decisionExecutor, never()).executeAll(anyList(), any(), any());
        assertTrue(record.getDecisions().isEmpty());
    }

    @Test
    void runCycle_shouldSkipWhileAnotherCycleIsInFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(contextBuilder.build(state)).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            throw new ExchangeException("binance", "slow");
        });
        AtomicBoolean firstResult = new AtomicBoolean(true);
        Thread first = new Thread(() -> {
            try {
                autoTrader.runCycle();
            } catch (ExchangeException e) {
                firstResult.set(false);
            }
        });
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertFalse(autoTrader.runCycle());

        release.countDown();
        first.join(5000);
        assertFalse(firstResult.get());
        assertEquals(1, state.getCallCount());
    }

    @Test
    void run_shouldNotTradeWhenStoppedBeforeLoopStarts() {
        autoTrader.prepareStart();
        autoTrader.stop();

        autoTrader.run();

        assertFalse(autoTrader.isRunning());
        assertEquals(0, state.getCallCount());
        verifyNoInteractions(contextBuilder, decisionLogger);
    }

    @Test
    void run_shouldDoNothingUnlessPrepared() {
        autoTrader.run();

        verifyNoInteractions(contextBuilder, decisionLogger);
    }

    @Test
    void run_shouldFinishCurrentCycleThenExitWhenStopped() {
        when(contextBuilder.build(state)).thenAnswer(invocation -> {
            autoTrader.stop();
            throw new ExchangeException("binance", "account unavailable");
        });
        autoTrader.prepareStart();

        autoTrader.run();

        assertFalse(autoTrader.isRunning());
        assertEquals(1, state.getCallCount());
        assertEquals("Failed to build trading context: [binance] account unavailable", savedRecord().getErrorMessage());
    }

    @Test
    void getStatus_shouldDescribeAgent() {
        when(trader.getName()).thenReturn("binance");
        when(aiClient.getProviderName()).thenReturn("deepseek");

        TraderStatus status = autoTrader.getStatus();

        assertEquals("deepseek_binance", status.getTraderId());
        assertEquals("DeepSeek Binance", status.getTraderName());
        assertEquals("binance", status.getExchange());
        assertEquals("3m", status.getScanInterval());
        assertEquals("deepseek", status.getAiProvider());
        assertEquals(60, status.getRuntimeMinutes());
        assertEquals(CycleState.IDLE, status.getCycleState());
        assertFalse(status.isRunning());
    }
}
