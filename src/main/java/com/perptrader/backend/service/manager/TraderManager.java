package com.perptrader.backend.service.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.backend.config.AgentConfig;
import com.perptrader.backend.config.AgentConfigValidator;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.exception.ConfigurationException;
import com.perptrader.backend.model.AccountOverview;
import com.perptrader.backend.model.CompetitionEntry;
import com.perptrader.backend.service.ai.AIClientFactory;
import com.perptrader.backend.service.context.AgentState;
import com.perptrader.backend.service.context.ContextBuilder;
import com.perptrader.backend.service.cycle.AutoTrader;
import com.perptrader.backend.service.decision.DecisionParser;
import com.perptrader.backend.service.decision.DecisionScheduler;
import com.perptrader.backend.service.decision.DecisionValidator;
import com.perptrader.backend.service.decision.PromptCompiler;
import com.perptrader.backend.service.exchange.Trader;
import com.perptrader.backend.service.exchange.TraderFactory;
import com.perptrader.backend.service.execution.DecisionExecutor;
import com.perptrader.backend.service.journal.DecisionLogger;
import com.perptrader.backend.service.journal.JsonlDecisionLogger;
import com.perptrader.backend.service.market.MarketSnapshotProvider;
import com.perptrader.backend.service.pool.CoinPoolProvider;
import com.perptrader.backend.service.util.Sleeper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Owns every configured agent: builds them at startup, runs each on its own thread and
 * stops them on shutdown.
 */
@Service
public class TraderManager {

    private static final Logger logger = LoggerFactory.getLogger(TraderManager.class);

    private final TraderProperties properties;
    private final AgentConfigValidator configValidator;
    private final TraderFactory traderFactory;
    private final AIClientFactory aiClientFactory;
    private final CoinPoolProvider coinPoolProvider;
    private final MarketSnapshotProvider marketSnapshotProvider;
    private final PromptCompiler promptCompiler;
    private final DecisionParser decisionParser;
    private final DecisionValidator decisionValidator;
    private final DecisionScheduler decisionScheduler;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, AutoTrader> traders = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Thread> threads = new LinkedHashMap<>();

    public TraderManager(TraderProperties properties, AgentConfigValidator configValidator,
                         TraderFactory traderFactory, AIClientFactory aiClientFactory,
                         CoinPoolProvider coinPoolProvider, MarketSnapshotProvider marketSnapshotProvider,
                         PromptCompiler promptCompiler, DecisionParser decisionParser,
                         DecisionValidator decisionValidator, DecisionScheduler decisionScheduler,
                         ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.configValidator = configValidator;
        this.traderFactory = traderFactory;
        this.aiClientFactory = aiClientFactory;
        this.coinPoolProvider = coinPoolProvider;
        this.marketSnapshotProvider = marketSnapshotProvider;
        this.promptCompiler = promptCompiler;
        this.decisionParser = decisionParser;
        this.decisionValidator = decisionValidator;
        this.decisionScheduler = decisionScheduler;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Validates the configuration and builds one agent per enabled entry. Invalid
     * configuration aborts startup.
     */
    @PostConstruct
    public void init() {
        List<AgentConfig> agents = properties.getAgents();
        configValidator.validate(agents);
        for (AgentConfig agent : agents) {
            if (!agent.isEnabled()) {
                logger.info("Trader '{}' is disabled, skipping", agent.getId());
                continue;
            }
            addTrader(agent);
        }
        logger.info("{} trader(s) configured", traders.size());
    }

    public void addTrader(AgentConfig config) {
        if (traders.containsKey(config.getId())) {
            throw new ConfigurationException("Trader id '" + config.getId() + "' already exists");
        }
        configValidator.validate(config);
        traders.put(config.getId(), createAutoTrader(config));
        logger.info("Trader '{}' ({}) added", config.displayName(), config.getAiModel());
    }

    AutoTrader createAutoTrader(AgentConfig config) {
        Trader trader = traderFactory.create(config);
        AgentState state = new AgentState(clock.instant());
        DecisionLogger decisionLogger = new JsonlDecisionLogger(
                Paths.get(properties.getDecisionLogDir(), config.getId()), objectMapper);
        ContextBuilder contextBuilder = new ContextBuilder(config, trader, coinPoolProvider,
                marketSnapshotProvider, decisionLogger, properties, clock);
        DecisionExecutor executor = new DecisionExecutor(trader, state, clock,
                config.getExecutionDelayMs(), Sleeper.THREAD);

        return new AutoTrader(config, state, trader, contextBuilder, promptCompiler,
                aiClientFactory.create(config), decisionParser, decisionValidator, decisionScheduler,
                executor, decisionLogger, objectMapper, clock);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            startAll();
        } else {
            logger.info("Auto start disabled; traders are idle");
        }
    }

    public synchronized void startAll() {
        logger.info("Starting all traders...");
        for (AutoTrader trader : getTraders()) {
            Thread existing = threads.get(trader.getId());
            if (existing != null && existing.isAlive()) {
                continue;
            }
            trader.prepareStart();
            Thread thread = new Thread(trader, "trader-" + trader.getId());
            thread.setDaemon(true);
            threads.put(trader.getId(), thread);
            thread.start();
            logger.info("{} started on its own thread", trader.getName());
        }
    }

    /**
     * Signals every agent and waits, up to {@code trader.stop-timeout-seconds} in total, for
     * in-flight cycles to finish their order sequences.
     */
    @PreDestroy
    public synchronized void stopAll() {
        logger.info("Stopping all traders...");
        getTraders().forEach(AutoTrader::stop);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getStopTimeoutSeconds());
        for (Map.Entry<String, Thread> entry : threads.entrySet()) {
            Thread thread = entry.getValue();
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                if (remainingMs > 0) {
                    thread.join(remainingMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for traders to stop");
                return;
            }
            if (thread.isAlive()) {
                logger.warn("Trader {} did not stop within {} seconds", entry.getKey(), properties.getStopTimeoutSeconds());
            }
        }
        logger.info("All traders stopped");
    }

    /**
     * @return false when no trader has this id
     */
    public boolean stopTrader(String id) {
        Optional<AutoTrader> trader = getTrader(id);
        trader.ifPresent(AutoTrader::stop);
        return trader.isPresent();
    }

    public Optional<AutoTrader> getTrader(String id) {
        return Optional.ofNullable(traders.get(id));
    }

    /**
     * The trader with this id, or the first configured one when id is blank.
     */
    public Optional<AutoTrader> resolveTrader(String id) {
        if (id == null || id.isBlank()) {
            return getTraders().stream().findFirst();
        }
        return getTrader(id);
    }

    public List<AutoTrader> getTraders() {
        synchronized (traders) {
            return new ArrayList<>(traders.values());
        }
    }

    public List<String> getTraderIds() {
        synchronized (traders) {
            return new ArrayList<>(traders.keySet());
        }
    }

    /**
     * Side-by-side figures for every agent; agents whose exchange cannot be read are left out.
     */
    public List<CompetitionEntry> getCompetitionData() {
        Collection<AutoTrader> all = getTraders();
        List<CompetitionEntry> entries = new ArrayList<>();
        for (AutoTrader trader : all) {
            try {
                AccountOverview account = trader.getAccountOverview();
                entries.add(CompetitionEntry.builder()
                        .traderId(trader.getId())
                        .traderName(trader.getName())
                        .aiModel(trader.getAiModel())
                        .totalEquity(account.getTotalEquity())
                        .totalPnl(account.getTotalPnl())
                        .totalPnlPct(account.getTotalPnlPct())
                        .positionCount(account.getPositionCount())
                        .marginUsedPct(account.getMarginUsedPct())
                        .callCount(trader.getStatus().getCallCount())
                        .running(trader.isRunning())
                        .build());
            } catch (RuntimeException e) {
                logger.error("Failed to read data for {}: {}", trader.getName(), e.getMessage());
            }
        }
        return entries;
    }
}
