package com.perptrader.backend.service.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.backend.exception.TradingException;
import com.perptrader.backend.model.ActionRecord;
import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.model.DecisionStatistics;
import com.perptrader.backend.model.PerformanceSummary;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Journal stored as {@code decisions.jsonl} (one record per line) next to a
 * {@code statistics.json} summary.
 */
public class JsonlDecisionLogger implements DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(JsonlDecisionLogger.class);

    static final String LOG_FILE = "decisions.jsonl";
    static final String STATS_FILE = "statistics.json";

    private final Path logFile;
    private final Path statsFile;
    private final ObjectMapper objectMapper;
    private DecisionStatistics stats;

    public JsonlDecisionLogger(Path logDir, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.logFile = logDir.resolve(LOG_FILE);
        this.statsFile = logDir.resolve(STATS_FILE);
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            throw new TradingException("Cannot create decision log directory " + logDir, e);
        }
        this.stats = loadStatistics();
    }

    @Override
    public synchronized void logDecision(DecisionRecord record) {
        DecisionStatistics.DecisionStatisticsBuilder next = stats.toBuilder()
                .totalDecisions(stats.getTotalDecisions() + 1);
        if (record.isSuccess()) {
            next.successfulDecisions(stats.getSuccessfulDecisions() + 1);
        } else {
            next.failedDecisions(stats.getFailedDecisions() + 1);
        }

        int executions = stats.getTotalExecutions();
        int succeeded = stats.getSuccessfulExecutions();
        int failed = stats.getFailedExecutions();
        for (ActionRecord action : record.getDecisions()) {
            executions++;
            if (action.isSuccess()) {
                succeeded++;
            } else {
                failed++;
            }
        }
        next.totalExecutions(executions).successfulExecutions(succeeded).failedExecutions(failed);
        if (stats.getFirstLogTime() == null) {
            next.firstLogTime(record.getTimestamp());
        }
        next.lastLogTime(record.getTimestamp());
        stats = next.build();
        saveStatistics();

        record.setCycleNumber(stats.getTotalDecisions());
        try {
            String line = objectMapper.writeValueAsString(record) + "\n";
            Files.write(logFile, line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.error("Failed to append decision record #{}: {}", record.getCycleNumber(), e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<DecisionRecord> getLatestRecords(int limit) {
        List<DecisionRecord> records = new ArrayList<>();
        if (limit <= 0 || !Files.exists(logFile)) {
            return records;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("Failed to read decision records: {}", e.getMessage(), e);
            return records;
        }
        for (String line : lines.subList(Math.max(0, lines.size() - limit), lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, DecisionRecord.class));
            } catch (JsonProcessingException e) {
                logger.warn("Skipping unreadable decision record line: {}", e.getOriginalMessage());
            }
        }
        return records;
    }

    @Override
    public synchronized DecisionStatistics getStatistics() {
        return stats.toBuilder().build();
    }

    /**
     * Sharpe ratio of per-cycle equity returns (mean over population standard deviation),
     * maximum drawdown of the equity curve, and win/loss figures from realized close profits.
     */
    @Override
    public PerformanceSummary analyzePerformance(int cycles) {
        List<DecisionRecord> records = getLatestRecords(cycles);
        if (records.isEmpty()) {
            return PerformanceSummary.empty();
        }

        List<Double> equity = new ArrayList<>();
        DescriptiveStatistics wins = new DescriptiveStatistics();
        DescriptiveStatistics losses = new DescriptiveStatistics();
        for (DecisionRecord record : records) {
            if (record.getAccountState() != null && record.getAccountState().getTotalBalance() > 0) {
                equity.add(record.getAccountState().getTotalBalance());
            }
            for (ActionRecord action : record.getDecisions()) {
                if (!action.isSuccess()) {
                    continue;
                }
                if (action.getProfit() > 0) {
                    wins.addValue(action.getProfit());
                } else if (action.getProfit() < 0) {
                    losses.addValue(Math.abs(action.getProfit()));
                }
            }
        }

        long trades = wins.getN() + losses.getN();
        double totalWins = wins.getSum();
        double totalLosses = losses.getSum();
        return PerformanceSummary.builder()
                .sharpeRatio(sharpeRatio(equity))
                .maxDrawdown(maxDrawdown(equity))
                .winRate(trades > 0 ? (double) wins.getN() / trades * 100 : 0.0)
                .avgWin(wins.getN() > 0 ? wins.getMean() : 0.0)
                .avgLoss(losses.getN() > 0 ? losses.getMean() : 0.0)
                .profitFactor(totalLosses > 0 ? totalWins / totalLosses : 0.0)
                .totalPnl(totalWins - totalLosses)
                .cycleCount(records.size())
                .build();
    }

    static double sharpeRatio(List<Double> equity) {
        if (equity.size() < 2) {
            return 0.0;
        }
        DescriptiveStatistics returns = new DescriptiveStatistics();
        for (int i = 1; i < equity.size(); i++) {
            double previous = equity.get(i - 1);
            returns.addValue((equity.get(i) - previous) / previous * 100);
        }
        double std = Math.sqrt(returns.getPopulationVariance());
        return std > 0 ? returns.getMean() / std : 0.0;
    }

    static double maxDrawdown(List<Double> equity) {
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (double value : equity) {
            peak = Math.max(peak, value);
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak * 100);
            }
        }
        return maxDrawdown;
    }

    private DecisionStatistics loadStatistics() {
        if (Files.exists(statsFile)) {
            try {
                return objectMapper.readValue(statsFile.toFile(), DecisionStatistics.class);
            } catch (IOException e) {
                logger.warn("Statistics file {} unreadable, starting from zero: {}", statsFile, e.getMessage());
                return new DecisionStatistics();
            }
        }
        DecisionStatistics fresh = new DecisionStatistics();
        this.stats = fresh;
        saveStatistics();
        return fresh;
    }

    private void saveStatistics() {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(statsFile.toFile(), stats);
        } catch (IOException e) {
            logger.warn("Failed to save statistics: {}", e.getMessage());
        }
    }
}
