package com.perptrader.backend.service.journal;

import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.model.DecisionStatistics;
import com.perptrader.backend.model.PerformanceSummary;

import java.util.List;

/**
 * Append-only journal of cycle records for one agent.
 */
public interface DecisionLogger {

    /**
     * Appends a record and assigns its cycle number.
     */
    void logDecision(DecisionRecord record);

    /**
     * Up to {@code limit} most recent records, oldest first.
     */
    List<DecisionRecord> getLatestRecords(int limit);

    DecisionStatistics getStatistics();

    PerformanceSummary analyzePerformance(int cycles);
}
