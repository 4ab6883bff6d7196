package com.perptrader.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PerformanceSummary {
    private double sharpeRatio;
    private double totalPnl;
    private double winRate;
    private double avgWin;
    private double avgLoss;
    private double maxDrawdown;
    private double profitFactor;
    private int cycleCount;

    public static PerformanceSummary empty() {
        return new PerformanceSummary();
    }
}
