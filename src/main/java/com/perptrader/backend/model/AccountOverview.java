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
public class AccountOverview {
    private double totalEquity;
    private double walletBalance;
    private double unrealizedProfit;
    private double availableBalance;
    private double totalPnl;
    private double totalPnlPct;
    private double totalUnrealizedPnl;
    private double initialBalance;
    private double dailyPnl;
    private int positionCount;
    private double marginUsed;
    private double marginUsedPct;
}
