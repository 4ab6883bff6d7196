package com.perptrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccountSnapshot {
    private double totalBalance;
    private double availableBalance;
    private double totalUnrealizedProfit;
    private int positionCount;
    private double marginUsedPct;

    public static AccountSnapshot of(AccountInfo account) {
        return AccountSnapshot.builder()
                .totalBalance(account.getTotalEquity())
                .availableBalance(account.getAvailableBalance())
                .totalUnrealizedProfit(account.getTotalPnl())
                .positionCount(account.getPositionCount())
                .marginUsedPct(account.getMarginUsedPct())
                .build();
    }
}
