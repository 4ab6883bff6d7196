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
public class PositionInfo {
    private String symbol;
    private PositionSide side;
    private double entryPrice;
    private double markPrice;
    private double quantity;
    private int leverage;
    private double unrealizedPnl;
    private double unrealizedPnlPct;
    private double liquidationPrice;
    private double marginUsed;
    /** Epoch millis of the first cycle that saw this (symbol, side); 0 when unknown. */
    private long firstSeenTime;

    public String positionKey() {
        return positionKey(symbol, side);
    }

    public static String positionKey(String symbol, PositionSide side) {
        return symbol + "_" + side.getValue();
    }
}
