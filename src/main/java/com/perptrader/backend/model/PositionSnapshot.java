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
public class PositionSnapshot {
    private String symbol;
    private PositionSide side;
    private double positionAmt;
    private double entryPrice;
    private double markPrice;
    private double unrealizedProfit;
    private double leverage;
    private double liquidationPrice;

    public static PositionSnapshot of(PositionInfo position) {
        return PositionSnapshot.builder()
                .symbol(position.getSymbol())
                .side(position.getSide())
                .positionAmt(position.getQuantity())
                .entryPrice(position.getEntryPrice())
                .markPrice(position.getMarkPrice())
                .unrealizedProfit(position.getUnrealizedPnl())
                .leverage(position.getLeverage())
                .liquidationPrice(position.getLiquidationPrice())
                .build();
    }
}
