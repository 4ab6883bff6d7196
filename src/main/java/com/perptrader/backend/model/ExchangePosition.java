package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangePosition {
    private String symbol;
    private PositionSide side;
    /** Always a non-negative magnitude; direction is carried by side. */
    private double positionAmt;
    private double entryPrice;
    private double markPrice;
    private double unrealizedProfit;
    /** 0 when the exchange did not report it. */
    private int leverage;
    private double liquidationPrice;

    /** PnL in percent of entry, signed by side. */
    public double pnlPercent() {
        if (entryPrice <= 0) {
            return 0;
        }
        if (side == PositionSide.LONG) {
            return (markPrice - entryPrice) / entryPrice * 100;
        }
        return (entryPrice - markPrice) / entryPrice * 100;
    }
}
