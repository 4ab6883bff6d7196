package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketSnapshot {
    private String symbol;
    private double currentPrice;
    private double currentEma20;
    private double currentMacd;
    private double currentRsi7;
    /** Null when the provider could not read open interest. */
    private OpenInterest openInterest;
    private double fundingRate;
    private String shortInterval;
    private String mediumInterval;
    private String longInterval;
    private TimeframeSeries shortSeries;
    private TimeframeSeries mediumSeries;
    private TimeframeSeries longSeries;

    /** Open interest valued in USD at the current price; 0 when unknown. */
    public double openInterestValueUsd() {
        if (openInterest == null || currentPrice <= 0) {
            return 0;
        }
        return openInterest.getLatest() * currentPrice;
    }
}
