package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Most recent points of one kline interval, oldest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeframeSeries {
    private String interval;
    @Builder.Default
    private List<Double> midPrices = new ArrayList<>();
    @Builder.Default
    private List<Double> ema20 = new ArrayList<>();
    @Builder.Default
    private List<Double> macd = new ArrayList<>();
    @Builder.Default
    private List<Double> rsi7 = new ArrayList<>();
    @Builder.Default
    private List<Double> rsi14 = new ArrayList<>();
    @Builder.Default
    private List<Double> atr3 = new ArrayList<>();
    @Builder.Default
    private List<Double> atr14 = new ArrayList<>();
    @Builder.Default
    private List<Double> volume = new ArrayList<>();

    /**
     * Percent change from the first to the last mid price, or null when it cannot be computed.
     */
    public Double changePercent() {
        if (midPrices == null || midPrices.isEmpty() || midPrices.get(0) <= 0) {
            return null;
        }
        double first = midPrices.get(0);
        double last = midPrices.get(midPrices.size() - 1);
        return (last - first) / first * 100;
    }
}
