package com.perptrader.backend.service.market;

import com.perptrader.backend.model.MarketSnapshot;
import com.perptrader.backend.model.TimeframeSeries;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a {@link MarketSnapshot} as the plain-text block embedded in the user prompt.
 */
public final class MarketDataFormatter {

    private MarketDataFormatter() {
    }

    public static String format(MarketSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US,
                "current_price = %.2f, current_ema20 = %.3f, current_macd = %.3f, current_rsi (7 period) = %.3f%n%n",
                snapshot.getCurrentPrice(), snapshot.getCurrentEma20(), snapshot.getCurrentMacd(), snapshot.getCurrentRsi7()));

        sb.append("In addition, here is the latest ").append(snapshot.getSymbol())
                .append(" open interest and funding rate for perps:\n\n");
        if (snapshot.getOpenInterest() != null) {
            sb.append(String.format(Locale.US, "Open Interest: Latest: %.2f Average: %.2f%n%n",
                    snapshot.getOpenInterest().getLatest(), snapshot.getOpenInterest().getAverage()));
        }
        sb.append(String.format(Locale.US, "Funding Rate: %.2e%n%n", snapshot.getFundingRate()));

        appendSeries(sb, "Intraday series", snapshot.getShortSeries());
        appendSeries(sb, "Medium-term series", snapshot.getMediumSeries());
        appendSeries(sb, "Longer-term context", snapshot.getLongSeries());
        return sb.toString();
    }

    private static void appendSeries(StringBuilder sb, String title, TimeframeSeries series) {
        if (series == null || series.getMidPrices().isEmpty()) {
            return;
        }
        String label = KlineIntervals.isSupported(series.getInterval())
                ? KlineIntervals.describe(series.getInterval()) + " intervals"
                : series.getInterval();
        sb.append(title).append(" (").append(label).append(", oldest → latest):\n\n");
        appendList(sb, "Mid prices", series.getMidPrices());
        appendList(sb, "EMA indicators (20-period)", series.getEma20());
        appendList(sb, "MACD indicators", series.getMacd());
        appendList(sb, "RSI indicators (7-Period)", series.getRsi7());
        appendList(sb, "RSI indicators (14-Period)", series.getRsi14());
        appendList(sb, "ATR indicators (3-Period)", series.getAtr3());
        appendList(sb, "ATR indicators (14-Period)", series.getAtr14());
        appendList(sb, "Volume", series.getVolume());
    }

    private static void appendList(StringBuilder sb, String name, List<Double> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        String joined = values.stream()
                .map(v -> String.format(Locale.US, "%.3f", v))
                .collect(Collectors.joining(", "));
        sb.append(name).append(": [").append(joined).append("]\n\n");
    }
}
