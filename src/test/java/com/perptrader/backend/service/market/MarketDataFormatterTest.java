package com.perptrader.backend.service.market;

import com.perptrader.backend.model.MarketSnapshot;
import com.perptrader.backend.model.OpenInterest;
import com.perptrader.backend.model.TimeframeSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarketDataFormatterTest {

    @Test
    void format_shouldRenderHeaderOpenInterestAndSeries() {
        MarketSnapshot snapshot = MarketSnapshot.builder()
                .symbol("ETHUSDT")
                .currentPrice(3060.5)
                .currentEma20(3050.1234)
                .currentMacd(1.5)
                .currentRsi7(55.25)
                .openInterest(new OpenInterest(120000, 110000))
                .fundingRate(0.0001)
                .shortSeries(TimeframeSeries.builder()
                        .interval("3m")
                        .midPrices(List.of(3050.0, 3060.5))
                        .rsi7(List.of(50.0, 55.25))
                        .build())
                .longSeries(TimeframeSeries.builder().interval("4h").build())
                .build();

        String text = MarketDataFormatter.format(snapshot);

        assertTrue(text.startsWith("current_price = 3060.50, current_ema20 = 3050.123, current_macd = 1.500, current_rsi (7 period) = 55.250"), text);
        assertTrue(text.contains("latest ETHUSDT open interest"));
        assertTrue(text.contains("Open Interest: Latest: 120000.00 Average: 110000.00"));
        assertTrue(text.contains("Funding Rate: 1.00e-04"));
        assertTrue(text.contains("Intraday series (3-minute intervals, oldest → latest):"));
        assertTrue(text.contains("Mid prices: [3050.000, 3060.500]"));
        assertTrue(text.contains("RSI indicators (7-Period): [50.000, 55.250]"));
        assertFalse(text.contains("MACD indicators"));
        assertFalse(text.contains("Longer-term context"));
    }

    @Test
    void format_shouldOmitOpenInterestWhenUnknown() {
        MarketSnapshot snapshot = MarketSnapshot.builder().symbol("XYZUSDT").currentPrice(1).build();

        String text = MarketDataFormatter.format(snapshot);

        assertFalse(text.contains("Open Interest:"));
        assertTrue(text.contains("Funding Rate: 0.00e+00"));
    }
}
