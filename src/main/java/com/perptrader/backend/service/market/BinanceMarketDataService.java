package com.perptrader.backend.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.exception.ExchangeException;
import com.perptrader.backend.model.MarketSnapshot;
import com.perptrader.backend.model.OpenInterest;
import com.perptrader.backend.model.TimeframeSeries;
import com.perptrader.backend.service.client.HttpClientService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.num.Num;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Market snapshots built from Binance USDT-M public endpoints, with indicators computed by ta4j.
 */
@Service
public class BinanceMarketDataService implements MarketSnapshotProvider {

    private static final Logger logger = LoggerFactory.getLogger(BinanceMarketDataService.class);

    private static final int EMA_PERIOD = 20;
    private static final int MACD_SHORT = 12;
    private static final int MACD_LONG = 26;

    private final HttpClientService httpClientService;
    private final String baseUrl;
    private final int klineLimit;
    private final int seriesLength;

    public BinanceMarketDataService(HttpClientService httpClientService, TraderProperties properties) {
        this.httpClientService = httpClientService;
        this.baseUrl = properties.getMarketData().getBaseUrl();
        this.klineLimit = properties.getMarketData().getKlineLimit();
        this.seriesLength = properties.getMarketData().getSeriesLength();
    }

    @Override
    public MarketSnapshot getSnapshot(String symbol, String shortInterval) {
        String normalized = normalizeSymbol(symbol);
        String shortLabel = KlineIntervals.isSupported(shortInterval) ? shortInterval : KlineIntervals.DEFAULT_SHORT;
        String mediumLabel = KlineIntervals.next(shortLabel);
        String longLabel = KlineIntervals.next(mediumLabel);

        BarSeries shortBars = loadBars(normalized, shortLabel);
        if (shortBars.isEmpty()) {
            throw new ExchangeException("binance", "No klines returned for " + normalized + " " + shortLabel);
        }
        BarSeries mediumBars = loadBars(normalized, mediumLabel);
        BarSeries longBars = loadBars(normalized, longLabel);

        int last = shortBars.getEndIndex();
        ClosePriceIndicator close = new ClosePriceIndicator(shortBars);

        return MarketSnapshot.builder()
                .symbol(normalized)
                .currentPrice(close.getValue(last).doubleValue())
                .currentEma20(valueOrZero(new EMAIndicator(close, EMA_PERIOD), last, EMA_PERIOD))
                .currentMacd(valueOrZero(new MACDIndicator(close, MACD_SHORT, MACD_LONG), last, MACD_LONG))
                .currentRsi7(valueOrZero(new RSIIndicator(close, 7), last, 7))
                .openInterest(fetchOpenInterest(normalized))
                .fundingRate(fetchFundingRate(normalized))
                .shortInterval(shortLabel)
                .mediumInterval(mediumLabel)
                .longInterval(longLabel)
                .shortSeries(buildSeries(shortLabel, shortBars))
                .mediumSeries(buildSeries(mediumLabel, mediumBars))
                .longSeries(buildSeries(longLabel, longBars))
                .build();
    }

    public static String normalizeSymbol(String symbol) {
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        return upper.endsWith("USDT") ? upper : upper + "USDT";
    }

    BarSeries loadBars(String symbol, String interval) {
        JsonNode klines = getJson("/fapi/v1/klines", Map.of(
                "symbol", symbol,
                "interval", interval,
                "limit", String.valueOf(klineLimit)));

        Duration period = Duration.ofMinutes(KlineIntervals.minutes(interval));
        BarSeries series = new BaseBarSeriesBuilder().withName(symbol + "_" + interval).build();
        if (klines == null || !klines.isArray()) {
            return series;
        }
        for (JsonNode kline : klines) {
            ZonedDateTime endTime = Instant.ofEpochMilli(kline.get(6).asLong()).atZone(ZoneOffset.UTC);
            series.addBar(period, endTime,
                    Double.parseDouble(kline.get(1).asText()),
                    Double.parseDouble(kline.get(2).asText()),
                    Double.parseDouble(kline.get(3).asText()),
                    Double.parseDouble(kline.get(4).asText()),
                    Double.parseDouble(kline.get(5).asText()));
        }
        return series;
    }

    TimeframeSeries buildSeries(String interval, BarSeries bars) {
        TimeframeSeries series = TimeframeSeries.builder().interval(interval).build();
        if (bars.isEmpty()) {
            return series;
        }
        ClosePriceIndicator close = new ClosePriceIndicator(bars);
        EMAIndicator ema20 = new EMAIndicator(close, EMA_PERIOD);
        MACDIndicator macd = new MACDIndicator(close, MACD_SHORT, MACD_LONG);
        RSIIndicator rsi7 = new RSIIndicator(close, 7);
        RSIIndicator rsi14 = new RSIIndicator(close, 14);
        ATRIndicator atr3 = new ATRIndicator(bars, 3);
        ATRIndicator atr14 = new ATRIndicator(bars, 14);
        VolumeIndicator volume = new VolumeIndicator(bars);

        int end = bars.getEndIndex();
        int start = Math.max(bars.getBeginIndex(), end - seriesLength + 1);
        for (int i = start; i <= end; i++) {
            series.getMidPrices().add(close.getValue(i).doubleValue());
            series.getVolume().add(volume.getValue(i).doubleValue());
            // indicator values inside their warm-up window are left out
            addIfWarm(series.getEma20(), ema20, i, EMA_PERIOD);
            addIfWarm(series.getMacd(), macd, i, MACD_LONG);
            addIfWarm(series.getRsi7(), rsi7, i, 7);
            addIfWarm(series.getRsi14(), rsi14, i, 14);
            addIfWarm(series.getAtr3(), atr3, i, 3);
            addIfWarm(series.getAtr14(), atr14, i, 14);
        }
        return series;
    }

    private OpenInterest fetchOpenInterest(String symbol) {
        double latest;
        try {
            JsonNode node = getJson("/fapi/v1/openInterest", Map.of("symbol", symbol));
            latest = node.path("openInterest").asDouble();
        } catch (ExchangeException e) {
            logger.warn("Open interest unavailable for {}: {}", symbol, e.getMessage());
            return null;
        }

        double average = latest;
        try {
            JsonNode history = getJson("/futures/data/openInterestHist",
                    Map.of("symbol", symbol, "period", "5m", "limit", "30"));
            if (history != null && history.isArray() && history.size() > 0) {
                double sum = 0;
                for (JsonNode point : history) {
                    sum += point.path("sumOpenInterest").asDouble();
                }
                average = sum / history.size();
            }
        } catch (ExchangeException e) {
            logger.debug("Open interest history unavailable for {}, using latest value", symbol);
        }
        return new OpenInterest(latest, average);
    }

    private double fetchFundingRate(String symbol) {
        try {
            JsonNode node = getJson("/fapi/v1/premiumIndex", Map.of("symbol", symbol));
            return node.path("lastFundingRate").asDouble();
        } catch (ExchangeException e) {
            logger.warn("Funding rate unavailable for {}: {}", symbol, e.getMessage());
            return 0.0;
        }
    }

    private JsonNode getJson(String path, Map<String, String> params) {
        try {
            ResponseEntity<JsonNode> response = httpClientService.get(baseUrl + path, null, JsonNode.class, params);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ExchangeException("binance", "GET " + path + " returned " + response.getStatusCode());
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw new ExchangeException("binance", "GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static void addIfWarm(List<Double> target, Indicator<Num> indicator, int index, int warmup) {
        if (index >= warmup - 1) {
            target.add(finiteOrZero(indicator.getValue(index).doubleValue()));
        }
    }

    private static double valueOrZero(Indicator<Num> indicator, int index, int warmup) {
        if (index < warmup - 1) {
            return 0.0;
        }
        return finiteOrZero(indicator.getValue(index).doubleValue());
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
