package com.perptrader.backend.service.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.exception.ExchangeException;
import com.perptrader.backend.model.ExchangeBalance;
import com.perptrader.backend.model.ExchangePosition;
import com.perptrader.backend.model.OrderResult;
import com.perptrader.backend.model.PositionSide;
import com.perptrader.backend.service.client.HttpClientService;
import com.perptrader.backend.service.util.SignatureUtil;
import com.perptrader.backend.service.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Binance USDT-M futures in hedge mode, signed with HMAC-SHA256 over the query string.
 */
public class BinanceFuturesTrader implements Trader {

    private static final Logger logger = LoggerFactory.getLogger(BinanceFuturesTrader.class);

    static final String NAME = "binance";
    private static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final HttpClientService httpClientService;
    private final String apiKey;
    private final String secretKey;
    private final TraderProperties.Binance settings;
    private final Clock clock;
    private final Sleeper sleeper;

    // Key: symbol, Value: LOT_SIZE stepSize
    private final LoadingCache<String, String> stepSizeCache;
    private final Map<String, Integer> appliedLeverage = new ConcurrentHashMap<>();

    public BinanceFuturesTrader(HttpClientService httpClientService, String apiKey, String secretKey,
                                TraderProperties.Binance settings, Clock clock, Sleeper sleeper) {
        this.httpClientService = httpClientService;
        this.apiKey = apiKey;
        this.secretKey = secretKey;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.stepSizeCache = CacheBuilder.newBuilder()
                .maximumSize(1000)
                .expireAfterWrite(24, TimeUnit.HOURS)
                .build(new CacheLoader<String, String>() {
                    @Override
                    public String load(String symbol) {
                        return fetchStepSize(symbol);
                    }
                });
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ExchangeBalance getBalance() {
        logger.info("Requesting Binance account balance");
        JsonNode account = signed(HttpMethod.GET, "/fapi/v2/account", new LinkedHashMap<>());
        ExchangeBalance balance = ExchangeBalance.builder()
                .totalWalletBalance(account.path("totalWalletBalance").asDouble())
                .availableBalance(account.path("availableBalance").asDouble())
                .totalUnrealizedProfit(account.path("totalUnrealizedProfit").asDouble())
                .build();
        logger.info("Binance balance: wallet={}, available={}, unrealized={}",
                balance.getTotalWalletBalance(), balance.getAvailableBalance(), balance.getTotalUnrealizedProfit());
        return balance;
    }

    @Override
    public List<ExchangePosition> getPositions() {
        JsonNode risks = signed(HttpMethod.GET, "/fapi/v2/positionRisk", new LinkedHashMap<>());
        List<ExchangePosition> positions = new ArrayList<>();
        for (JsonNode risk : risks) {
            double amount = risk.path("positionAmt").asDouble();
            if (amount == 0) {
                continue;
            }
            positions.add(ExchangePosition.builder()
                    .symbol(risk.path("symbol").asText())
                    .side(amount > 0 ? PositionSide.LONG : PositionSide.SHORT)
                    .positionAmt(Math.abs(amount))
                    .entryPrice(risk.path("entryPrice").asDouble())
                    .markPrice(risk.path("markPrice").asDouble())
                    .unrealizedProfit(risk.path("unRealizedProfit").asDouble())
                    .leverage(risk.path("leverage").asInt())
                    .liquidationPrice(risk.path("liquidationPrice").asDouble())
                    .build());
        }
        return positions;
    }

    @Override
    public void setLeverage(String symbol, int leverage) {
        if (currentLeverage(symbol).filter(current -> current == leverage).isPresent()) {
            logger.info("  {} leverage already {}x, skipping", symbol, leverage);
            return;
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("leverage", String.valueOf(leverage));
        try {
            signed(HttpMethod.POST, "/fapi/v1/leverage", params);
        } catch (ExchangeException e) {
            if (isNoChangeNeeded(e)) {
                appliedLeverage.put(symbol, leverage);
                return;
            }
            throw e;
        }
        appliedLeverage.put(symbol, leverage);
        logger.info("  {} leverage set to {}x, waiting {} ms for the exchange cooldown",
                symbol, leverage, settings.getLeverageCooldownMs());
        pause(settings.getLeverageCooldownMs());
    }

    @Override
    public void setMarginMode(String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("marginType", "ISOLATED");
        try {
            signed(HttpMethod.POST, "/fapi/v1/marginType", params);
        } catch (ExchangeException e) {
            if (isNoChangeNeeded(e)) {
                logger.info("  {} is already in isolated margin mode", symbol);
                return;
            }
            throw e;
        }
        logger.info("  {} switched to isolated margin", symbol);
        pause(settings.getMarginModeCooldownMs());
    }

    @Override
    public OrderResult openLong(String symbol, double quantity, int leverage) {
        return openPosition(symbol, PositionSide.LONG, quantity, leverage);
    }

    @Override
    public OrderResult openShort(String symbol, double quantity, int leverage) {
        return openPosition(symbol, PositionSide.SHORT, quantity, leverage);
    }

    private OrderResult openPosition(String symbol, PositionSide side, double quantity, int leverage) {
        try {
            cancelAllOrders(symbol);
        } catch (ExchangeException e) {
            logger.warn("  Failed to cancel old orders for {}: {}", symbol, e.getMessage());
        }
        setLeverage(symbol, leverage);
        setMarginMode(symbol);

        String quantityText = formatQuantity(symbol, quantity);
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("side", side == PositionSide.LONG ? "BUY" : "SELL");
        params.put("positionSide", side.getExchangeName());
        params.put("type", "MARKET");
        params.put("quantity", quantityText);
        JsonNode order = signed(HttpMethod.POST, "/fapi/v1/order", params);
        logger.info("Opened {} {} quantity {}", side.getValue(), symbol, quantityText);
        return toOrderResult(order, symbol, quantityText);
    }

    @Override
    public OrderResult closeLong(String symbol, double quantity) {
        return closePosition(symbol, PositionSide.LONG, quantity);
    }

    @Override
    public OrderResult closeShort(String symbol, double quantity) {
        return closePosition(symbol, PositionSide.SHORT, quantity);
    }

    private OrderResult closePosition(String symbol, PositionSide side, double quantity) {
        double amount = quantity;
        if (amount == 0) {
            Optional<ExchangePosition> position = findPosition(symbol, side);
            if (position.isEmpty()) {
                logger.info("No {} position on {} to close", side.getValue(), symbol);
                return OrderResult.noPosition(symbol);
            }
            amount = position.get().getPositionAmt();
        }

        String quantityText = formatQuantity(symbol, amount);
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("side", side == PositionSide.LONG ? "SELL" : "BUY");
        params.put("positionSide", side.getExchangeName());
        params.put("type", "MARKET");
        params.put("quantity", quantityText);
        JsonNode order = signed(HttpMethod.POST, "/fapi/v1/order", params);
        logger.info("Closed {} {} quantity {}", side.getValue(), symbol, quantityText);

        try {
            cancelAllOrders(symbol);
        } catch (ExchangeException e) {
            logger.warn("  Failed to cancel remaining orders for {}: {}", symbol, e.getMessage());
        }
        return toOrderResult(order, symbol, quantityText);
    }

    @Override
    public void cancelAllOrders(String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        signed(HttpMethod.DELETE, "/fapi/v1/allOpenOrders", params);
        logger.info("  Cancelled all open orders for {}", symbol);
    }

    @Override
    public double getMarketPrice(String symbol) {
        JsonNode ticker = publicGet("/fapi/v1/ticker/price", Map.of("symbol", symbol));
        double price = ticker.path("price").asDouble();
        if (price <= 0) {
            throw new ExchangeException(NAME, "No price for " + symbol);
        }
        return price;
    }

    @Override
    public void setStopLoss(String symbol, PositionSide side, double quantity, double stopPrice) {
        placeProtectiveOrder(symbol, side, "STOP_MARKET", stopPrice);
        logger.info("  Stop loss set at {}", stopPrice);
    }

    @Override
    public void setTakeProfit(String symbol, PositionSide side, double quantity, double takeProfitPrice) {
        placeProtectiveOrder(symbol, side, "TAKE_PROFIT_MARKET", takeProfitPrice);
        logger.info("  Take profit set at {}", takeProfitPrice);
    }

    // closePosition=true closes whatever is open on that side, so no quantity is sent
    private void placeProtectiveOrder(String symbol, PositionSide side, String type, double triggerPrice) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("side", side == PositionSide.LONG ? "SELL" : "BUY");
        params.put("positionSide", side.getExchangeName());
        params.put("type", type);
        params.put("stopPrice", BigDecimal.valueOf(triggerPrice).stripTrailingZeros().toPlainString());
        params.put("workingType", "CONTRACT_PRICE");
        params.put("closePosition", "true");
        signed(HttpMethod.POST, "/fapi/v1/order", params);
    }

    /**
     * Quantity rounded down to the symbol's step size; falls back to a fixed precision when
     * exchange metadata cannot be read.
     */
    String formatQuantity(String symbol, double quantity) {
        try {
            return PrecisionUtil.toPlainString(PrecisionUtil.floorToStep(quantity, stepSizeCache.get(symbol)));
        } catch (ExecutionException | UncheckedExecutionException e) {
            int precision = settings.getDefaultQuantityPrecision();
            logger.warn("Step size lookup failed for {}, using precision {}: {}", symbol, precision, e.getMessage());
            return PrecisionUtil.toPlainString(
                    BigDecimal.valueOf(quantity).setScale(precision, RoundingMode.DOWN));
        }
    }

    private String fetchStepSize(String symbol) {
        JsonNode info = publicGet("/fapi/v1/exchangeInfo", null);
        for (JsonNode entry : info.path("symbols")) {
            if (!symbol.equals(entry.path("symbol").asText())) {
                continue;
            }
            for (JsonNode filter : entry.path("filters")) {
                if ("LOT_SIZE".equals(filter.path("filterType").asText())) {
                    String stepSize = filter.path("stepSize").asText();
                    logger.info("  {} quantity step size: {}", symbol, stepSize);
                    return stepSize;
                }
            }
        }
        throw new ExchangeException(NAME, "No LOT_SIZE filter for " + symbol);
    }

    private Optional<Integer> currentLeverage(String symbol) {
        Integer applied = appliedLeverage.get(symbol);
        if (applied != null) {
            return Optional.of(applied);
        }
        try {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", symbol);
            JsonNode risks = signed(HttpMethod.GET, "/fapi/v2/positionRisk", params);
            for (JsonNode risk : risks) {
                if (risk.has("leverage")) {
                    int leverage = risk.path("leverage").asInt();
                    appliedLeverage.put(symbol, leverage);
                    return Optional.of(leverage);
                }
            }
        } catch (ExchangeException e) {
            logger.debug("Could not read current leverage for {}: {}", symbol, e.getMessage());
        }
        return Optional.empty();
    }

    private JsonNode signed(HttpMethod method, String path, Map<String, String> params) {
        params.put("timestamp", String.valueOf(clock.millis()));
        params.put("recvWindow", String.valueOf(settings.getRecvWindow()));
        String query = SignatureUtil.signQuery(secretKey, SignatureUtil.buildQueryString(params));

        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, apiKey);
        try {
            ResponseEntity<JsonNode> response = httpClientService.exchangeSigned(
                    method, settings.getBaseUrl(), path, query, headers, JsonNode.class);
            return requireBody(response, method + " " + path);
        } catch (RestClientResponseException e) {
            throw new ExchangeException(NAME, method + " " + path + " failed: " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ExchangeException(NAME, method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode publicGet(String path, Map<String, String> params) {
        try {
            ResponseEntity<JsonNode> response = httpClientService.get(settings.getBaseUrl() + path, null, JsonNode.class, params);
            return requireBody(response, "GET " + path);
        } catch (RestClientException e) {
            throw new ExchangeException(NAME, "GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static JsonNode requireBody(ResponseEntity<JsonNode> response, String call) {
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new ExchangeException(NAME, call + " returned " + response.getStatusCode());
        }
        return response.getBody();
    }

    private static OrderResult toOrderResult(JsonNode order, String symbol, String quantityText) {
        return OrderResult.builder()
                .orderId(order.path("orderId").asText(""))
                .symbol(symbol)
                .status(OrderResult.Status.FILLED)
                .quantity(Double.parseDouble(quantityText))
                .build();
    }

    // -4046 / -4059 and "No need to change" mean the requested state is already in effect
    static boolean isNoChangeNeeded(ExchangeException e) {
        String message = e.getMessage();
        return message != null && (message.contains("No need to change")
                || message.contains("-4046") || message.contains("-4059"));
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException(NAME, "Interrupted while waiting after a settings change", e);
        }
    }
}
