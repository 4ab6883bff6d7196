package com.perptrader.backend.service.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.exception.ExchangeException;
import com.perptrader.backend.model.ExchangeBalance;
import com.perptrader.backend.model.ExchangePosition;
import com.perptrader.backend.model.OrderResult;
import com.perptrader.backend.model.PositionSide;
import com.perptrader.backend.service.client.HttpClientService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hyperliquid perpetuals. Market orders are emulated with IOC limit orders priced through the
 * mid by the configured slippage; stops are reduce-only trigger orders.
 */
public class HyperliquidTrader implements Trader {

    private static final Logger logger = LoggerFactory.getLogger(HyperliquidTrader.class);

    static final String NAME = "hyperliquid";
    private static final int PRICE_SIGNIFICANT_FIGURES = 5;

    private final HttpClientService httpClientService;
    private final HyperliquidSigner signer;
    private final TraderProperties.Hyperliquid settings;
    private final String baseUrl;
    private final Clock clock;
    private final AtomicLong lastNonce = new AtomicLong();
    private final Map<String, Integer> appliedLeverage = new ConcurrentHashMap<>();
    private final Supplier<Map<String, AssetMeta>> metaSupplier;

    public HyperliquidTrader(HttpClientService httpClientService, HyperliquidSigner signer,
                             TraderProperties.Hyperliquid settings, boolean testnet, Clock clock) {
        this.httpClientService = httpClientService;
        this.signer = signer;
        this.settings = settings;
        this.baseUrl = testnet ? settings.getTestnetUrl() : settings.getMainnetUrl();
        this.clock = clock;
        this.metaSupplier = Suppliers.memoizeWithExpiration(this::loadMeta, 1, TimeUnit.HOURS);
        logger.info("Hyperliquid trader ready (testnet={}, wallet={})", testnet, signer.getAddress());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ExchangeBalance getBalance() {
        logger.info("Requesting Hyperliquid account state");
        JsonNode state = clearinghouseState();
        JsonNode summary = state.has("crossMarginSummary") ? state.path("crossMarginSummary") : state.path("marginSummary");
        double accountValue = summary.path("accountValue").asDouble();
        double marginUsed = summary.path("totalMarginUsed").asDouble();

        double unrealized = 0;
        for (JsonNode assetPosition : state.path("assetPositions")) {
            unrealized += assetPosition.path("position").path("unrealizedPnl").asDouble();
        }
        // accountValue already includes unrealized PnL
        ExchangeBalance balance = ExchangeBalance.builder()
                .totalWalletBalance(accountValue - unrealized)
                .availableBalance(accountValue - marginUsed)
                .totalUnrealizedProfit(unrealized)
                .build();
        logger.info("Hyperliquid account value={}, wallet={}, available={}, unrealized={}",
                accountValue, balance.getTotalWalletBalance(), balance.getAvailableBalance(), unrealized);
        return balance;
    }

    @Override
    public List<ExchangePosition> getPositions() {
        List<ExchangePosition> positions = new ArrayList<>();
        for (JsonNode assetPosition : clearinghouseState().path("assetPositions")) {
            JsonNode position = assetPosition.path("position");
            double size = position.path("szi").asDouble();
            if (size == 0) {
                continue;
            }
            double amount = Math.abs(size);
            positions.add(ExchangePosition.builder()
                    .symbol(position.path("coin").asText() + "USDT")
                    .side(size > 0 ? PositionSide.LONG : PositionSide.SHORT)
                    .positionAmt(amount)
                    .entryPrice(position.path("entryPx").asDouble(0))
                    .markPrice(position.path("positionValue").asDouble() / amount)
                    .unrealizedProfit(position.path("unrealizedPnl").asDouble())
                    .leverage(position.path("leverage").path("value").asInt())
                    .liquidationPrice(position.path("liquidationPx").asDouble(0))
                    .build());
        }
        return positions;
    }

    @Override
    public void setLeverage(String symbol, int leverage) {
        Integer current = appliedLeverage.get(symbol);
        if (current != null && current == leverage) {
            logger.info("  {} leverage already {}x, skipping", symbol, leverage);
            return;
        }
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "updateLeverage");
        action.put("asset", assetIndex(toCoin(symbol)));
        // isolated margin is selected together with leverage
        action.put("isCross", false);
        action.put("leverage", leverage);
        postAction(action);
        appliedLeverage.put(symbol, leverage);
        logger.info("  {} leverage set to {}x (isolated)", symbol, leverage);
    }

    @Override
    public void setMarginMode(String symbol) {
        logger.debug("  {} margin mode is applied with leverage on Hyperliquid", symbol);
    }

    @Override
    public OrderResult openLong(String symbol, double quantity, int leverage) {
        return openPosition(symbol, true, quantity, leverage);
    }

    @Override
    public OrderResult openShort(String symbol, double quantity, int leverage) {
        return openPosition(symbol, false, quantity, leverage);
    }

    private OrderResult openPosition(String symbol, boolean buy, double quantity, int leverage) {
        try {
            cancelAllOrders(symbol);
        } catch (ExchangeException e) {
            logger.warn("  Failed to cancel old orders for {}: {}", symbol, e.getMessage());
        }
        setLeverage(symbol, leverage);
        OrderResult result = placeIocOrder(symbol, buy, quantity, false);
        logger.info("Opened {} {} quantity {}", buy ? "long" : "short", symbol, result.getQuantity());
        return result;
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
        OrderResult result = placeIocOrder(symbol, side == PositionSide.SHORT, amount, true);
        logger.info("Closed {} {} quantity {}", side.getValue(), symbol, result.getQuantity());
        try {
            cancelAllOrders(symbol);
        } catch (ExchangeException e) {
            logger.warn("  Failed to cancel remaining orders for {}: {}", symbol, e.getMessage());
        }
        return result;
    }

    private OrderResult placeIocOrder(String symbol, boolean buy, double quantity, boolean reduceOnly) {
        String coin = toCoin(symbol);
        double mid = getMarketPrice(symbol);
        double slippage = buy ? 1 + settings.getSlippage() : 1 - settings.getSlippage();
        String price = PrecisionUtil.toPlainString(PrecisionUtil.roundToSignificantFigures(mid * slippage, PRICE_SIGNIFICANT_FIGURES));
        BigDecimal size = roundSize(coin, quantity);
        logger.info("  {} size {} -> {}, limit price {}", coin, quantity, size.toPlainString(), price);

        Map<String, Object> orderType = new LinkedHashMap<>();
        orderType.put("limit", Map.of("tif", "Ioc"));
        JsonNode status = placeOrder(orderWire(coin, buy, price, size, reduceOnly, orderType));

        JsonNode filled = status.path("filled");
        double filledSize = filled.path("totalSz").asDouble(0);
        return OrderResult.builder()
                .orderId(filled.path("oid").asText(status.path("resting").path("oid").asText("")))
                .symbol(symbol)
                .status(filled.isMissingNode() ? OrderResult.Status.SUBMITTED : OrderResult.Status.FILLED)
                .quantity(filledSize > 0 ? filledSize : size.doubleValue())
                .build();
    }

    @Override
    public void cancelAllOrders(String symbol) {
        String coin = toCoin(symbol);
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("type", "openOrders");
        request.put("user", signer.getAddress());

        List<Map<String, Object>> cancels = new ArrayList<>();
        for (JsonNode order : info(request)) {
            if (coin.equals(order.path("coin").asText())) {
                Map<String, Object> cancel = new LinkedHashMap<>();
                cancel.put("a", assetIndex(coin));
                cancel.put("o", order.path("oid").asLong());
                cancels.add(cancel);
            }
        }
        if (!cancels.isEmpty()) {
            Map<String, Object> action = new LinkedHashMap<>();
            action.put("type", "cancel");
            action.put("cancels", cancels);
            postAction(action);
        }
        logger.info("  Cancelled {} open orders for {}", cancels.size(), symbol);
    }

    @Override
    public double getMarketPrice(String symbol) {
        String coin = toCoin(symbol);
        JsonNode mids = info(Map.of("type", "allMids"));
        if (!mids.has(coin)) {
            throw new ExchangeException(NAME, "No price for " + symbol);
        }
        return mids.path(coin).asDouble();
    }

    @Override
    public void setStopLoss(String symbol, PositionSide side, double quantity, double stopPrice) {
        placeTriggerOrder(symbol, side, quantity, stopPrice, "sl");
        logger.info("  Stop loss set at {}", stopPrice);
    }

    @Override
    public void setTakeProfit(String symbol, PositionSide side, double quantity, double takeProfitPrice) {
        placeTriggerOrder(symbol, side, quantity, takeProfitPrice, "tp");
        logger.info("  Take profit set at {}", takeProfitPrice);
    }

    private void placeTriggerOrder(String symbol, PositionSide side, double quantity, double triggerPrice, String tpsl) {
        String coin = toCoin(symbol);
        String price = PrecisionUtil.toPlainString(PrecisionUtil.roundToSignificantFigures(triggerPrice, PRICE_SIGNIFICANT_FIGURES));

        Map<String, Object> trigger = new LinkedHashMap<>();
        trigger.put("isMarket", true);
        trigger.put("triggerPx", price);
        trigger.put("tpsl", tpsl);
        Map<String, Object> orderType = new LinkedHashMap<>();
        orderType.put("trigger", trigger);

        // closing a short buys back
        placeOrder(orderWire(coin, side == PositionSide.SHORT, price, roundSize(coin, quantity), true, orderType));
    }

    private Map<String, Object> orderWire(String coin, boolean buy, String price, BigDecimal size,
                                          boolean reduceOnly, Map<String, Object> orderType) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("a", assetIndex(coin));
        wire.put("b", buy);
        wire.put("p", price);
        wire.put("s", PrecisionUtil.toPlainString(size));
        wire.put("r", reduceOnly);
        wire.put("t", orderType);
        return wire;
    }

    private JsonNode placeOrder(Map<String, Object> orderWire) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "order");
        action.put("orders", List.of(orderWire));
        action.put("grouping", "na");
        JsonNode response = postAction(action);

        JsonNode status = response.path("response").path("data").path("statuses").path(0);
        if (status.has("error")) {
            throw new ExchangeException(NAME, "Order rejected: " + status.path("error").asText());
        }
        return status;
    }

    private JsonNode postAction(Map<String, Object> action) {
        long nonce = nextNonce();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        payload.put("nonce", nonce);
        payload.put("signature", signer.signAction(action, nonce));
        payload.put("vaultAddress", null);

        JsonNode response = post("/exchange", payload);
        if (!"ok".equals(response.path("status").asText())) {
            throw new ExchangeException(NAME, action.get("type") + " failed: " + response.path("response").asText(response.toString()));
        }
        return response;
    }

    private JsonNode clearinghouseState() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("type", "clearinghouseState");
        request.put("user", signer.getAddress());
        return info(request);
    }

    private JsonNode info(Map<String, Object> request) {
        return post("/info", request);
    }

    private JsonNode post(String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<JsonNode> response = httpClientService.post(baseUrl + path, headers, body, JsonNode.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ExchangeException(NAME, "POST " + path + " returned " + response.getStatusCode());
            }
            return response.getBody();
        } catch (RestClientResponseException e) {
            throw new ExchangeException(NAME, "POST " + path + " failed: " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ExchangeException(NAME, "POST " + path + " failed: " + e.getMessage(), e);
        }
    }

    private Map<String, AssetMeta> loadMeta() {
        JsonNode meta = info(Map.of("type", "meta"));
        Map<String, AssetMeta> assets = new HashMap<>();
        int index = 0;
        for (JsonNode asset : meta.path("universe")) {
            assets.put(asset.path("name").asText(), new AssetMeta(index++, asset.path("szDecimals").asInt()));
        }
        logger.info("Loaded Hyperliquid metadata for {} assets", assets.size());
        return assets;
    }

    private int assetIndex(String coin) {
        AssetMeta asset = metaSupplier.get().get(coin);
        if (asset == null) {
            throw new ExchangeException(NAME, "Unknown asset " + coin);
        }
        return asset.index;
    }

    BigDecimal roundSize(String coin, double quantity) {
        AssetMeta asset = metaSupplier.get().get(coin);
        int decimals = asset != null ? asset.sizeDecimals : settings.getDefaultSizeDecimals();
        if (asset == null) {
            logger.warn("No size precision for {}, using {}", coin, decimals);
        }
        return PrecisionUtil.roundToDecimals(quantity, decimals);
    }

    // nonces must be strictly increasing per wallet
    private long nextNonce() {
        long now = clock.millis();
        return lastNonce.updateAndGet(last -> Math.max(last + 1, now));
    }

    static String toCoin(String symbol) {
        if (symbol.length() > 4 && symbol.endsWith("USDT")) {
            return symbol.substring(0, symbol.length() - 4);
        }
        return symbol;
    }

    private static final class AssetMeta {
        private final int index;
        private final int sizeDecimals;

        private AssetMeta(int index, int sizeDecimals) {
            this.index = index;
            this.sizeDecimals = sizeDecimals;
        }
    }
}
