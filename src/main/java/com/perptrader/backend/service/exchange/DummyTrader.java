package com.perptrader.backend.service.exchange;

import com.perptrader.backend.model.ExchangeBalance;
import com.perptrader.backend.model.ExchangePosition;
import com.perptrader.backend.model.OrderResult;
import com.perptrader.backend.model.PositionSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Stand-in used for the Aster exchange until a real adapter exists. Reports an empty account
 * and accepts every order without contacting anything.
 */
public class DummyTrader implements Trader {

    private static final Logger logger = LoggerFactory.getLogger(DummyTrader.class);

    static final double PLACEHOLDER_PRICE = 100.0;
    static final String PLACEHOLDER_ORDER_ID = "dummy_order_id";

    private final String name;

    public DummyTrader(String name) {
        this.name = name;
        logger.warn("Exchange '{}' runs on a placeholder adapter; no orders reach a real venue", name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ExchangeBalance getBalance() {
        return ExchangeBalance.builder().build();
    }

    @Override
    public List<ExchangePosition> getPositions() {
        return Collections.emptyList();
    }

    @Override
    public void setLeverage(String symbol, int leverage) {
        logger.debug("[{}] set leverage {} {}x ignored", name, symbol, leverage);
    }

    @Override
    public void setMarginMode(String symbol) {
        logger.debug("[{}] set margin mode {} ignored", name, symbol);
    }

    @Override
    public OrderResult openLong(String symbol, double quantity, int leverage) {
        return submitted(symbol, quantity);
    }

    @Override
    public OrderResult openShort(String symbol, double quantity, int leverage) {
        return submitted(symbol, quantity);
    }

    @Override
    public OrderResult closeLong(String symbol, double quantity) {
        return submitted(symbol, quantity);
    }

    @Override
    public OrderResult closeShort(String symbol, double quantity) {
        return submitted(symbol, quantity);
    }

    @Override
    public void cancelAllOrders(String symbol) {
        logger.debug("[{}] cancel orders {} ignored", name, symbol);
    }

    @Override
    public double getMarketPrice(String symbol) {
        return PLACEHOLDER_PRICE;
    }

    @Override
    public void setStopLoss(String symbol, PositionSide side, double quantity, double stopPrice) {
        logger.debug("[{}] stop loss {} at {} ignored", name, symbol, stopPrice);
    }

    @Override
    public void setTakeProfit(String symbol, PositionSide side, double quantity, double takeProfitPrice) {
        logger.debug("[{}] take profit {} at {} ignored", name, symbol, takeProfitPrice);
    }

    @Override
    public double calculatePositionSize(double balance, double riskPercent, double price, int leverage) {
        return 0.0;
    }

    private OrderResult submitted(String symbol, double quantity) {
        logger.info("[{}] order on {} quantity {} accepted by placeholder adapter", name, symbol, quantity);
        return OrderResult.builder()
                .orderId(PLACEHOLDER_ORDER_ID)
                .symbol(symbol)
                .status(OrderResult.Status.SUBMITTED)
                .quantity(quantity)
                .build();
    }
}
