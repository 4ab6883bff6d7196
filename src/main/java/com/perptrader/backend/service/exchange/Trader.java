package com.perptrader.backend.service.exchange;

import com.perptrader.backend.model.ExchangeBalance;
import com.perptrader.backend.model.ExchangePosition;
import com.perptrader.backend.model.OrderResult;
import com.perptrader.backend.model.PositionSide;

import java.util.List;
import java.util.Optional;

/**
 * Capabilities every exchange adapter offers. Failures surface as
 * {@link com.perptrader.backend.exception.ExchangeException}.
 */
public interface Trader {

    String getName();

    ExchangeBalance getBalance();

    /** Open positions only, with non-negative quantities. */
    List<ExchangePosition> getPositions();

    /** No exchange call is made when the symbol is already at the target leverage. */
    void setLeverage(String symbol, int leverage);

    /** Switches the symbol to isolated margin; "already isolated" counts as success. */
    void setMarginMode(String symbol);

    /**
     * Cancels resting orders (best effort), applies leverage and isolated margin, then
     * places a market-equivalent buy.
     */
    OrderResult openLong(String symbol, double quantity, int leverage);

    OrderResult openShort(String symbol, double quantity, int leverage);

    /**
     * Closes a long. A quantity of 0 closes the whole live position; when there is none the
     * result is {@link OrderResult#noPosition(String)}.
     */
    OrderResult closeLong(String symbol, double quantity);

    OrderResult closeShort(String symbol, double quantity);

    void cancelAllOrders(String symbol);

    double getMarketPrice(String symbol);

    void setStopLoss(String symbol, PositionSide side, double quantity, double stopPrice);

    void setTakeProfit(String symbol, PositionSide side, double quantity, double takeProfitPrice);

    /**
     * Quantity whose margin equals {@code riskPercent} of {@code balance} at {@code leverage}.
     */
    default double calculatePositionSize(double balance, double riskPercent, double price, int leverage) {
        if (price <= 0) {
            return 0.0;
        }
        return balance * (riskPercent / 100.0) * leverage / price;
    }

    default Optional<ExchangePosition> findPosition(String symbol, PositionSide side) {
        return getPositions().stream()
                .filter(p -> p.getSymbol().equals(symbol) && p.getSide() == side)
                .findFirst();
    }
}
