package com.perptrader.backend.service.execution;

import com.perptrader.backend.exception.TradingException;
import com.perptrader.backend.model.ActionRecord;
import com.perptrader.backend.model.Decision;
import com.perptrader.backend.model.DecisionRecord;
import com.perptrader.backend.model.ExchangePosition;
import com.perptrader.backend.model.OrderResult;
import com.perptrader.backend.model.PositionInfo;
import com.perptrader.backend.model.PositionSide;
import com.perptrader.backend.model.TradeAction;
import com.perptrader.backend.model.TradingContext;
import com.perptrader.backend.service.context.AgentState;
import com.perptrader.backend.service.exchange.Trader;
import com.perptrader.backend.service.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs validated, sorted decisions against the agent's exchange. A failing decision is
 * recorded and never stops the ones after it.
 */
public class DecisionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(DecisionExecutor.class);

    private final Trader trader;
    private final AgentState state;
    private final Clock clock;
    private final long executionDelayMs;
    private final Sleeper sleeper;

    public DecisionExecutor(Trader trader, AgentState state, Clock clock, long executionDelayMs, Sleeper sleeper) {
        this.trader = trader;
        this.state = state;
        this.clock = clock;
        this.executionDelayMs = executionDelayMs;
        this.sleeper = sleeper;
    }

    /**
     * Executes each decision in order, appending an {@link ActionRecord} and an execution log line
     * to {@code record} for every one of them.
     */
    public void executeAll(List<Decision> decisions, TradingContext ctx, DecisionRecord record) {
        for (Decision decision : decisions) {
            ActionRecord action = ActionRecord.builder()
                    .action(decision.getAction())
                    .symbol(decision.getSymbol())
                    .leverage(decision.getLeverage())
                    .timestamp(clock.instant())
                    .build();
            try {
                execute(decision, ctx, action);
                action.setSuccess(true);
                record.getExecutionLog().add(String.format("✓ %s %s succeeded", decision.getSymbol(), decision.getAction()));
                record.getDecisions().add(action);
                pauseAfterExecution();
            } catch (RuntimeException e) {
                logger.error("Decision failed ({} {}): {}", decision.getSymbol(), decision.getAction(), e.getMessage());
                action.setError(e.getMessage());
                record.getExecutionLog().add(String.format("❌ %s %s failed: %s", decision.getSymbol(), decision.getAction(), e.getMessage()));
                record.getDecisions().add(action);
            }
        }
    }

    void execute(Decision decision, TradingContext ctx, ActionRecord action) {
        TradeAction tradeAction = decision.tradeAction();
        if (tradeAction == null) {
            throw new TradingException("Unknown action: " + decision.getAction());
        }
        if (tradeAction.isOpen() && !ctx.isCandidate(decision.getSymbol())) {
            throw new TradingException(decision.getSymbol()
                    + " is not in the candidate pool; opening is only allowed for candidate symbols");
        }
        switch (tradeAction) {
            case OPEN_LONG:
            case OPEN_SHORT:
                open(decision, tradeAction.getSide(), action);
                break;
            case CLOSE_LONG:
            case CLOSE_SHORT:
                close(decision, tradeAction.getSide(), action);
                break;
            default:
                // hold and wait place no orders
                break;
        }
    }

    private void open(Decision decision, PositionSide side, ActionRecord action) {
        String symbol = decision.getSymbol();
        logger.info("  Opening {} {}", side.getValue(), symbol);

        if (trader.findPosition(symbol, side).isPresent()) {
            throw new TradingException(String.format(
                    "%s already has a %s position; refusing to stack. Close it first with close_%s",
                    symbol, side.getValue(), side.getValue()));
        }

        double price = trader.getMarketPrice(symbol);
        double quantity = decision.getPositionSizeUsd() / price;
        action.setQuantity(quantity);
        action.setPrice(price);

        OrderResult order = side == PositionSide.LONG
                ? trader.openLong(symbol, quantity, decision.getLeverage())
                : trader.openShort(symbol, quantity, decision.getLeverage());
        action.setOrderId(order.getOrderId());
        // protective orders cover what the exchange actually took
        double openedQuantity = order.getQuantity() > 0 ? order.getQuantity() : quantity;
        action.setQuantity(openedQuantity);
        logger.info("  Position opened, order id: {}, quantity: {}", order.getOrderId(), String.format("%.4f", openedQuantity));

        state.markEntry(PositionInfo.positionKey(symbol, side), clock.instant());

        try {
            trader.setStopLoss(symbol, side, openedQuantity, decision.getStopLoss());
        } catch (TradingException e) {
            logger.warn("  Failed to set stop loss for {}: {}", symbol, e.getMessage());
        }
        try {
            trader.setTakeProfit(symbol, side, openedQuantity, decision.getTakeProfit());
        } catch (TradingException e) {
            logger.warn("  Failed to set take profit for {}: {}", symbol, e.getMessage());
        }
    }

    private void close(Decision decision, PositionSide side, ActionRecord action) {
        String symbol = decision.getSymbol();
        logger.info("  Closing {} {}", side.getValue(), symbol);

        action.setPrice(trader.getMarketPrice(symbol));
        Optional<ExchangePosition> position = trader.findPosition(symbol, side);

        OrderResult order = side == PositionSide.LONG ? trader.closeLong(symbol, 0) : trader.closeShort(symbol, 0);
        if (order.isNoPosition()) {
            throw new TradingException(String.format("No open %s position on %s", side.getValue(), symbol));
        }
        action.setOrderId(order.getOrderId());
        action.setQuantity(order.getQuantity());
        logger.info("  Position closed");

        if (position.isPresent()) {
            ExchangePosition closed = position.get();
            action.setProfit(closed.getUnrealizedProfit());
            Instant now = clock.instant();
            state.markClose(closed.pnlPercent(), closed.getUnrealizedProfit(), now);
            logger.info("  Closed at {}% ({} USDT), consecutive losses now {}",
                    String.format("%.2f", closed.pnlPercent()), String.format("%+.2f", closed.getUnrealizedProfit()),
                    state.getConsecutiveLossesCount());
        }
    }

    private void pauseAfterExecution() {
        if (executionDelayMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(executionDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
