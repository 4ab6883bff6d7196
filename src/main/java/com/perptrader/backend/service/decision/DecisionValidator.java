package com.perptrader.backend.service.decision;

import com.perptrader.backend.config.TraderProperties;
import com.perptrader.backend.exception.ValidationRejectedException;
import com.perptrader.backend.model.Decision;
import com.perptrader.backend.model.TradeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hard risk rules applied to the model's decisions before anything reaches an exchange.
 * Stops at the first violation.
 */
@Component
public class DecisionValidator {

    static final Set<String> MAJOR_SYMBOLS = Set.of("BTCUSDT", "ETHUSDT");
    static final double MIN_REWARD_RISK = 3.0;
    static final double SIZE_TOLERANCE = 0.01;

    private final double assumedEntryFraction;

    public DecisionValidator(TraderProperties properties) {
        this(properties.getAssumedEntryFraction());
    }

    public DecisionValidator(double assumedEntryFraction) {
        this.assumedEntryFraction = assumedEntryFraction;
    }

    /**
     * @throws ValidationRejectedException on the first decision that breaks a rule
     */
    public void validate(List<Decision> decisions, double equity, int btcEthLeverage, int altcoinLeverage) {
        for (int i = 0; i < decisions.size(); i++) {
            Decision decision = decisions.get(i);
            try {
                validateOne(decision, equity, btcEthLeverage, altcoinLeverage);
            } catch (ValidationRejectedException e) {
                throw new ValidationRejectedException("Decision #" + (i + 1) + " rejected: " + e.getMessage(), decision);
            }
        }
    }

    void validateOne(Decision d, double equity, int btcEthLeverage, int altcoinLeverage) {
        TradeAction action = d.tradeAction();
        if (action == null) {
            throw reject("invalid action: " + d.getAction(), d);
        }
        if (!action.isOpen()) {
            return;
        }

        boolean major = MAJOR_SYMBOLS.contains(d.getSymbol());
        int maxLeverage = major ? btcEthLeverage : altcoinLeverage;
        double maxPositionValue = major ? equity * 10 : equity * 1.5;

        if (d.getLeverage() <= 0 || d.getLeverage() > maxLeverage) {
            throw reject(String.format(Locale.US, "leverage must be between 1 and %d for %s, got %d",
                    maxLeverage, d.getSymbol(), d.getLeverage()), d);
        }
        if (d.getPositionSizeUsd() <= 0) {
            throw reject(String.format(Locale.US, "position size must be greater than 0, got %.2f",
                    d.getPositionSizeUsd()), d);
        }
        if (d.getPositionSizeUsd() > maxPositionValue * (1 + SIZE_TOLERANCE)) {
            throw reject(String.format(Locale.US, "%s position value cannot exceed %.0f USDT (%s account equity), got %.0f",
                    major ? "BTC/ETH" : "altcoin", maxPositionValue, major ? "10x" : "1.5x", d.getPositionSizeUsd()), d);
        }
        if (d.getStopLoss() <= 0 || d.getTakeProfit() <= 0) {
            throw reject("stop loss and take profit must be greater than 0", d);
        }

        boolean isLong = action == TradeAction.OPEN_LONG;
        if (isLong && d.getStopLoss() >= d.getTakeProfit()) {
            throw reject("for a long, stop loss must be below take profit", d);
        }
        if (!isLong && d.getStopLoss() <= d.getTakeProfit()) {
            throw reject("for a short, stop loss must be above take profit", d);
        }

        double entry = assumedEntry(d, isLong);
        double riskPercent = isLong
                ? (entry - d.getStopLoss()) / entry * 100
                : (d.getStopLoss() - entry) / entry * 100;
        double rewardPercent = isLong
                ? (d.getTakeProfit() - entry) / entry * 100
                : (entry - d.getTakeProfit()) / entry * 100;
        double ratio = riskPercent > 0 ? rewardPercent / riskPercent : 0.0;
        if (riskPercent <= 0 || ratio < MIN_REWARD_RISK) {
            throw reject(String.format(Locale.US,
                    "reward:risk ratio too low (%.2f:1), must be >= %.1f:1 [risk: %.2f%% reward: %.2f%%] [entry: %.2f stop: %.2f target: %.2f]",
                    ratio, MIN_REWARD_RISK, riskPercent, rewardPercent, entry, d.getStopLoss(), d.getTakeProfit()), d);
        }
    }

    /**
     * Entry assumed between stop and target at the configured fraction of the range, measured
     * from the stop. The live price is unknown until the order fills.
     */
    double assumedEntry(Decision d, boolean isLong) {
        return isLong
                ? d.getStopLoss() + (d.getTakeProfit() - d.getStopLoss()) * assumedEntryFraction
                : d.getStopLoss() - (d.getStopLoss() - d.getTakeProfit()) * assumedEntryFraction;
    }

    private static ValidationRejectedException reject(String message, Decision decision) {
        return new ValidationRejectedException(message, decision);
    }
}
