package com.perptrader.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One trading instruction produced by the model for a single symbol.
 * Numeric fields default to zero when the model leaves them out.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Decision {
    String symbol;
    String action;
    int leverage;
    double positionSizeUsd;
    double stopLoss;
    double takeProfit;
    int confidence;
    double riskUsd;
    String reasoning;

    public TradeAction tradeAction() {
        return TradeAction.fromValue(action);
    }
}
