package com.perptrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of executing one decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ActionRecord {
    private String action;
    private String symbol;
    private double quantity;
    private int leverage;
    private double price;
    private String orderId;
    private Instant timestamp;
    private boolean success;
    private String error;
    /** Unrealized PnL of the position at the moment it was closed; 0 for other actions. */
    private double profit;
}
