package com.perptrader.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One agent's line in the side-by-side comparison.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CompetitionEntry {
    private String traderId;
    private String traderName;
    private String aiModel;
    private double totalEquity;
    private double totalPnl;
    private double totalPnlPct;
    private int positionCount;
    private double marginUsedPct;
    private int callCount;
    private boolean running;
}
