package com.perptrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A row of the open-interest growth ranking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OpenInterestTopEntry {
    private String symbol;
    private int rank;
    private double currentOi;
    private double oiDelta;
    private double oiDeltaPercent;
    private double oiDeltaValue;
    private double priceDeltaPercent;
    private double netLong;
    private double netShort;
}
