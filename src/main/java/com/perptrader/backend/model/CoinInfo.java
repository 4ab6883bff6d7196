package com.perptrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An entry of the scored (AI500) coin list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CoinInfo {
    private String pair;
    private double score;
    private long startTime;
    private double startPrice;
    private double lastScore;
    private double maxScore;
    private double maxPrice;
    private double increasePercent;
    @Builder.Default
    @JsonProperty("is_available")
    private boolean available = true;
}
