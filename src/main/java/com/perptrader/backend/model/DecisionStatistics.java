package com.perptrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DecisionStatistics {
    private int totalDecisions;
    private int successfulDecisions;
    private int failedDecisions;
    private int totalExecutions;
    private int successfulExecutions;
    private int failedExecutions;
    private Instant firstLogTime;
    private Instant lastLogTime;
}
