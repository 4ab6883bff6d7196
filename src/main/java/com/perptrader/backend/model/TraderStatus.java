package com.perptrader.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TraderStatus {
    private String traderId;
    private String traderName;
    private String aiModel;
    private String exchange;
    private boolean running;
    private CycleState cycleState;
    private Instant startTime;
    private long runtimeMinutes;
    private int callCount;
    private double initialBalance;
    private String scanInterval;
    private Instant stopUntil;
    private Instant lastResetTime;
    private String aiProvider;
}
