package com.perptrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One line of the decision journal. Exactly one is written per cycle, whether it
 * succeeded or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DecisionRecord {
    private Instant timestamp;
    private int cycleNumber;
    private boolean success;
    private String errorMessage;
    private String inputPrompt;
    private String cotTrace;
    private String decisionJson;
    @Builder.Default
    private List<String> executionLog = new ArrayList<>();
    private AccountSnapshot accountState;
    @Builder.Default
    private List<PositionSnapshot> positions = new ArrayList<>();
    @Builder.Default
    private List<String> candidateCoins = new ArrayList<>();
    @Builder.Default
    private List<ActionRecord> decisions = new ArrayList<>();

    private String lastEnterTime;
    private String lastStopTime;
    private String lastTakeProfitTime;
    private int consecutiveLossesCount;
    private double dailyLossPercent;

    /** Marks the record failed, keeping the first fatal stage's message. */
    public void fail(String message) {
        if (success || errorMessage == null) {
            this.errorMessage = message;
        }
        this.success = false;
    }
}
