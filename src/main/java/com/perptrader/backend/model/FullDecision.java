package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one model call produced: the prompt it answered, its free-text reasoning
 * and the decisions parsed from the trailing JSON array.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FullDecision {
    private String userPrompt;
    private String reasoningTrace;
    @Builder.Default
    private List<Decision> decisions = new ArrayList<>();
    private Instant timestamp;
}
