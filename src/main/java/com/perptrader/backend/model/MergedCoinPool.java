package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated union of the scored list and the open-interest ranking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergedCoinPool {
    @Builder.Default
    private List<String> allSymbols = new ArrayList<>();
    @Builder.Default
    private Map<String, Set<String>> symbolSources = new LinkedHashMap<>();
    @Builder.Default
    private List<OpenInterestTopEntry> oiTopEntries = new ArrayList<>();
}
