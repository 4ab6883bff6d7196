package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateCoin {

    public static final String SOURCE_AI500 = "ai500";
    public static final String SOURCE_OI_TOP = "oi_top";

    private String symbol;
    private Set<String> sources = new LinkedHashSet<>();

    public boolean isDualSignal() {
        return sources.size() > 1;
    }

    public boolean isOnlyOiTop() {
        return sources.size() == 1 && sources.contains(SOURCE_OI_TOP);
    }
}
