package com.perptrader.backend.service.market;

import com.perptrader.backend.model.MarketSnapshot;

/**
 * Source of per-symbol market snapshots. Medium and long intervals are derived from
 * {@code shortInterval} with {@link KlineIntervals#next(String)}.
 */
public interface MarketSnapshotProvider {

    MarketSnapshot getSnapshot(String symbol, String shortInterval);
}
