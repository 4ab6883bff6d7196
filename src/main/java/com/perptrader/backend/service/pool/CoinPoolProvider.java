package com.perptrader.backend.service.pool;

import com.perptrader.backend.model.MergedCoinPool;

public interface CoinPoolProvider {

    /**
     * Union of the top {@code limit} scored coins and the open-interest ranking, deduplicated,
     * each symbol tagged with the sources it came from. Never throws; degrades to defaults.
     */
    MergedCoinPool getMergedPool(int limit);
}
