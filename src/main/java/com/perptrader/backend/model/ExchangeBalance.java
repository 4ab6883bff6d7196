package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Balance figures as reported by an exchange adapter. Adapters must report the wallet
 * balance without unrealized PnL so that equity = wallet + unrealized holds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeBalance {
    private double totalWalletBalance;
    private double availableBalance;
    private double totalUnrealizedProfit;

    public double totalEquity() {
        return totalWalletBalance + totalUnrealizedProfit;
    }
}
