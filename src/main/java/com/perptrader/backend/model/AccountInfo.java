package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountInfo {
    /** Wallet balance plus unrealized PnL. */
    private double totalEquity;
    private double availableBalance;
    private double totalPnl;
    private double totalPnlPct;
    private double marginUsed;
    private double marginUsedPct;
    private int positionCount;
}
