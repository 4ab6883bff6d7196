package com.perptrader.backend.config;

import com.perptrader.backend.exception.ConfigurationException;
import com.perptrader.backend.model.ExchangeType;
import lombok.Data;

import java.util.Locale;

/**
 * Settings of one trading agent, bound from {@code trader.agents[n]}.
 */
@Data
public class AgentConfig {
    private String id;
    private String name;
    private boolean enabled = true;

    /** deepseek, qwen or custom. */
    private String aiModel = "deepseek";
    private String deepseekKey;
    private String qwenKey;
    private String customApiUrl;
    private String customApiKey;
    private String customModelName;

    /** binance, hyperliquid or aster. */
    private String exchange = "binance";
    private String binanceApiKey;
    private String binanceSecretKey;
    private String hyperliquidPrivateKey;
    private boolean hyperliquidTestnet = false;
    private String asterUser;
    private String asterSigner;
    private String asterPrivateKey;

    private int scanIntervalMinutes = 3;
    private double initialBalance;
    private int btcEthLeverage = 5;
    private int altcoinLeverage = 5;

    /** Percent of the day-start equity; 0 disables the check. */
    private double maxDailyLoss;
    /** Percent below peak equity; 0 disables the check. */
    private double maxDrawdown;
    private int stopTradingMinutes = 60;

    /** Pause after each successfully executed decision. */
    private long executionDelayMs = 1000;

    public ExchangeType exchangeType() {
        if (exchange == null || exchange.isBlank()) {
            return ExchangeType.BINANCE;
        }
        for (ExchangeType type : ExchangeType.values()) {
            if (type.getValue().equals(exchange.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new ConfigurationException("Unsupported exchange for agent " + id + ": " + exchange);
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
