package com.perptrader.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@DependsOn("dotenv")
@ConfigurationProperties(prefix = "trader")
public class TraderProperties {

    private List<AgentConfig> agents = new ArrayList<>();

    /** Start every configured agent once the application is ready. */
    private boolean autoStart = true;

    /** Parent directory of the per-agent decision journals. */
    private String decisionLogDir = "decision_logs";

    /** Candidates whose open interest is worth less than this (USD) are not analyzed. */
    private double minOpenInterestUsd = 15_000_000;

    /** Where between stop and target the validator assumes entry when no live price is known. */
    private double assumedEntryFraction = 0.2;

    /** How long shutdown waits for agents to finish their current cycle. */
    private int stopTimeoutSeconds = 180;

    /** Performance summary window, in cycles. */
    private int performanceWindow = 20;

    private Prompt prompt = new Prompt();
    private Ai ai = new Ai();
    private CoinPool coinPool = new CoinPool();
    private MarketData marketData = new MarketData();
    private Binance binance = new Binance();
    private Hyperliquid hyperliquid = new Hyperliquid();

    @Data
    public static class Prompt {
        private String systemPromptLocation = "classpath:prompt/system_prompt.txt";
    }

    @Data
    public static class Ai {
        private int timeoutSeconds = 120;
        private int maxTokens = 2000;
        private double temperature = 0.5;
        private int maxAttempts = 3;
        private long backoffStepMs = 2000;
    }

    @Data
    public static class CoinPool {
        private String ai500Url = "";
        private String oiTopUrl = "";
        private int ai500Limit = 20;
        private int timeoutSeconds = 30;
        private int maxAttempts = 3;
        private long retryPauseMs = 2000;
        private String cacheDir = "coin_pool_cache";
        private boolean useDefaultCoins = false;
        private List<String> customCoins = new ArrayList<>();
        private int memoryCacheMinutes = 1;
    }

    @Data
    public static class MarketData {
        private String baseUrl = "https://fapi.binance.com";
        private int klineLimit = 60;
        private int seriesLength = 10;
    }

    @Data
    public static class Binance {
        private String baseUrl = "https://fapi.binance.com";
        private long recvWindow = 5000;
        private long leverageCooldownMs = 5000;
        private long marginModeCooldownMs = 3000;
        private int defaultQuantityPrecision = 3;
    }

    @Data
    public static class Hyperliquid {
        private String mainnetUrl = "https://api.hyperliquid.xyz";
        private String testnetUrl = "https://api.hyperliquid-testnet.xyz";
        private int defaultSizeDecimals = 4;
        private double slippage = 0.01;
    }
}
