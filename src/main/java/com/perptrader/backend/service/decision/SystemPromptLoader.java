package com.perptrader.backend.service.decision;

import com.perptrader.backend.config.TraderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads the strategy part of the system prompt from a Spring resource location. A missing or
 * unreadable template falls back to {@link #DEFAULT_STRATEGY}.
 */
@Component
public class SystemPromptLoader {

    private static final Logger logger = LoggerFactory.getLogger(SystemPromptLoader.class);

    static final String DEFAULT_STRATEGY = String.join("\n",
            "You are a professional crypto derivatives trading AI trading autonomously on perpetual futures.",
            "",
            "# Core objective",
            "",
            "Maximize the Sharpe ratio (average return / return volatility).",
            "- High-quality trades (high win rate, large reward:risk) raise it.",
            "- Frequent small trades, overtrading and premature exits lower it.",
            "",
            "The system scans every few minutes, which does not mean you must trade every time.",
            "Most of the time the right answer is `wait` or `hold`; open only on excellent setups.",
            "",
            "# Long/short balance",
            "",
            "Profit from shorting a downtrend equals profit from buying an uptrend.",
            "- Uptrend: long. Downtrend: short. Choppy market: wait.",
            "",
            "# Trade frequency",
            "",
            "- A good trader makes 2-4 trades per day, 0.1-0.2 per hour.",
            "- More than 2 trades per hour is overtrading.",
            "- Hold a new position for at least 30-60 minutes.",
            "",
            "# Entry criteria",
            "",
            "Open only on strong signals; when unsure, wait.",
            "Cross-check price, volume, open interest, indicators and series shape.",
            "Open only with overall confidence >= 75.",
            "Avoid single-indicator signals, contradicting signals, ranges and re-entries shortly after a close.",
            "",
            "# Sharpe ratio self-evolution",
            "",
            "- Sharpe < -0.5: stop trading, wait for at least 6 cycles and review frequency, holding time and signal strength.",
            "- Sharpe -0.5 to 0: only trades with confidence > 80, at most one new position per hour, hold at least 30 minutes.",
            "- Sharpe 0 to 0.7: keep the current strategy.",
            "- Sharpe > 0.7: position sizes may grow moderately.",
            "",
            "# Decision process",
            "",
            "1. Review the Sharpe ratio: is the strategy working?",
            "2. Review positions: has the trend changed, is it time to take profit or stop out?",
            "3. Look for new opportunities, long or short.",
            "4. Output the reasoning followed by the JSON decisions.",
            "");

    private final ResourceLoader resourceLoader;
    private final String location;
    private volatile String cached;

    public SystemPromptLoader(ResourceLoader resourceLoader, TraderProperties properties) {
        this.resourceLoader = resourceLoader;
        this.location = properties.getPrompt().getSystemPromptLocation();
    }

    public String loadStrategy() {
        String text = cached;
        if (text == null) {
            text = read();
            cached = text;
        }
        return text;
    }

    private String read() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            logger.warn("System prompt template {} not found, using built-in default", location);
            return DEFAULT_STRATEGY;
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            logger.info("Loaded system prompt template from {}", location);
            return text;
        } catch (IOException e) {
            logger.error("Failed to read system prompt template {}, using built-in default: {}", location, e.getMessage());
            return DEFAULT_STRATEGY;
        }
    }
}
