package com.perptrader.backend.service.decision;

import com.perptrader.backend.model.AccountInfo;
import com.perptrader.backend.model.CandidateCoin;
import com.perptrader.backend.model.MarketSnapshot;
import com.perptrader.backend.model.PositionInfo;
import com.perptrader.backend.model.TimeframeSeries;
import com.perptrader.backend.model.TradingContext;
import com.perptrader.backend.service.market.MarketDataFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a {@link TradingContext} into the system and user prompts. Output depends only on the
 * context and the strategy template.
 */
@Component
public class PromptCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PromptCompiler.class);

    static final String BTC_SYMBOL = "BTCUSDT";
    static final Duration ENTER_COOLDOWN = Duration.ofMinutes(9);
    static final Duration STOP_COOLDOWN = Duration.ofMinutes(6);
    static final Duration TAKE_PROFIT_COOLDOWN = Duration.ofMinutes(3);

    private final SystemPromptLoader systemPromptLoader;

    public PromptCompiler(SystemPromptLoader systemPromptLoader) {
        this.systemPromptLoader = systemPromptLoader;
    }

    public CompiledPrompt compile(TradingContext ctx) {
        double equity = ctx.getAccount() == null ? 0.0 : ctx.getAccount().getTotalEquity();
        String system = buildSystemPrompt(systemPromptLoader.loadStrategy(), equity,
                ctx.getBtcEthLeverage(), ctx.getAltcoinLeverage());
        return new CompiledPrompt(system, buildUserPrompt(ctx));
    }

    public static String buildSystemPrompt(String strategy, double equity, int btcEthLeverage, int altcoinLeverage) {
        StringBuilder sb = new StringBuilder(strategy);
        if (!strategy.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append("\n# Hard constraints (risk control)\n\n");
        sb.append("1. Reward:risk ratio: must be >= 1:3 (risk 1% to make 3%+)\n");
        sb.append("2. Max positions: 3 symbols (quality over quantity)\n");
        sb.append(String.format(Locale.US,
                "3. Position size per symbol: altcoins %.0f-%.0f USDT (%dx leverage) | BTC/ETH %.0f-%.0f USDT (%dx leverage)%n",
                equity * 0.8, equity * 1.5, altcoinLeverage, equity * 5, equity * 10, btcEthLeverage));
        sb.append("4. Margin: total usage <= 90%\n");

        sb.append("\n# Output format\n\n");
        sb.append("Step 1: chain of thought (plain text)\nBriefly explain your reasoning.\n\n");
        sb.append("Step 2: JSON decision array\n\n```json\n[\n");
        sb.append(String.format(Locale.US,
                "  {\"symbol\": \"BTCUSDT\", \"action\": \"open_short\", \"leverage\": %d, \"position_size_usd\": %.0f, "
                        + "\"stop_loss\": 97000, \"take_profit\": 91000, \"confidence\": 85, \"risk_usd\": 300, "
                        + "\"reasoning\": \"Downtrend with bearish MACD cross\"},%n",
                btcEthLeverage, equity * 5));
        sb.append("  {\"symbol\": \"ETHUSDT\", \"action\": \"close_long\", \"reasoning\": \"Take profit\"}\n");
        sb.append("]\n```\n\n");
        sb.append("Field notes:\n");
        sb.append("- `action`: open_long | open_short | close_long | close_short | hold | wait\n");
        sb.append("- `confidence`: 0-100 (opening suggested at >= 75)\n");
        sb.append("- Required when opening: leverage, position_size_usd, stop_loss, take_profit, confidence, risk_usd, reasoning\n");
        return sb.toString();
    }

    public static String buildUserPrompt(TradingContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "**Time**: %s | **Cycle**: #%d | **Runtime**: %d minutes%n",
                ctx.getCurrentTime(), ctx.getCallCount(), ctx.getRuntimeMinutes()));

        MarketSnapshot btc = ctx.getMarketSnapshots().get(BTC_SYMBOL);
        if (btc != null) {
            appendBtcBlock(sb, btc);
        }

        AccountInfo account = ctx.getAccount() == null ? new AccountInfo() : ctx.getAccount();
        double availablePct = account.getTotalEquity() > 0
                ? account.getAvailableBalance() / account.getTotalEquity() * 100 : 0.0;
        sb.append(String.format(Locale.US,
                "**Account**: equity %.2f | available %.2f (%.1f%%) | pnl %+.2f%% | margin %.1f%% | positions %d%n",
                account.getTotalEquity(), account.getAvailableBalance(), availablePct,
                account.getTotalPnlPct(), account.getMarginUsedPct(), account.getPositionCount()));

        appendTradingState(sb, ctx, account);
        appendPositions(sb, ctx);
        appendCandidates(sb, ctx);

        if (ctx.getPerformance() != null) {
            sb.append(String.format(Locale.US, "## Sharpe ratio: %.2f%n%n", ctx.getPerformance().getSharpeRatio()));
        }
        sb.append("---\n\n");
        sb.append("Now analyze and output your decision (chain of thought + JSON)\n");
        return sb.toString();
    }

    private static void appendBtcBlock(StringBuilder sb, MarketSnapshot btc) {
        sb.append(String.format(Locale.US, "**BTC**: %.2f (%s: %s, %s: %s) | MACD: %.4f | RSI: %.2f%n",
                btc.getCurrentPrice(),
                btc.getMediumInterval(), formatChange(btc.getMediumSeries()),
                btc.getLongInterval(), formatChange(btc.getLongSeries()),
                btc.getCurrentMacd(), btc.getCurrentRsi7()));

        sb.append("\n**BTC multi-timeframe indicators** (BTC regime check for altcoin trades):\n\n");
        appendSeriesLine(sb, "btc_macd_short", btc.getShortInterval(), btc.getShortSeries() == null ? null : btc.getShortSeries().getMacd(), "%.4f");
        appendSeriesLine(sb, "btc_macd_medium", btc.getMediumInterval(), btc.getMediumSeries() == null ? null : btc.getMediumSeries().getMacd(), "%.4f");
        appendSeriesLine(sb, "btc_macd_long", btc.getLongInterval(), btc.getLongSeries() == null ? null : btc.getLongSeries().getMacd(), "%.4f");
        if (btc.getShortSeries() != null && !btc.getShortSeries().getMidPrices().isEmpty()) {
            sb.append("btc_price (short): [").append(join(btc.getShortSeries().getMidPrices(), "%.2f")).append("]\n");
        }
        Double volatility = realizedVolatility(btc.getLongSeries());
        if (volatility != null) {
            sb.append(String.format(Locale.US, "btc_daily_volatility_percent: %.2f%%%n", volatility));
        }
        sb.append('\n');
    }

    private static void appendTradingState(StringBuilder sb, TradingContext ctx, AccountInfo account) {
        sb.append("\n**Trading state constraints** (checked in decision steps 1-2):\n\n");
        if (ctx.getPositions().isEmpty()) {
            sb.append("current_position: {side: null, entry_price: null, size_coins: null}\n");
        } else {
            for (PositionInfo pos : ctx.getPositions()) {
                sb.append(String.format(Locale.US,
                        "current_position_%s: {side: %s, entry_price: %.4f, size_coins: %.4f}%n",
                        pos.getSymbol(), pos.getSide().getValue(), pos.getEntryPrice(), pos.getQuantity()));
            }
        }
        sb.append("last_enter_time: ").append(orNull(ctx.getLastEnterTime())).append('\n');
        sb.append("last_stop_time: ").append(orNull(ctx.getLastStopTime())).append('\n');
        sb.append("last_take_profit_time: ").append(orNull(ctx.getLastTakeProfitTime())).append('\n');
        sb.append("consecutive_losses_count: ").append(ctx.getConsecutiveLossesCount()).append('\n');

        double dailyLoss = ctx.getDailyLossPercent() > 0
                ? ctx.getDailyLossPercent()
                : Math.abs(Math.min(0, account.getTotalPnlPct()));
        sb.append(String.format(Locale.US, "daily_loss_percent: %.2f%%%n", dailyLoss));
        sb.append("cooldown_status: ").append(cooldownStatus(ctx)).append("\n\n");
    }

    private static void appendPositions(StringBuilder sb, TradingContext ctx) {
        if (ctx.getPositions().isEmpty()) {
            sb.append("**Current positions**: none\n");
            return;
        }
        sb.append("## Current positions\n");
        int index = 1;
        for (PositionInfo pos : ctx.getPositions()) {
            sb.append(String.format(Locale.US,
                    "%d. %s %s | entry %.4f current %.4f | pnl %+.2f%% | leverage %dx | margin %.0f | liquidation %.4f%s%n",
                    index++, pos.getSymbol(), pos.getSide().getValue().toUpperCase(Locale.ROOT),
                    pos.getEntryPrice(), pos.getMarkPrice(), pos.getUnrealizedPnlPct(), pos.getLeverage(),
                    pos.getMarginUsed(), pos.getLiquidationPrice(), holdingDuration(pos, ctx.getCurrentTime())));
            MarketSnapshot snapshot = ctx.getMarketSnapshots().get(pos.getSymbol());
            if (snapshot != null) {
                sb.append(MarketDataFormatter.format(snapshot)).append('\n');
            }
        }
    }

    private static void appendCandidates(StringBuilder sb, TradingContext ctx) {
        sb.append(String.format(Locale.US, "## Candidate coins (%d)%n%n", ctx.getMarketSnapshots().size()));
        int displayed = 0;
        for (CandidateCoin coin : ctx.getCandidateCoins()) {
            MarketSnapshot snapshot = ctx.getMarketSnapshots().get(coin.getSymbol());
            if (snapshot == null) {
                continue;
            }
            displayed++;
            String tags = "";
            if (coin.isDualSignal()) {
                tags = " (AI500+OI_Top dual signal)";
            } else if (coin.isOnlyOiTop()) {
                tags = " (OI_Top open interest growth)";
            }
            sb.append("### ").append(displayed).append(". ").append(coin.getSymbol()).append(tags).append("\n\n");
            sb.append(MarketDataFormatter.format(snapshot)).append('\n');
        }
        sb.append('\n');
    }

    /**
     * "cooling" while any of the entry, stop or take-profit cooldowns is still running at the
     * context's current time; "ok" otherwise.
     */
    public static String cooldownStatus(TradingContext ctx) {
        Instant now = ctx.getCurrentTime();
        if (now == null) {
            return "ok";
        }
        boolean cooling = isWithin(ctx.getLastEnterTime(), now, ENTER_COOLDOWN)
                || isWithin(ctx.getLastStopTime(), now, STOP_COOLDOWN)
                || isWithin(ctx.getLastTakeProfitTime(), now, TAKE_PROFIT_COOLDOWN);
        return cooling ? "cooling" : "ok";
    }

    private static boolean isWithin(String isoTime, Instant now, Duration window) {
        if (isoTime == null || isoTime.isBlank()) {
            return false;
        }
        try {
            Duration elapsed = Duration.between(Instant.parse(isoTime), now);
            return elapsed.compareTo(window) < 0;
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparseable cooldown timestamp {}", isoTime);
            return false;
        }
    }

    static String holdingDuration(PositionInfo pos, Instant now) {
        if (pos.getFirstSeenTime() <= 0 || now == null) {
            return "";
        }
        long minutes = Math.max(0, (now.toEpochMilli() - pos.getFirstSeenTime()) / 60_000);
        if (minutes < 60) {
            return " | holding " + minutes + " min";
        }
        return " | holding " + (minutes / 60) + "h" + (minutes % 60) + "m";
    }

    /** Mean absolute period-over-period change of the series' prices, in percent. */
    static Double realizedVolatility(TimeframeSeries series) {
        if (series == null || series.getMidPrices().size() < 2) {
            return null;
        }
        List<Double> prices = series.getMidPrices();
        double sum = 0;
        int count = 0;
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            if (previous > 0) {
                sum += Math.abs((prices.get(i) - previous) / previous * 100);
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    private static String formatChange(TimeframeSeries series) {
        Double change = series == null ? null : series.changePercent();
        return change == null ? "N/A" : String.format(Locale.US, "%+.2f%%", change);
    }

    private static void appendSeriesLine(StringBuilder sb, String name, String interval, List<Double> values, String format) {
        if (values == null || values.isEmpty()) {
            return;
        }
        sb.append(name).append(" (").append(interval).append("): [").append(join(values, format)).append("]\n");
    }

    private static String join(List<Double> values, String format) {
        return values.stream().map(v -> String.format(Locale.US, format, v)).collect(Collectors.joining(", "));
    }

    private static String orNull(String value) {
        return value == null || value.isBlank() ? "null" : value;
    }
}
