package com.perptrader.backend.service.market;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supported kline intervals and the rules that derive the medium and long timeframes.
 */
public final class KlineIntervals {

    public static final String DEFAULT_SHORT = "3m";

    private static final Map<String, Integer> MINUTES = new LinkedHashMap<>();

    static {
        MINUTES.put("1m", 1);
        MINUTES.put("3m", 3);
        MINUTES.put("5m", 5);
        MINUTES.put("15m", 15);
        MINUTES.put("30m", 30);
        MINUTES.put("1h", 60);
        MINUTES.put("2h", 120);
        MINUTES.put("4h", 240);
        MINUTES.put("6h", 360);
        MINUTES.put("8h", 480);
        MINUTES.put("12h", 720);
        MINUTES.put("1d", 1440);
        MINUTES.put("3d", 4320);
        MINUTES.put("1w", 10080);
    }

    private KlineIntervals() {
    }

    public static boolean isSupported(String interval) {
        return MINUTES.containsKey(interval);
    }

    public static int minutes(String interval) {
        Integer value = MINUTES.get(interval);
        if (value == null) {
            throw new IllegalArgumentException("Unsupported interval: " + interval);
        }
        return value;
    }

    /**
     * Smallest supported interval within [4x, 5x] the given one; otherwise the smallest at
     * or above 4x; the largest supported interval when nothing qualifies.
     */
    public static String next(String interval) {
        int base = minutes(interval);
        int low = base * 4;
        int high = base * 5;
        for (Map.Entry<String, Integer> entry : MINUTES.entrySet()) {
            if (entry.getValue() >= low && entry.getValue() <= high) {
                return entry.getKey();
            }
        }
        for (Map.Entry<String, Integer> entry : MINUTES.entrySet()) {
            if (entry.getValue() >= low) {
                return entry.getKey();
            }
        }
        return "1w";
    }

    /**
     * Short interval for a scan period given in minutes. Unknown periods fall back to 3m.
     */
    public static String forScanMinutes(int scanMinutes) {
        for (Map.Entry<String, Integer> entry : MINUTES.entrySet()) {
            if (entry.getValue() == scanMinutes) {
                return entry.getKey();
            }
        }
        return DEFAULT_SHORT;
    }

    /** Duration label used in prompts, e.g. "3-minute" or "4-hour". */
    public static String describe(String interval) {
        int value = minutes(interval);
        if (value % 10080 == 0) {
            return (value / 10080) + "-week";
        }
        if (value % 1440 == 0) {
            return (value / 1440) + "-day";
        }
        if (value % 60 == 0) {
            return (value / 60) + "-hour";
        }
        return value + "-minute";
    }
}
