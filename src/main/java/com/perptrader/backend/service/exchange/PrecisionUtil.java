package com.perptrader.backend.service.exchange;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Quantity and price rounding rules shared by the exchange adapters.
 */
public final class PrecisionUtil {

    private PrecisionUtil() {
    }

    /**
     * Largest multiple of {@code stepSize} not above {@code quantity}.
     */
    public static BigDecimal floorToStep(double quantity, String stepSize) {
        BigDecimal step = new BigDecimal(stepSize);
        if (step.signum() <= 0) {
            throw new IllegalArgumentException("Step size must be positive: " + stepSize);
        }
        BigDecimal steps = BigDecimal.valueOf(quantity).divide(step, 0, RoundingMode.DOWN);
        return steps.multiply(step).stripTrailingZeros();
    }

    /** Number of decimals implied by a step size such as "0.001" (3) or "1" (0). */
    public static int decimalsOf(String stepSize) {
        return Math.max(0, new BigDecimal(stepSize).stripTrailingZeros().scale());
    }

    public static BigDecimal roundToDecimals(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    /**
     * Rounds to {@code figures} significant digits, so 97123.456 becomes 97123 and 0.0123456 becomes 0.012346.
     */
    public static BigDecimal roundToSignificantFigures(double value, int figures) {
        if (value == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(value).round(new MathContext(figures, RoundingMode.HALF_UP)).stripTrailingZeros();
    }

    /** Plain decimal text with no exponent and no trailing zeros. */
    public static String toPlainString(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
