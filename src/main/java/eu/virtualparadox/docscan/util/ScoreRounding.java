package eu.virtualparadox.docscan.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding of percentage scores for display.
 * <p>Rounds the exact binary value of the double half-even, so {@code 6.25} becomes {@code 6.2}
 * and {@code 0.15} (stored slightly below) becomes {@code 0.1}.</p>
 */
public final class ScoreRounding {

    private ScoreRounding() {
        // prevent instantiation
    }

    public static double toOneDecimal(final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }
}
