package com.eainde.compatibility.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Rounding {

    private Rounding() {
    }

    /**
     * Rounds the exact binary value of {@code value} half-to-even. 54.55 is stored just
     * below 54.55, so it rounds to 54.5; 0.025 is stored just above, so it rounds to 0.03.
     */
    static double round(double value, int decimals) {
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
