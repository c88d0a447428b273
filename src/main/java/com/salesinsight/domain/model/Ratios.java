package com.salesinsight.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Division helpers with the zero-denominator results analytics callers rely on.
 */
public final class Ratios {

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final int SCALE = 2;

    private Ratios() {
    }

    /**
     * total / count, or 0 when count is 0.
     */
    public static BigDecimal average(BigDecimal total, long count) {
        if (count == 0 || total == null) {
            return zero();
        }
        return total.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * part / whole * 100, or 0 when whole is 0.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return zero();
        }
        return part.multiply(HUNDRED).divide(whole, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * (current - base) / base * 100, or null when base is 0.
     */
    public static BigDecimal changePercent(BigDecimal base, BigDecimal current) {
        if (base == null || base.signum() == 0) {
            return null;
        }
        return current.subtract(base).multiply(HUNDRED).divide(base, SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
