package com.aurumshield.backend.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(scale(left).multiply(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, double factor) {
        return scale(scale(left).multiply(BigDecimal.valueOf(factor)));
    }

    public static BigDecimal floorAtZero(BigDecimal value) {
        BigDecimal scaled = scale(value);
        return scaled.signum() < 0 ? ZERO : scaled;
    }

    /**
     * Ratio of two amounts as a double. Returns 0 when the denominator is zero or negative.
     */
    public static double ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() <= 0) {
            return 0.0;
        }
        return scale(numerator).divide(denominator, MathContext.DECIMAL64).doubleValue();
    }

    public static BigDecimal fromCents(long cents) {
        return scale(BigDecimal.valueOf(cents).movePointLeft(2));
    }
}
