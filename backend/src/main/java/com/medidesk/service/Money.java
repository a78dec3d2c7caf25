package com.medidesk.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency arithmetic: base-10 fixed point with two fraction digits, rounded half-up.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    public static BigDecimal of(BigDecimal value) {
        return value == null ? ZERO : value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal of(String value) {
        return of(new BigDecimal(value));
    }

    public static BigDecimal times(BigDecimal rate, long quantity) {
        return of(rate.multiply(BigDecimal.valueOf(quantity)));
    }

    public static BigDecimal sum(BigDecimal a, BigDecimal b) {
        return of(of(a).add(of(b)));
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
