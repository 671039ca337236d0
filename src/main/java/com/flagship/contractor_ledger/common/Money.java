package com.flagship.contractor_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money arithmetic helpers. All stored amounts carry two decimal places.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() < 0 ? ZERO : value;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? ZERO : value;
    }
}
