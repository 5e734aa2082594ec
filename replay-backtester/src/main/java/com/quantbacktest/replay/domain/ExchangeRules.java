package com.quantbacktest.replay.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and validation helpers for exchange increments.
 * Both roundings floor to the allowed multiple so an order is never more precise
 * than the exchange accepts.
 */
public final class ExchangeRules {

    private ExchangeRules() {
    }

    /**
     * Floor a price to a multiple of the tick size. A missing or non-positive tick means no rounding.
     */
    public static BigDecimal roundPrice(BigDecimal price, BigDecimal tickSize) {
        return floorToStep(price, tickSize);
    }

    /**
     * Floor a quantity to a multiple of the step size. A missing or non-positive step means no rounding.
     */
    public static BigDecimal roundQuantity(BigDecimal quantity, BigDecimal stepSize) {
        return floorToStep(quantity, stepSize);
    }

    /**
     * Check the minimum quantity and minimum notional, each only when present.
     */
    public static boolean isValid(BigDecimal price, BigDecimal quantity,
                                  BigDecimal minNotional, BigDecimal minQty) {
        if (minQty != null && quantity.compareTo(minQty) < 0) {
            return false;
        }
        return minNotional == null || price.multiply(quantity).compareTo(minNotional) >= 0;
    }

    private static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return value;
        }
        BigDecimal steps = value.divide(step, 0, RoundingMode.FLOOR);
        return steps.multiply(step).stripTrailingZeros();
    }
}
