package com.quantbacktest.replay.domain;

import java.math.BigDecimal;

/**
 * Thrown when a strategy asks to sell more than the portfolio holds.
 * This is a bug in the calling strategy, not a market rejection.
 */
public class InsufficientPositionException extends RuntimeException {

    private final BigDecimal requested;
    private final BigDecimal held;

    public InsufficientPositionException(BigDecimal requested, BigDecimal held) {
        super("Cannot sell " + requested.toPlainString() + ": position is only " + held.toPlainString());
        this.requested = requested;
        this.held = held;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getHeld() {
        return held;
    }
}
