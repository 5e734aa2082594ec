package com.quantbacktest.replay.domain;

/**
 * Why the execution model refused an order.
 */
public enum RejectionReason {
    INVALID_INPUT("quantity/reference price must be positive"),
    ZERO_QUANTITY_AFTER_ROUNDING("quantity rounds to zero at step size"),
    INSUFFICIENT_CASH("insufficient cash for notional + fee"),
    EXCHANGE_RULES("exchange rules: minNotional/minQty");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
