package com.quantbacktest.replay.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of running one order request through the execution model, before any
 * portfolio state changes. Carries every intermediate value for the trade audit.
 */
@Value
@Builder
public class ExecutionPreview {

    boolean accepted;
    RejectionReason rejectionReason;
    TradeSide side;
    BigDecimal intendedPrice;
    BigDecimal execPriceRaw;
    BigDecimal execPrice;
    BigDecimal qtyRaw;
    BigDecimal qtyRounded;
    BigDecimal slippageBps;
    BigDecimal notionalBeforeRound;
    BigDecimal notionalAfterRound;

    public BigDecimal getPriceRoundDiff() {
        return execPriceRaw.subtract(execPrice);
    }

    public BigDecimal getQtyRoundDiff() {
        return qtyRaw.subtract(qtyRounded);
    }
}
