package com.quantbacktest.replay.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Execution details kept alongside each trade: slippage and rounding steps,
 * the effective fee rate and the exchange rules that were in force.
 */
@Value
@Builder
public class TradeAudit {

    BigDecimal intendedPrice;
    BigDecimal execPriceRaw;
    BigDecimal priceRoundDiff;
    BigDecimal qtyRaw;
    BigDecimal qtyRounded;
    BigDecimal qtyRoundDiff;
    BigDecimal slippageBps;
    BigDecimal notionalBeforeRound;
    BigDecimal notionalAfterRound;
    String ruleCheck;
    String runId;
    BigDecimal feeBps;
    int schemaVersion;
    BigDecimal tickSizeUsed;
    BigDecimal stepSizeUsed;
    BigDecimal minNotionalUsed;
}
