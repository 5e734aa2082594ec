package com.quantbacktest.replay.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Execution parameters shared by the portfolio ledger and the strategies of one run.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionSettings {

    /** Commission rate in basis points of the executed notional. */
    @Builder.Default
    BigDecimal feeBps = BigDecimal.ZERO;

    /** Adverse price shift in basis points applied to every market order. */
    @Builder.Default
    BigDecimal slippageBps = BigDecimal.ZERO;

    /** Default fraction of cash a strategy commits when it sizes a buy. */
    @Builder.Default
    BigDecimal allocPct = BigDecimal.ONE;

    /** Whether sell-side fees are subtracted from realized PnL. */
    @Builder.Default
    boolean realizedPnlNetFees = false;
}
