package com.quantbacktest.replay.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An accepted execution recorded in the portfolio's trade ledger.
 * Price and quantity are the final values after slippage and exchange rounding.
 */
@Value
@Builder
public class Trade {

    Instant timestamp;
    String symbol;
    TradeSide side;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal fee;
    BigDecimal cashAfter;
    BigDecimal positionAfter;
    BigDecimal equityAfter;

    /** Realized PnL of this trade; always zero for buys. */
    BigDecimal realizedPnl;
    BigDecimal cumulativeRealizedPnl;
    String note;

    TradeAudit audit;
}
