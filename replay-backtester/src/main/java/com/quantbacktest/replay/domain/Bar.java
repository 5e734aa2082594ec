package com.quantbacktest.replay.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single OHLCV bar. Bars are produced by the market data source and consumed
 * once per engine iteration.
 */
@Value
@Builder
public class Bar {

    Instant timestamp;
    String symbol;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
}
