package com.quantbacktest.replay.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Performance statistics derived from the equity curve and trade ledger.
 * Ratios are fractions (0.05 = 5%); a statistic that cannot be computed is null.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsSummary {

    BigDecimal totalReturn;
    BigDecimal annualizedReturn;
    BigDecimal annualizedVolatility;
    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;
    int tradeCount;
    BigDecimal totalPnl;
    long periodDays;
    BigDecimal equityStart;
    BigDecimal equityEnd;
    Instant startTimestamp;
    Instant endTimestamp;
    String returnsBasis;
    int annualizationDays;
}
