package com.quantbacktest.replay.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Snapshot of the portfolio state for reporting.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PortfolioSummary {

    BigDecimal startingCash;
    BigDecimal cash;
    BigDecimal position;
    BigDecimal lastPrice;
    BigDecimal equity;
    BigDecimal realizedPnl;
    BigDecimal totalPnl;
    BigDecimal averageCost;
    int tradeCount;
}
