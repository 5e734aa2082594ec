package com.quantbacktest.replay.controller.dto;

import com.quantbacktest.replay.domain.MetricsSummary;
import com.quantbacktest.replay.domain.PortfolioSummary;
import com.quantbacktest.replay.domain.RejectionReason;
import com.quantbacktest.replay.domain.SymbolRules;
import com.quantbacktest.replay.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a completed backtest run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResponse {

    private String runId;
    private String symbol;
    private String strategyName;
    private int barsProcessed;
    private BigDecimal finalEquity;

    private PortfolioSummary portfolio;
    private MetricsSummary metrics;
    private SymbolRules rules;

    private Map<RejectionReason, Integer> rejectedOrders;
    private List<Trade> trades;

    private String reportDirectory;
}
