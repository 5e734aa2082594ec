package com.quantbacktest.replay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.replay.controller.dto.BacktestRequest;
import com.quantbacktest.replay.controller.dto.BacktestResponse;
import com.quantbacktest.replay.domain.BacktestEngine;
import com.quantbacktest.replay.domain.Bar;
import com.quantbacktest.replay.domain.ExecutionSettings;
import com.quantbacktest.replay.domain.MetricsSummary;
import com.quantbacktest.replay.domain.PerformanceMetrics;
import com.quantbacktest.replay.domain.Portfolio;
import com.quantbacktest.replay.domain.Strategy;
import com.quantbacktest.replay.domain.SymbolRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Implementation of BacktestService: loads bars and rules, replays them through
 * the engine, then computes metrics and writes the run's reports.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    static final String RUN_ID_KEY = "runId";

    private final MarketDataService marketDataService;
    private final SymbolRulesService symbolRulesService;
    private final StrategyFactory strategyFactory;
    private final ReportWriter reportWriter;
    private final BacktestMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final ExecutionSettings defaultExecutionSettings;

    @Value("${backtest.initial-capital:10000}")
    private BigDecimal defaultInitialCapital;

    @Value("${backtest.rules.enabled:true}")
    private boolean rulesEnabled;

    @Value("${backtest.engine.log-every:10}")
    private int logEvery;

    @Value("${backtest.metrics.use-daily:true}")
    private boolean useDailyReturns;

    @Value("${backtest.metrics.annualization-days:252}")
    private int annualizationDays;

    @Override
    public BacktestResponse runBacktest(BacktestRequest request) {
        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID_KEY, runId);

        try {
            return runInternal(runId, request);
        } catch (RuntimeException e) {
            metricsService.recordRunFailed();
            log.error("Backtest run failed: {}", e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private BacktestResponse runInternal(String runId, BacktestRequest request) {
        long startTime = System.currentTimeMillis();
        String symbol = request.getSymbol();

        log.info("Performing backtest - Strategy: {}, Symbol: {}, Period: {} to {}",
                request.getStrategyName(), symbol, request.getStartDate(), request.getEndDate());

        ExecutionSettings settings = resolveSettings(request);
        JsonNode parameters = request.getParameters() != null
                ? objectMapper.valueToTree(request.getParameters())
                : null;
        Strategy strategy = strategyFactory.createStrategy(request.getStrategyName(), parameters, settings.getAllocPct());

        List<Bar> bars = marketDataService.loadBars(symbol, request.getStartDate(), request.getEndDate());
        if (bars.isEmpty()) {
            throw new IllegalStateException("No market data available for " + symbol + " between "
                    + request.getStartDate() + " and " + request.getEndDate());
        }

        boolean useRules = request.getUseExchangeRules() != null ? request.getUseExchangeRules() : rulesEnabled;
        SymbolRules rules = useRules ? symbolRulesService.loadRules(symbol) : null;

        BigDecimal initialCapital = request.getInitialCapital() != null
                ? request.getInitialCapital()
                : defaultInitialCapital;

        Portfolio portfolio = Portfolio.builder()
                .symbol(symbol)
                .cash(initialCapital)
                .settings(settings)
                .rules(rules)
                .runId(runId)
                .build();

        BacktestEngine engine = new BacktestEngine();
        BacktestEngine.BacktestResult result = engine.runBacktest(BacktestEngine.BacktestRunConfig.builder()
                .strategy(strategy)
                .bars(bars)
                .portfolio(portfolio)
                .logEvery(logEvery)
                .build());

        MetricsSummary metrics = PerformanceMetrics.calculate(
                result.getEquityCurve(), result.getTrades(), useDailyReturns, annualizationDays);

        Path runDir = reportWriter.createRunDirectory(symbol, result.getStrategyName());
        reportWriter.writeReport(runDir, result.getTrades(), result.getEquityCurve(),
                ReportWriter.RunSummary.builder()
                        .runId(runId)
                        .symbol(symbol)
                        .strategy(result.getStrategyName())
                        .metrics(metrics)
                        .portfolio(result.getSummary())
                        .rejectedOrders(result.getRejectionCounts())
                        .build());

        long executionTimeMs = System.currentTimeMillis() - startTime;
        metricsService.recordRunCompleted(executionTimeMs, result.getTrades().size(), result.getRejectionCounts());

        log.info("Completed in {} ms - Trades: {}, Final equity: {}, Total return: {}",
                executionTimeMs, result.getTrades().size(), result.getFinalEquity(), metrics.getTotalReturn());
        log.debug(metricsService.getMetricsSummary());

        return BacktestResponse.builder()
                .runId(runId)
                .symbol(symbol)
                .strategyName(result.getStrategyName())
                .barsProcessed(result.getBarsProcessed())
                .finalEquity(result.getFinalEquity())
                .portfolio(result.getSummary())
                .metrics(metrics)
                .rules(rules)
                .rejectedOrders(result.getRejectionCounts())
                .trades(result.getTrades())
                .reportDirectory(runDir.toString())
                .build();
    }

    /**
     * Request overrides take precedence over the configured execution defaults.
     */
    ExecutionSettings resolveSettings(BacktestRequest request) {
        ExecutionSettings.ExecutionSettingsBuilder builder = defaultExecutionSettings.toBuilder();
        if (request.getFeeBps() != null) {
            builder.feeBps(request.getFeeBps());
        }
        if (request.getSlippageBps() != null) {
            builder.slippageBps(request.getSlippageBps());
        }
        if (request.getAllocPct() != null) {
            builder.allocPct(request.getAllocPct());
        }
        if (request.getRealizedPnlNetFees() != null) {
            builder.realizedPnlNetFees(request.getRealizedPnlNetFees());
        }
        return builder.build();
    }
}
