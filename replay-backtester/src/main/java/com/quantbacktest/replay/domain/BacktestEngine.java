package com.quantbacktest.replay.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Core backtesting engine that replays bars through a strategy, one bar at a time.
 * <p>
 * Per bar: mark the portfolio to the close, sample equity, then call the strategy.
 * After the last bar the optional finish hook runs and one more equity sample is
 * taken so the curve always ends on the true final equity. Strategy exceptions
 * are not caught.
 */
@Slf4j
public class BacktestEngine {

    /**
     * Run a backtest with the given parameters.
     */
    public BacktestResult runBacktest(BacktestRunConfig config) {
        Strategy strategy = config.getStrategy();
        Portfolio portfolio = config.getPortfolio();
        Optional<FinishHook> finishHook = strategy.finishHook();
        String prefix = portfolio.getRunId() != null ? "[run:" + portfolio.getRunId() + "] " : "";

        log.info("{}Starting backtest - Strategy: {}, Symbol: {}, Starting cash: {}",
                prefix, strategy.getName(), portfolio.getSymbol(), portfolio.getStartingCash());

        int barCount = 0;
        Bar lastBar = null;
        for (Bar bar : config.getBars()) {
            barCount++;
            lastBar = bar;

            portfolio.markToMarket(bar.getClose());
            portfolio.recordEquitySample(bar.getTimestamp());

            if (barCount == 1 || (config.getLogEvery() > 0 && barCount % config.getLogEvery() == 0)) {
                log.info("{}[{}] {} i={} close={} cash={} qty={} equity={}", prefix, bar.getTimestamp(),
                        bar.getSymbol(), barCount, bar.getClose(), portfolio.getCash(),
                        portfolio.getPosition(), portfolio.equity());
            } else if (log.isDebugEnabled()) {
                log.debug("{}[{}] {} i={} close={} equity={}", prefix, bar.getTimestamp(),
                        bar.getSymbol(), barCount, bar.getClose(), portfolio.equity());
            }

            strategy.onBar(bar, portfolio);
        }

        if (finishHook.isPresent()) {
            try {
                finishHook.get().onFinish(portfolio);
            } catch (RuntimeException e) {
                log.error("{}Finish hook of {} failed: {}", prefix, strategy.getName(), e.getMessage());
                throw e;
            }
        }

        if (lastBar != null) {
            portfolio.recordEquitySample(lastBar.getTimestamp());
        }

        BigDecimal finalEquity = portfolio.equity();
        log.info("{}Backtest completed - Bars: {}, Trades: {}, Rejected orders: {}, Final equity: {}",
                prefix, barCount, portfolio.getTrades().size(), portfolio.getRejectedOrderCount(), finalEquity);

        return BacktestResult.builder()
                .strategyName(strategy.getName())
                .barsProcessed(barCount)
                .finalEquity(finalEquity)
                .summary(portfolio.summary())
                .trades(portfolio.getTrades())
                .equityCurve(portfolio.getEquityCurve())
                .rejectionCounts(portfolio.getRejectionCounts())
                .build();
    }

    /**
     * Configuration for a backtest run.
     */
    @Value
    @Builder
    public static class BacktestRunConfig {
        Strategy strategy;
        Iterable<Bar> bars;
        Portfolio portfolio;
        @Builder.Default
        int logEvery = 10;
    }

    /**
     * Result of a backtest run.
     */
    @Value
    @Builder
    public static class BacktestResult {
        String strategyName;
        int barsProcessed;
        BigDecimal finalEquity;
        PortfolioSummary summary;
        List<Trade> trades;
        List<EquityPoint> equityCurve;
        Map<RejectionReason, Integer> rejectionCounts;
    }
}
