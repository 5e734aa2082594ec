package com.quantbacktest.replay.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calculator for backtest performance metrics.
 */
@Slf4j
public class PerformanceMetrics {

    public static final String BASIS_DAILY = "daily";
    public static final String BASIS_PER_BAR = "per-bar";

    /**
     * Calculate every metric of a finished run.
     *
     * @param useDaily          resample equity to the last value of each UTC day; falls back to
     *                          per-bar returns when there are fewer than two days
     * @param annualizationDays periods per year used to annualize return, volatility and Sharpe
     */
    public static MetricsSummary calculate(List<EquityPoint> equityCurve, List<Trade> trades,
                                           boolean useDaily, int annualizationDays) {
        if (equityCurve.isEmpty()) {
            throw new IllegalArgumentException("Equity curve is empty");
        }
        if (annualizationDays < 1) {
            throw new IllegalArgumentException("Annualization days must be at least 1");
        }

        List<EquityPoint> curve = new ArrayList<>(equityCurve);
        curve.sort(Comparator.comparing(EquityPoint::getTimestamp));

        EquityPoint first = curve.get(0);
        EquityPoint last = curve.get(curve.size() - 1);
        long periodDays = Math.max(Duration.between(first.getTimestamp(), last.getTimestamp()).toDays(), 1);

        String basis = BASIS_PER_BAR;
        List<Double> returns = null;
        if (useDaily) {
            List<Double> daily = calculateReturns(lastEquityPerDay(curve));
            if (!daily.isEmpty()) {
                returns = daily;
                basis = BASIS_DAILY;
            }
        }
        if (returns == null) {
            returns = calculateReturns(curve.stream().map(EquityPoint::getEquity).toList());
        }

        BigDecimal totalReturn = calculateTotalReturn(first.getEquity(), last.getEquity());
        BigDecimal realizedTotal = trades.stream()
                .map(Trade::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        MetricsSummary summary = MetricsSummary.builder()
                .totalReturn(totalReturn)
                .annualizedReturn(calculateAnnualizedReturn(totalReturn, annualizationDays, periodDays))
                .annualizedVolatility(calculateVolatility(returns, annualizationDays))
                .sharpeRatio(calculateSharpeRatio(returns, annualizationDays))
                .maxDrawdown(calculateMaxDrawdown(curve.stream().map(EquityPoint::getEquity).toList()))
                .tradeCount(trades.size())
                .totalPnl(realizedTotal.setScale(2, RoundingMode.HALF_UP))
                .periodDays(periodDays)
                .equityStart(first.getEquity().setScale(2, RoundingMode.HALF_UP))
                .equityEnd(last.getEquity().setScale(2, RoundingMode.HALF_UP))
                .startTimestamp(first.getTimestamp())
                .endTimestamp(last.getTimestamp())
                .returnsBasis(basis)
                .annualizationDays(annualizationDays)
                .build();

        log.debug("Metrics computed on {} returns ({}): {}", returns.size(), basis, summary);
        return summary;
    }

    /**
     * Calculate total return as a fraction: {@code end / start - 1}.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal startEquity, BigDecimal endEquity) {
        if (startEquity.signum() <= 0) {
            return null;
        }
        return endEquity.divide(startEquity, MathContext.DECIMAL64)
                .subtract(BigDecimal.ONE)
                .setScale(6, RoundingMode.HALF_UP);
    }

    /**
     * Compound the total return over the calendar length of the run.
     */
    public static BigDecimal calculateAnnualizedReturn(BigDecimal totalReturn, int annualizationDays, long periodDays) {
        if (totalReturn == null) {
            return null;
        }
        double annualized = Math.pow(1 + totalReturn.doubleValue(), (double) annualizationDays / periodDays) - 1;
        return toDecimal(annualized, 6);
    }

    /**
     * Annualized volatility: sample standard deviation of returns times sqrt(annualizationDays).
     */
    public static BigDecimal calculateVolatility(List<Double> returns, int annualizationDays) {
        double stdDev = standardDeviation(returns);
        return toDecimal(stdDev * Math.sqrt(annualizationDays), 6);
    }

    /**
     * Calculate Sharpe ratio (simplified - assuming risk-free rate of 0).
     */
    public static BigDecimal calculateSharpeRatio(List<Double> returns, int annualizationDays) {
        double stdDev = standardDeviation(returns);
        if (Double.isNaN(stdDev) || stdDev == 0) {
            return null;
        }
        double sharpe = (mean(returns) / stdDev) * Math.sqrt(annualizationDays);
        return toDecimal(sharpe, 4);
    }

    /**
     * Calculate maximum drawdown as the most negative {@code equity / runningPeak - 1}.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> equityValues) {
        if (equityValues.isEmpty()) {
            return null;
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal peak = equityValues.get(0);

        for (BigDecimal value : equityValues) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.signum() > 0) {
                BigDecimal drawdown = value.divide(peak, MathContext.DECIMAL64).subtract(BigDecimal.ONE);
                if (drawdown.compareTo(maxDrawdown) < 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown.setScale(6, RoundingMode.HALF_UP);
    }

    /**
     * Simple returns between consecutive values; steps from a non-positive value are skipped.
     */
    public static List<Double> calculateReturns(List<BigDecimal> values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            BigDecimal prevValue = values.get(i - 1);
            if (prevValue.signum() > 0) {
                returns.add(values.get(i).subtract(prevValue)
                        .divide(prevValue, MathContext.DECIMAL64)
                        .doubleValue());
            }
        }
        return returns;
    }

    static List<BigDecimal> lastEquityPerDay(List<EquityPoint> sortedCurve) {
        Map<LocalDate, BigDecimal> byDay = new LinkedHashMap<>();
        for (EquityPoint point : sortedCurve) {
            byDay.put(point.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate(), point.getEquity());
        }
        return new ArrayList<>(byDay.values());
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    private static double standardDeviation(List<Double> values) {
        if (values.size() < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sumSquaredDiff = values.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .sum();
        return Math.sqrt(sumSquaredDiff / (values.size() - 1));
    }

    private static BigDecimal toDecimal(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
