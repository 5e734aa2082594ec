package com.quantbacktest.replay.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedList;
import java.util.Optional;
import java.util.Queue;

/**
 * Moving Average Crossover Strategy.
 * Buys when short MA crosses above long MA, sells the whole position when short MA
 * crosses below long MA, and liquidates whatever is left after the last bar.
 */
@Slf4j
public class MovingAverageCrossoverStrategy implements Strategy {

    private final int shortPeriod;
    private final int longPeriod;
    private final BigDecimal allocPct;

    private final Queue<BigDecimal> shortWindow = new LinkedList<>();
    private final Queue<BigDecimal> longWindow = new LinkedList<>();

    private BigDecimal previousShortMA = null;
    private BigDecimal previousLongMA = null;
    private Bar lastBar;

    public MovingAverageCrossoverStrategy(int shortPeriod, int longPeriod, BigDecimal allocPct) {
        if (shortPeriod <= 0) {
            throw new IllegalArgumentException("Short period must be positive");
        }
        if (shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("Short period must be less than long period");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.allocPct = allocPct;
    }

    @Override
    public void onBar(Bar bar, Portfolio portfolio) {
        BigDecimal closePrice = bar.getClose();
        lastBar = bar;

        // Update windows
        shortWindow.add(closePrice);
        longWindow.add(closePrice);

        if (shortWindow.size() > shortPeriod) {
            shortWindow.poll();
        }
        if (longWindow.size() > longPeriod) {
            longWindow.poll();
        }

        // Wait until we have enough data
        if (longWindow.size() < longPeriod) {
            return;
        }

        BigDecimal shortMA = calculateMA(shortWindow);
        BigDecimal longMA = calculateMA(longWindow);

        if (previousShortMA != null && previousLongMA != null) {
            boolean wasBelowLong = previousShortMA.compareTo(previousLongMA) < 0;
            boolean isAboveLong = shortMA.compareTo(longMA) > 0;
            boolean wasAboveLong = previousShortMA.compareTo(previousLongMA) > 0;
            boolean isBelowLong = shortMA.compareTo(longMA) < 0;

            // Golden cross - buy signal
            if (wasBelowLong && isAboveLong) {
                BigDecimal qty = portfolio.affordableQuantity(closePrice, allocPct);
                if (qty.signum() > 0) {
                    portfolio.buy(bar.getTimestamp(), qty, closePrice, "MA golden cross");
                    log.debug("MA Crossover: BUY {} at {} on {} (Short MA: {}, Long MA: {})",
                            qty, closePrice, bar.getTimestamp(), shortMA, longMA);
                }
            }
            // Death cross - sell signal
            else if (wasAboveLong && isBelowLong) {
                BigDecimal held = portfolio.getPosition();
                if (held.signum() > 0) {
                    portfolio.sell(bar.getTimestamp(), held, closePrice, "MA death cross");
                    log.debug("MA Crossover: SELL {} at {} on {} (Short MA: {}, Long MA: {})",
                            held, closePrice, bar.getTimestamp(), shortMA, longMA);
                }
            }
        }

        previousShortMA = shortMA;
        previousLongMA = longMA;
    }

    @Override
    public Optional<FinishHook> finishHook() {
        return Optional.of(this::liquidate);
    }

    private void liquidate(Portfolio portfolio) {
        if (lastBar != null && portfolio.getPosition().signum() > 0) {
            portfolio.sell(lastBar.getTimestamp(), portfolio.getPosition(), lastBar.getClose(), "Close on finish");
        }
        log.debug("MA Crossover strategy completed. Final position: {}, Final cash: {}",
                portfolio.getPosition(), portfolio.getCash());
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + shortPeriod + "," + longPeriod + ")";
    }

    private BigDecimal calculateMA(Queue<BigDecimal> window) {
        BigDecimal sum = window.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(window.size()), 8, RoundingMode.HALF_UP);
    }
}
