package com.quantbacktest.replay.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Demonstration strategy that exercises the whole execution path.
 * Buys {@code allocPct} of cash at the second bar's close and closes the
 * position at the last close once the replay is over.
 */
@Slf4j
public class BuySecondBarStrategy implements Strategy {

    private final BigDecimal allocPct;

    private int barCounter = 0;
    private Bar lastBar;

    public BuySecondBarStrategy(BigDecimal allocPct) {
        if (allocPct == null || allocPct.signum() <= 0 || allocPct.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Allocation must be in (0, 1]");
        }
        this.allocPct = allocPct;
    }

    @Override
    public void onBar(Bar bar, Portfolio portfolio) {
        barCounter++;
        lastBar = bar;

        if (barCounter == 2) {
            BigDecimal qty = portfolio.affordableQuantity(bar.getClose(), allocPct);
            if (qty.signum() > 0) {
                portfolio.buy(bar.getTimestamp(), qty, bar.getClose(), "Second bar buy (alloc %)");
            }
        }
    }

    @Override
    public Optional<FinishHook> finishHook() {
        return Optional.of(this::closeOpenPosition);
    }

    private void closeOpenPosition(Portfolio portfolio) {
        if (lastBar != null && portfolio.getPosition().signum() > 0) {
            log.debug("Closing {} {} at {}", portfolio.getPosition(), lastBar.getSymbol(), lastBar.getClose());
            portfolio.sell(lastBar.getTimestamp(), portfolio.getPosition(), lastBar.getClose(), "Close on finish");
        }
    }

    @Override
    public String getName() {
        return "BuySecondBar";
    }
}
