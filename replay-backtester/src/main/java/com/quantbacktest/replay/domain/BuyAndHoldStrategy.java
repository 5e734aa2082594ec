package com.quantbacktest.replay.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Simple buy-and-hold strategy.
 * Commits {@code allocPct} of cash on the first bar it can fill and holds until the end.
 */
@Slf4j
public class BuyAndHoldStrategy implements Strategy {

    private final BigDecimal allocPct;

    private boolean hasBought = false;

    public BuyAndHoldStrategy(BigDecimal allocPct) {
        this.allocPct = allocPct;
    }

    @Override
    public void onBar(Bar bar, Portfolio portfolio) {
        if (!hasBought && portfolio.getCash().signum() > 0) {
            BigDecimal qty = portfolio.affordableQuantity(bar.getClose(), allocPct);

            if (qty.signum() > 0 && portfolio.buy(bar.getTimestamp(), qty, bar.getClose(), "Buy and hold entry").isPresent()) {
                hasBought = true;
                log.debug("Buy and Hold: Bought {} at {} on {}",
                        portfolio.getPosition(), bar.getClose(), bar.getTimestamp());
            }
        }
    }

    @Override
    public Optional<FinishHook> finishHook() {
        return Optional.of(portfolio -> log.debug("Buy and Hold strategy completed. Final position: {}, Final cash: {}",
                portfolio.getPosition(), portfolio.getCash()));
    }

    @Override
    public String getName() {
        return "BuyAndHold";
    }
}
