package com.quantbacktest.replay.domain;

import java.util.Optional;

/**
 * Strategy interface for implementing trading strategies.
 * Strategies receive bars in chronological order and trade through the portfolio.
 */
public interface Strategy {

    /**
     * Called for each bar, after the portfolio has been marked to the bar's close.
     *
     * @param bar       the current bar
     * @param portfolio the portfolio of this run
     */
    void onBar(Bar bar, Portfolio portfolio);

    /**
     * Hook run once after the last bar, e.g. to liquidate an open position.
     * The engine asks for it once per run, before the first bar.
     */
    default Optional<FinishHook> finishHook() {
        return Optional.empty();
    }

    /**
     * Get the strategy name.
     */
    String getName();
}
