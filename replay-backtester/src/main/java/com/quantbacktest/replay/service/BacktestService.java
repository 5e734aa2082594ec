package com.quantbacktest.replay.service;

import com.quantbacktest.replay.controller.dto.BacktestRequest;
import com.quantbacktest.replay.controller.dto.BacktestResponse;

/**
 * Service interface for backtest runs.
 */
public interface BacktestService {

    /**
     * Run a backtest synchronously and write its reports.
     *
     * @param request the backtest request
     * @return the run result with its run id, trades, metrics and rejection counts
     */
    BacktestResponse runBacktest(BacktestRequest request);
}
