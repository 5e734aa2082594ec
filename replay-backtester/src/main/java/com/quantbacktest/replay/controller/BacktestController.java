package com.quantbacktest.replay.controller;

import com.quantbacktest.replay.controller.dto.BacktestRequest;
import com.quantbacktest.replay.controller.dto.BacktestResponse;
import com.quantbacktest.replay.domain.SymbolRules;
import com.quantbacktest.replay.service.BacktestService;
import com.quantbacktest.replay.service.SymbolRulesService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for backtest runs.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;
    private final SymbolRulesService symbolRulesService;

    /**
     * Run a backtest synchronously.
     *
     * @param request the backtest request
     * @return the run result with trades, metrics and rejection counts
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {

        log.info("POST /backtests - Strategy: {}, Symbol: {}",
                request.getStrategyName(), request.getSymbol());

        BacktestResponse response = backtestService.runBacktest(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Resolve the exchange rules for a symbol (cache first, unless refresh is configured).
     */
    @GetMapping("/rules/{symbol}")
    public ResponseEntity<SymbolRules> getRules(@PathVariable String symbol) {

        log.info("GET /backtests/rules/{}", symbol);

        return ResponseEntity.ok(symbolRulesService.loadRules(symbol));
    }
}
