package com.quantbacktest.replay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.replay.domain.SymbolRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves exchange rules for a symbol, reading {@code <rulesDir>/<SYMBOL>_rules.json}
 * when allowed and otherwise fetching them and rewriting the cache.
 */
@Service
@Slf4j
public class SymbolRulesService {

    private final ExchangeInfoClient exchangeInfoClient;
    private final ObjectMapper objectMapper;
    private final Path rulesDir;
    private final boolean useCache;
    private final boolean refresh;

    public SymbolRulesService(ExchangeInfoClient exchangeInfoClient,
                              ObjectMapper objectMapper,
                              @Value("${backtest.rules.dir:rules}") String rulesDir,
                              @Value("${backtest.rules.use-cache:true}") boolean useCache,
                              @Value("${backtest.rules.refresh:false}") boolean refresh) {
        this.exchangeInfoClient = exchangeInfoClient;
        this.objectMapper = objectMapper;
        this.rulesDir = Paths.get(rulesDir);
        this.useCache = useCache;
        this.refresh = refresh;
    }

    public SymbolRules loadRules(String symbol) {
        Path cachePath = cachePath(symbol);

        if (useCache && !refresh && Files.isRegularFile(cachePath)) {
            log.debug("Reading cached rules for {} from {}", symbol, cachePath);
            try {
                return objectMapper.readValue(cachePath.toFile(), SymbolRules.class);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read rules cache " + cachePath, e);
            }
        }

        SymbolRules rules = exchangeInfoClient.fetchSymbolRules(symbol);
        try {
            Files.createDirectories(rulesDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(cachePath.toFile(), rules);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write rules cache " + cachePath, e);
        }
        log.info("Cached rules for {}: tick={} step={} minQty={} minNotional={}", symbol,
                rules.getTickSize(), rules.getStepSize(), rules.getMinQty(), rules.getMinNotional());
        return rules;
    }

    Path cachePath(String symbol) {
        return rulesDir.resolve(symbol + "_rules.json");
    }
}
