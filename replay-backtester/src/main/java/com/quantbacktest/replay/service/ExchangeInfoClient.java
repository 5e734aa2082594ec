package com.quantbacktest.replay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.replay.domain.SymbolRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Fetches trading rules for a symbol from the exchange's public {@code exchangeInfo} endpoint.
 */
@Component
@Slf4j
public class ExchangeInfoClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ExchangeInfoClient(RestTemplate restTemplate,
                              @Value("${backtest.exchange.base-url:https://testnet.binance.vision}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    public SymbolRules fetchSymbolRules(String symbol) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/api/v3/exchangeInfo")
                .queryParam("symbol", symbol)
                .toUriString();

        log.info("Fetching exchange rules for {} from {}", symbol, url);
        JsonNode response = restTemplate.getForObject(url, JsonNode.class);
        return ExchangeInfoParser.parse(symbol, response);
    }
}
