package com.quantbacktest.replay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.replay.domain.SymbolRules;

import java.math.BigDecimal;

/**
 * Extracts {@link SymbolRules} from a Binance {@code exchangeInfo} response.
 * <p>
 * PRICE_FILTER gives the tick size, LOT_SIZE the step size and quantity bounds and
 * NOTIONAL / MIN_NOTIONAL the minimum notional. MARKET_LOT_SIZE is only consulted for
 * values LOT_SIZE does not provide, since Binance often reports a zero step there.
 */
final class ExchangeInfoParser {

    private ExchangeInfoParser() {
    }

    /**
     * @throws IllegalArgumentException if the symbol is missing or has no tick or step size
     */
    static SymbolRules parse(String symbol, JsonNode exchangeInfo) {
        JsonNode symbolInfo = null;
        if (exchangeInfo != null) {
            for (JsonNode candidate : exchangeInfo.path("symbols")) {
                if (symbol.equals(candidate.path("symbol").asText())) {
                    symbolInfo = candidate;
                    break;
                }
            }
        }
        if (symbolInfo == null) {
            throw new IllegalArgumentException("Symbol " + symbol + " not found in exchangeInfo");
        }

        BigDecimal tickSize = null;
        BigDecimal stepSize = null;
        BigDecimal minQty = null;
        BigDecimal maxQty = null;
        BigDecimal minNotional = null;
        JsonNode marketLotSize = null;

        for (JsonNode filter : symbolInfo.path("filters")) {
            switch (filter.path("filterType").asText()) {
                case "PRICE_FILTER" -> tickSize = decimal(filter, "tickSize");
                case "LOT_SIZE" -> {
                    stepSize = decimal(filter, "stepSize");
                    minQty = decimal(filter, "minQty");
                    maxQty = decimal(filter, "maxQty");
                }
                case "MARKET_LOT_SIZE" -> marketLotSize = filter;
                case "NOTIONAL", "MIN_NOTIONAL" -> {
                    BigDecimal value = decimal(filter, "minNotional");
                    if (value != null) {
                        minNotional = value;
                    }
                }
                default -> {
                }
            }
        }

        if (marketLotSize != null) {
            if (stepSize == null || stepSize.signum() <= 0) {
                stepSize = decimal(marketLotSize, "stepSize");
            }
            if (minQty == null) {
                minQty = decimal(marketLotSize, "minQty");
            }
            if (maxQty == null) {
                maxQty = decimal(marketLotSize, "maxQty");
            }
        }

        if (tickSize == null || stepSize == null) {
            throw new IllegalArgumentException("Missing PRICE_FILTER/LOT_SIZE for " + symbol
                    + ": tickSize=" + tickSize + ", stepSize=" + stepSize);
        }

        return SymbolRules.builder()
                .symbol(symbol)
                .tickSize(tickSize)
                .stepSize(stepSize)
                .minQty(minQty)
                .maxQty(maxQty)
                .minNotional(minNotional)
                .build();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return new BigDecimal(value.asText()).stripTrailingZeros();
    }
}
