package com.quantbacktest.replay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.replay.domain.BuyAndHoldStrategy;
import com.quantbacktest.replay.domain.BuySecondBarStrategy;
import com.quantbacktest.replay.domain.MovingAverageCrossoverStrategy;
import com.quantbacktest.replay.domain.Strategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Factory for creating strategy instances based on name and parameters.
 */
@Service
@Slf4j
public class StrategyFactory {

    static final int DEFAULT_SHORT_PERIOD = 10;
    static final int DEFAULT_LONG_PERIOD = 50;

    /**
     * Create a strategy instance from its name and optional JSON parameters.
     *
     * @param allocPct fraction of cash each entry spends
     * @throws IllegalArgumentException if the parameters are invalid for the chosen strategy
     */
    public Strategy createStrategy(String strategyName, JsonNode parameters, BigDecimal allocPct) {
        log.info("Creating strategy: {} with parameters: {} alloc={}", strategyName, parameters, allocPct);

        String name = strategyName == null ? "" : strategyName.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "buysecondbar", "buy_second_bar" -> new BuySecondBarStrategy(allocPct);

            case "buyandhold", "buy_and_hold" -> new BuyAndHoldStrategy(allocPct);

            case "movingaveragecrossover", "ma_crossover" -> {
                int shortPeriod = intParam(parameters, "shortPeriod", DEFAULT_SHORT_PERIOD);
                int longPeriod = intParam(parameters, "longPeriod", DEFAULT_LONG_PERIOD);
                yield new MovingAverageCrossoverStrategy(shortPeriod, longPeriod, allocPct);
            }

            default -> {
                log.warn("Unknown strategy: {}, defaulting to BuySecondBar", strategyName);
                yield new BuySecondBarStrategy(allocPct);
            }
        };
    }

    private static int intParam(JsonNode parameters, String field, int defaultValue) {
        if (parameters == null || !parameters.hasNonNull(field)) {
            return defaultValue;
        }
        JsonNode value = parameters.get(field);
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer, got " + value);
        }
        return value.asInt();
    }
}
