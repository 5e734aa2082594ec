package com.quantbacktest.replay.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Trading constraints for one symbol (tick size, step size, quantity and notional limits).
 * Read-only for the lifetime of a backtest run.
 * <p>
 * Decimal fields are serialized as strings so the rules cache never loses precision.
 */
@Value
@Builder
@JsonDeserialize(builder = SymbolRules.SymbolRulesBuilder.class)
public class SymbolRules {

    String symbol;

    @JsonSerialize(using = ToStringSerializer.class)
    BigDecimal tickSize;

    @JsonSerialize(using = ToStringSerializer.class)
    BigDecimal stepSize;

    @JsonSerialize(using = ToStringSerializer.class)
    BigDecimal minQty;

    @JsonSerialize(using = ToStringSerializer.class)
    BigDecimal maxQty;

    @JsonSerialize(using = ToStringSerializer.class)
    BigDecimal minNotional;

    public BigDecimal roundPrice(BigDecimal price) {
        return ExchangeRules.roundPrice(price, tickSize);
    }

    public BigDecimal roundQuantity(BigDecimal quantity) {
        return ExchangeRules.roundQuantity(quantity, stepSize);
    }

    public boolean isValid(BigDecimal price, BigDecimal quantity) {
        return ExchangeRules.isValid(price, quantity, minNotional, minQty);
    }

    /**
     * Floor price to the tick and quantity to the step, then validate the result.
     */
    public RoundedOrder apply(BigDecimal price, BigDecimal quantity) {
        BigDecimal roundedPrice = roundPrice(price);
        BigDecimal roundedQuantity = roundQuantity(quantity);
        return new RoundedOrder(roundedPrice, roundedQuantity, isValid(roundedPrice, roundedQuantity));
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class SymbolRulesBuilder {
    }

    /**
     * Result of applying the rules to a (price, quantity) pair.
     */
    @Value
    public static class RoundedOrder {
        BigDecimal price;
        BigDecimal quantity;
        boolean valid;
    }
}
