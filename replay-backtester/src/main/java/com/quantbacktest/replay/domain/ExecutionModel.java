package com.quantbacktest.replay.domain;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Turns an order intent into an accepted or rejected {@link ExecutionPreview}:
 * slippage first, then exchange rounding, then cash and exchange-rule checks.
 * Has no side effects; the portfolio decides what to do with the preview.
 * <p>
 * Slippage is a constant basis-point shift regardless of order size.
 */
public class ExecutionModel {

    private final BigDecimal feeBps;
    private final BigDecimal slippageBps;
    private final SymbolRules rules;

    public ExecutionModel(BigDecimal feeBps, BigDecimal slippageBps, Optional<SymbolRules> rules) {
        this.feeBps = feeBps;
        this.slippageBps = slippageBps;
        this.rules = rules.orElse(null);
    }

    public ExecutionPreview preview(TradeSide side, BigDecimal referencePrice,
                                    BigDecimal requestedQuantity, BigDecimal availableCash) {
        if (requestedQuantity == null || referencePrice == null
                || requestedQuantity.signum() <= 0 || referencePrice.signum() <= 0) {
            BigDecimal price = referencePrice != null ? referencePrice : BigDecimal.ZERO;
            BigDecimal qty = requestedQuantity != null ? requestedQuantity : BigDecimal.ZERO;
            return ExecutionPreview.builder()
                    .accepted(false)
                    .rejectionReason(RejectionReason.INVALID_INPUT)
                    .side(side)
                    .intendedPrice(price)
                    .execPriceRaw(price)
                    .execPrice(price)
                    .qtyRaw(qty)
                    .qtyRounded(BigDecimal.ZERO)
                    .slippageBps(slippageBps)
                    .notionalBeforeRound(BigDecimal.ZERO)
                    .notionalAfterRound(BigDecimal.ZERO)
                    .build();
        }

        BigDecimal slip = fraction(slippageBps);
        BigDecimal execPriceRaw = side == TradeSide.BUY
                ? referencePrice.multiply(BigDecimal.ONE.add(slip))
                : referencePrice.multiply(BigDecimal.ONE.subtract(slip));

        BigDecimal execPrice = execPriceRaw;
        BigDecimal qtyRounded = requestedQuantity;
        boolean rulesSatisfied = true;
        if (rules != null) {
            SymbolRules.RoundedOrder rounded = rules.apply(execPriceRaw, requestedQuantity);
            execPrice = rounded.getPrice();
            qtyRounded = rounded.getQuantity();
            rulesSatisfied = rounded.isValid();
        }

        ExecutionPreview.ExecutionPreviewBuilder preview = ExecutionPreview.builder()
                .side(side)
                .intendedPrice(referencePrice)
                .execPriceRaw(execPriceRaw)
                .execPrice(execPrice)
                .qtyRaw(requestedQuantity)
                .qtyRounded(qtyRounded)
                .slippageBps(slippageBps)
                .notionalBeforeRound(execPriceRaw.multiply(requestedQuantity))
                .notionalAfterRound(execPrice.multiply(qtyRounded));

        if (qtyRounded.signum() <= 0) {
            return preview.accepted(false).rejectionReason(RejectionReason.ZERO_QUANTITY_AFTER_ROUNDING).build();
        }

        if (side == TradeSide.BUY) {
            BigDecimal required = execPrice.multiply(qtyRounded).multiply(BigDecimal.ONE.add(fraction(feeBps)));
            if (required.compareTo(availableCash) > 0) {
                return preview.accepted(false).rejectionReason(RejectionReason.INSUFFICIENT_CASH).build();
            }
        }

        if (!rulesSatisfied) {
            return preview.accepted(false).rejectionReason(RejectionReason.EXCHANGE_RULES).build();
        }

        return preview.accepted(true).build();
    }

    public BigDecimal fee(BigDecimal notional) {
        return notional.multiply(fraction(feeBps));
    }

    public Optional<SymbolRules> getRules() {
        return Optional.ofNullable(rules);
    }

    static BigDecimal fraction(BigDecimal bps) {
        return bps.movePointLeft(4);
    }
}
