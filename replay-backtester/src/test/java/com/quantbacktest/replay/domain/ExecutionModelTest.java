package com.quantbacktest.replay.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExecutionModel previews.
 */
class ExecutionModelTest {

    private static final BigDecimal PLENTY_OF_CASH = new BigDecimal("1000000");

    private static SymbolRules rules(String tick, String step, String minNotional) {
        return SymbolRules.builder()
                .symbol("BTCUSDT")
                .tickSize(new BigDecimal(tick))
                .stepSize(new BigDecimal(step))
                .minNotional(minNotional != null ? new BigDecimal(minNotional) : null)
                .build();
    }

    @Test
    void testPreview_RejectsNonPositiveInputs() {
        ExecutionModel model = new ExecutionModel(BigDecimal.ZERO, BigDecimal.ZERO, Optional.empty());

        ExecutionPreview zeroQty = model.preview(TradeSide.BUY, new BigDecimal("100"), BigDecimal.ZERO, PLENTY_OF_CASH);
        ExecutionPreview negativePrice = model.preview(TradeSide.SELL, new BigDecimal("-1"), BigDecimal.ONE, PLENTY_OF_CASH);

        assertFalse(zeroQty.isAccepted());
        assertEquals(RejectionReason.INVALID_INPUT, zeroQty.getRejectionReason());
        assertFalse(negativePrice.isAccepted());
        assertEquals(RejectionReason.INVALID_INPUT, negativePrice.getRejectionReason());
    }

    @Test
    void testPreview_SlippageIsAdverseOnBothSides() {
        ExecutionModel model = new ExecutionModel(BigDecimal.ZERO, new BigDecimal("5"), Optional.empty());

        ExecutionPreview buy = model.preview(TradeSide.BUY, new BigDecimal("100"), BigDecimal.ONE, PLENTY_OF_CASH);
        ExecutionPreview sell = model.preview(TradeSide.SELL, new BigDecimal("100"), BigDecimal.ONE, PLENTY_OF_CASH);

        assertTrue(buy.isAccepted());
        assertEquals(0, new BigDecimal("100.05").compareTo(buy.getExecPrice()));
        assertEquals(0, new BigDecimal("99.95").compareTo(sell.getExecPrice()));
        assertEquals(0, new BigDecimal("100").compareTo(buy.getIntendedPrice()));
    }

    @Test
    void testPreview_RoundsPriceAndQuantityWithRules() {
        ExecutionModel model = new ExecutionModel(BigDecimal.ZERO, new BigDecimal("5"),
                Optional.of(rules("0.01", "0.001", null)));

        ExecutionPreview preview = model.preview(TradeSide.BUY, new BigDecimal("100.013"),
                new BigDecimal("0.0014"), PLENTY_OF_CASH);

        // 100.013 * 1.0005 = 100.0630065 -> 100.06
        assertTrue(preview.isAccepted());
        assertEquals(0, new BigDecimal("100.0630065").compareTo(preview.getExecPriceRaw()));
        assertEquals(0, new BigDecimal("100.06").compareTo(preview.getExecPrice()));
        assertEquals(0, new BigDecimal("0.0030065").compareTo(preview.getPriceRoundDiff()));
        assertEquals(0, new BigDecimal("0.001").compareTo(preview.getQtyRounded()));
        assertEquals(0, new BigDecimal("0.0004").compareTo(preview.getQtyRoundDiff()));
        assertEquals(0, new BigDecimal("0.10006").compareTo(preview.getNotionalAfterRound()));
    }

    @Test
    void testPreview_QuantityBelowStepIsRejected() {
        ExecutionModel model = new ExecutionModel(BigDecimal.ZERO, BigDecimal.ZERO,
                Optional.of(rules("0.01", "0.001", null)));

        ExecutionPreview preview = model.preview(TradeSide.BUY, new BigDecimal("100"),
                new BigDecimal("0.0009"), PLENTY_OF_CASH);

        assertFalse(preview.isAccepted());
        assertEquals(RejectionReason.ZERO_QUANTITY_AFTER_ROUNDING, preview.getRejectionReason());
        assertEquals(0, preview.getQtyRounded().signum());
    }

    @Test
    void testPreview_MinNotionalRejectsAfterRounding() {
        ExecutionModel model = new ExecutionModel(BigDecimal.ZERO, BigDecimal.ZERO,
                Optional.of(rules("0.001", "0.001", "10")));

        ExecutionPreview preview = model.preview(TradeSide.BUY, new BigDecimal("9.999"), BigDecimal.ONE, PLENTY_OF_CASH);

        assertFalse(preview.isAccepted());
        assertEquals(RejectionReason.EXCHANGE_RULES, preview.getRejectionReason());
        assertEquals(0, new BigDecimal("9.999").compareTo(preview.getNotionalAfterRound()));
    }

    @Test
    void testPreview_BuyRequiresCashForNotionalPlusFee() {
        ExecutionModel model = new ExecutionModel(new BigDecimal("10"), BigDecimal.ZERO, Optional.empty());

        // 100 * 10 * 1.001 = 1001
        ExecutionPreview shortByOne = model.preview(TradeSide.BUY, new BigDecimal("100"), BigDecimal.TEN, new BigDecimal("1000"));
        ExecutionPreview exact = model.preview(TradeSide.BUY, new BigDecimal("100"), BigDecimal.TEN, new BigDecimal("1001"));

        assertFalse(shortByOne.isAccepted());
        assertEquals(RejectionReason.INSUFFICIENT_CASH, shortByOne.getRejectionReason());
        assertTrue(exact.isAccepted(), "Spending exactly the available cash is allowed");
    }

    @Test
    void testPreview_SellIgnoresCash() {
        ExecutionModel model = new ExecutionModel(new BigDecimal("10"), BigDecimal.ZERO, Optional.empty());

        ExecutionPreview preview = model.preview(TradeSide.SELL, new BigDecimal("100"), BigDecimal.TEN, BigDecimal.ZERO);

        assertTrue(preview.isAccepted());
    }

    @Test
    void testFee_IsExactBasisPoints() {
        ExecutionModel model = new ExecutionModel(new BigDecimal("7.5"), BigDecimal.ZERO, Optional.empty());

        assertEquals(0, new BigDecimal("0.75").compareTo(model.fee(new BigDecimal("1000"))));
    }
}
