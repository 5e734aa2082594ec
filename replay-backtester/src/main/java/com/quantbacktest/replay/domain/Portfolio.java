package com.quantbacktest.replay.domain;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cash, position and PnL of one backtest run, plus its trade ledger and equity curve.
 * The only component allowed to change that state; every order goes through the
 * {@link ExecutionModel} and only accepted previews touch the books.
 * <p>
 * Realized PnL uses average-cost accounting: a sell realizes
 * {@code (price - averageCost) * qty} against the running average, not against lots.
 */
@Slf4j
@Getter
public class Portfolio {

    static final BigDecimal POSITION_TOLERANCE = new BigDecimal("1e-12");
    static final MathContext DIVISION_CONTEXT = MathContext.DECIMAL128;
    private static final MathContext SIZING_CONTEXT = new MathContext(34, RoundingMode.DOWN);

    private final String symbol;
    private final BigDecimal startingCash;
    private final ExecutionSettings settings;
    private final String runId;

    @Getter(AccessLevel.NONE)
    private final ExecutionModel executionModel;

    private BigDecimal cash;
    private BigDecimal position = BigDecimal.ZERO;
    private BigDecimal averageCost = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal lastPrice;

    @Getter(AccessLevel.NONE)
    private final List<Trade> trades = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<RejectionReason, Integer> rejectionCounts = new EnumMap<>(RejectionReason.class);

    @Builder
    public Portfolio(String symbol, BigDecimal cash, ExecutionSettings settings, SymbolRules rules, String runId) {
        if (cash == null || cash.signum() < 0) {
            throw new IllegalArgumentException("Starting cash must be non-negative");
        }
        this.symbol = symbol;
        this.cash = cash;
        this.startingCash = cash;
        this.settings = settings != null ? settings : ExecutionSettings.builder().build();
        this.runId = runId;
        this.executionModel = new ExecutionModel(
                this.settings.getFeeBps(), this.settings.getSlippageBps(), Optional.ofNullable(rules));
    }

    public Optional<SymbolRules> getRules() {
        return executionModel.getRules();
    }

    /**
     * Record the latest observed price. Cash and position are untouched.
     */
    public void markToMarket(BigDecimal price) {
        this.lastPrice = price;
    }

    /**
     * Cash plus the position valued at the last marked price, or cash alone when nothing was marked yet.
     */
    public BigDecimal equity() {
        return equity(null);
    }

    public BigDecimal equity(BigDecimal price) {
        BigDecimal p = price != null ? price : lastPrice;
        if (p == null) {
            return cash;
        }
        return cash.add(position.multiply(p));
    }

    public BigDecimal pnlTotal() {
        return equity().subtract(startingCash);
    }

    /**
     * Buy at the reference price through the execution model.
     * A rejected order is logged and counted, never thrown.
     *
     * @return the recorded trade, or empty when the execution model rejected the order
     */
    public Optional<Trade> buy(Instant timestamp, BigDecimal quantity, BigDecimal referencePrice, String note) {
        checkChronology(timestamp);

        ExecutionPreview preview = executionModel.preview(TradeSide.BUY, referencePrice, quantity, cash);
        if (!preview.isAccepted()) {
            reject(preview);
            return Optional.empty();
        }

        BigDecimal price = preview.getExecPrice();
        BigDecimal qty = preview.getQtyRounded();
        BigDecimal notional = price.multiply(qty);
        BigDecimal fee = executionModel.fee(notional);

        cash = cash.subtract(notional.add(fee));
        BigDecimal newPosition = position.add(qty);
        if (position.signum() <= 0) {
            averageCost = price;
        } else {
            averageCost = averageCost.multiply(position).add(price.multiply(qty))
                    .divide(newPosition, DIVISION_CONTEXT);
        }
        position = newPosition;
        lastPrice = price;

        return Optional.of(record(timestamp, TradeSide.BUY, preview, qty, price, fee, BigDecimal.ZERO, note));
    }

    /**
     * Sell at the reference price through the execution model.
     *
     * @throws InsufficientPositionException if the requested quantity exceeds the held position
     */
    public Optional<Trade> sell(Instant timestamp, BigDecimal quantity, BigDecimal referencePrice, String note) {
        if (quantity != null && quantity.compareTo(position.add(POSITION_TOLERANCE)) > 0) {
            throw new InsufficientPositionException(quantity, position);
        }
        checkChronology(timestamp);

        ExecutionPreview preview = executionModel.preview(TradeSide.SELL, referencePrice, quantity, cash);
        if (!preview.isAccepted()) {
            reject(preview);
            return Optional.empty();
        }

        BigDecimal price = preview.getExecPrice();
        BigDecimal qty = preview.getQtyRounded().min(position);
        BigDecimal notional = price.multiply(qty);
        BigDecimal fee = executionModel.fee(notional);

        BigDecimal realized = price.subtract(averageCost).multiply(qty);
        if (settings.isRealizedPnlNetFees()) {
            realized = realized.subtract(fee);
        }
        realizedPnl = realizedPnl.add(realized);
        cash = cash.add(notional.subtract(fee));

        position = position.subtract(qty);
        if (position.compareTo(POSITION_TOLERANCE) <= 0) {
            position = BigDecimal.ZERO;
            averageCost = BigDecimal.ZERO;
        }
        lastPrice = price;

        return Optional.of(record(timestamp, TradeSide.SELL, preview, qty, price, fee, realized, note));
    }

    /**
     * Raw quantity that spends {@code allocationFraction} of cash at {@code price}, fees included.
     * Step size is not applied here; the execution model rounds it when the order is placed.
     */
    public BigDecimal affordableQuantity(BigDecimal price, BigDecimal allocationFraction) {
        if (price == null || allocationFraction == null || price.signum() <= 0 || allocationFraction.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal feeMultiplier = BigDecimal.ONE.add(ExecutionModel.fraction(settings.getFeeBps()));
        BigDecimal budget = cash.multiply(allocationFraction);
        BigDecimal qty = budget.divide(price.multiply(feeMultiplier), SIZING_CONTEXT);
        return qty.signum() > 0 ? qty : BigDecimal.ZERO;
    }

    public BigDecimal affordableQuantity(BigDecimal price) {
        return affordableQuantity(price, settings.getAllocPct());
    }

    public PortfolioSummary summary() {
        return PortfolioSummary.builder()
                .startingCash(startingCash)
                .cash(cash)
                .position(position)
                .lastPrice(lastPrice)
                .equity(equity())
                .realizedPnl(realizedPnl)
                .totalPnl(pnlTotal())
                .averageCost(averageCost)
                .tradeCount(trades.size())
                .build();
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    public Map<RejectionReason, Integer> getRejectionCounts() {
        return Collections.unmodifiableMap(rejectionCounts);
    }

    public int getRejectedOrderCount() {
        return rejectionCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    void recordEquitySample(Instant timestamp) {
        equityCurve.add(new EquityPoint(timestamp, equity()));
    }

    private void checkChronology(Instant timestamp) {
        if (!trades.isEmpty() && timestamp.isBefore(trades.get(trades.size() - 1).getTimestamp())) {
            throw new IllegalArgumentException("Trade at " + timestamp
                    + " precedes the last recorded trade at " + trades.get(trades.size() - 1).getTimestamp());
        }
    }

    private void reject(ExecutionPreview preview) {
        rejectionCounts.merge(preview.getRejectionReason(), 1, Integer::sum);
        log.info("[{} skipped] {} | qty_raw={} ref={}", preview.getSide(),
                preview.getRejectionReason().getDescription(),
                preview.getQtyRaw().toPlainString(), preview.getIntendedPrice().toPlainString());
    }

    private Trade record(Instant timestamp, TradeSide side, ExecutionPreview preview, BigDecimal qty,
                         BigDecimal price, BigDecimal fee, BigDecimal realized, String note) {
        BigDecimal notionalAfterRound = preview.getNotionalAfterRound();
        BigDecimal feeBpsRealized = notionalAfterRound.signum() > 0
                ? fee.divide(notionalAfterRound, DIVISION_CONTEXT).movePointRight(4)
                : BigDecimal.ZERO;

        SymbolRules rules = executionModel.getRules().orElse(null);
        TradeAudit audit = TradeAudit.builder()
                .intendedPrice(preview.getIntendedPrice())
                .execPriceRaw(preview.getExecPriceRaw())
                .priceRoundDiff(preview.getPriceRoundDiff())
                .qtyRaw(preview.getQtyRaw())
                .qtyRounded(preview.getQtyRounded())
                .qtyRoundDiff(preview.getQtyRoundDiff())
                .slippageBps(preview.getSlippageBps())
                .notionalBeforeRound(preview.getNotionalBeforeRound())
                .notionalAfterRound(notionalAfterRound)
                .ruleCheck(TradeLedgerSchema.RULE_CHECK_OK)
                .runId(runId)
                .feeBps(feeBpsRealized)
                .schemaVersion(TradeLedgerSchema.SCHEMA_VERSION)
                .tickSizeUsed(rules != null ? rules.getTickSize() : null)
                .stepSizeUsed(rules != null ? rules.getStepSize() : null)
                .minNotionalUsed(rules != null ? rules.getMinNotional() : null)
                .build();

        Trade trade = Trade.builder()
                .timestamp(timestamp)
                .symbol(symbol)
                .side(side)
                .quantity(qty)
                .price(price)
                .fee(fee)
                .cashAfter(cash)
                .positionAfter(position)
                .equityAfter(equity(price))
                .realizedPnl(realized)
                .cumulativeRealizedPnl(realizedPnl)
                .note(note != null ? note : "")
                .audit(audit)
                .build();
        trades.add(trade);

        log.debug("{} {} {} @ {} fee={} cash={} position={}", side, qty.toPlainString(), symbol,
                price.toPlainString(), fee.toPlainString(), cash.toPlainString(), position.toPlainString());
        return trade;
    }
}
