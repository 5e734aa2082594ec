package com.quantbacktest.replay.domain;

import java.util.List;
import java.util.stream.Stream;

/**
 * Column contract of the exported trade ledger. Bump {@link #SCHEMA_VERSION}
 * whenever a column is added, renamed or removed.
 */
public final class TradeLedgerSchema {

    public static final int SCHEMA_VERSION = 1;

    public static final String RULE_CHECK_OK = "OK";

    public static final List<String> BASE_COLUMNS = List.of(
            "ts", "symbol", "side", "qty", "price", "fee",
            "cash_after", "qty_after", "equity_after",
            "realized_pnl", "cum_realized_pnl", "note");

    public static final List<String> AUDIT_COLUMNS = List.of(
            "intended_price", "exec_price_raw", "price_round_diff",
            "qty_raw", "qty_rounded", "qty_round_diff", "slippage_bps",
            "notional_before_round", "notional_after_round", "rule_check",
            "run_id", "fee_bps", "schema_version",
            "tickSize_used", "stepSize_used", "minNotional_used");

    public static final List<String> EQUITY_CURVE_COLUMNS = List.of("ts", "equity");

    private TradeLedgerSchema() {
    }

    public static List<String> allColumns() {
        return Stream.concat(BASE_COLUMNS.stream(), AUDIT_COLUMNS.stream()).toList();
    }
}
