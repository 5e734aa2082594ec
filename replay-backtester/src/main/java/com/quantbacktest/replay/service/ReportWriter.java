package com.quantbacktest.replay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.replay.domain.EquityPoint;
import com.quantbacktest.replay.domain.MetricsSummary;
import com.quantbacktest.replay.domain.PortfolioSummary;
import com.quantbacktest.replay.domain.RejectionReason;
import com.quantbacktest.replay.domain.Trade;
import com.quantbacktest.replay.domain.TradeAudit;
import com.quantbacktest.replay.domain.TradeLedgerSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes the artifacts of one run into {@code <reportsDir>/<SYMBOL>_<Strategy>_<yyyy-MM-dd>_runNN}:
 * the trade ledger, the equity curve and a JSON summary.
 */
@Service
@Slf4j
public class ReportWriter {

    static final String TRADES_FILE = "trades.csv";
    static final String EQUITY_CURVE_FILE = "equity_curve.csv";
    static final String SUMMARY_FILE = "summary.json";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path reportsDir;

    public ReportWriter(ObjectMapper objectMapper, Clock clock,
                        @Value("${backtest.reports-dir:reports}") String reportsDir) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.reportsDir = Paths.get(reportsDir);
    }

    /**
     * Create the next free run directory for the symbol and strategy (UTC date, run numbers never reused).
     */
    public Path createRunDirectory(String symbol, String strategyName) {
        String safeStrategy = strategyName.replaceAll("[^A-Za-z0-9_-]", "");
        String prefix = symbol + "_" + safeStrategy + "_" + LocalDate.now(clock) + "_run";

        try {
            Files.createDirectories(reportsDir);
            int next = nextRunNumber(prefix);
            Path runDir = reportsDir.resolve(prefix + String.format("%02d", next));
            Files.createDirectories(runDir);
            return runDir;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create report directory under " + reportsDir, e);
        }
    }

    public void writeReport(Path runDir, List<Trade> trades, List<EquityPoint> equityCurve, RunSummary summary) {
        writeTrades(runDir.resolve(TRADES_FILE), trades);
        writeEquityCurve(runDir.resolve(EQUITY_CURVE_FILE), equityCurve);
        writeSummary(runDir.resolve(SUMMARY_FILE), summary);
        log.info("Reports written to {}", runDir);
    }

    void writeTrades(Path file, List<Trade> trades) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.join(",", TradeLedgerSchema.allColumns()));
            writer.newLine();
            for (Trade trade : trades) {
                writer.write(toCsvRow(trade));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    void writeEquityCurve(Path file, List<EquityPoint> equityCurve) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.join(",", TradeLedgerSchema.EQUITY_CURVE_COLUMNS));
            writer.newLine();
            for (EquityPoint point : equityCurve) {
                writer.write(point.getTimestamp() + "," + decimal(point.getEquity()));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    void writeSummary(Path file, RunSummary summary) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), summary.toMap());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    private int nextRunNumber(String prefix) throws IOException {
        Pattern pattern = Pattern.compile("^" + Pattern.quote(prefix) + "(\\d+)$");
        try (Stream<Path> entries = Files.list(reportsDir)) {
            return entries.filter(Files::isDirectory)
                    .map(path -> pattern.matcher(path.getFileName().toString()))
                    .filter(Matcher::matches)
                    .mapToInt(matcher -> Integer.parseInt(matcher.group(1)))
                    .max()
                    .orElse(0) + 1;
        }
    }

    private String toCsvRow(Trade trade) {
        TradeAudit audit = trade.getAudit();
        Stream<String> base = Stream.of(
                trade.getTimestamp().toString(),
                trade.getSymbol(),
                trade.getSide().name(),
                decimal(trade.getQuantity()),
                decimal(trade.getPrice()),
                decimal(trade.getFee()),
                decimal(trade.getCashAfter()),
                decimal(trade.getPositionAfter()),
                decimal(trade.getEquityAfter()),
                decimal(trade.getRealizedPnl()),
                decimal(trade.getCumulativeRealizedPnl()),
                escape(trade.getNote()));
        Stream<String> auditColumns = Stream.of(
                decimal(audit.getIntendedPrice()),
                decimal(audit.getExecPriceRaw()),
                decimal(audit.getPriceRoundDiff()),
                decimal(audit.getQtyRaw()),
                decimal(audit.getQtyRounded()),
                decimal(audit.getQtyRoundDiff()),
                decimal(audit.getSlippageBps()),
                decimal(audit.getNotionalBeforeRound()),
                decimal(audit.getNotionalAfterRound()),
                audit.getRuleCheck(),
                audit.getRunId() != null ? audit.getRunId() : "",
                decimal(audit.getFeeBps()),
                String.valueOf(audit.getSchemaVersion()),
                decimal(audit.getTickSizeUsed()),
                decimal(audit.getStepSizeUsed()),
                decimal(audit.getMinNotionalUsed()));
        return String.join(",", Stream.concat(base, auditColumns).toArray(String[]::new));
    }

    private static String decimal(BigDecimal value) {
        return value != null ? value.toPlainString() : "";
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    /**
     * Contents of {@code summary.json}.
     */
    @lombok.Value
    @lombok.Builder
    public static class RunSummary {
        String runId;
        String symbol;
        String strategy;
        MetricsSummary metrics;
        PortfolioSummary portfolio;
        Map<RejectionReason, Integer> rejectedOrders;

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("run_id", runId);
            map.put("symbol", symbol);
            map.put("strategy", strategy);
            map.put("metrics", metrics);
            map.put("portfolio", portfolio);
            Map<String, Integer> rejected = new LinkedHashMap<>();
            Arrays.stream(RejectionReason.values())
                    .forEach(reason -> rejected.put(reason.name(), rejectedOrders.getOrDefault(reason, 0)));
            map.put("rejected_orders", rejected);
            return map;
        }
    }
}
