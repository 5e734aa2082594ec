package com.quantbacktest.replay.service;

import com.quantbacktest.replay.domain.Bar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Bar source for backtests.
 * Reads {@code <dataDir>/<SYMBOL>.csv}. Every returned series is sorted,
 * filtered to the requested UTC date range and validated.
 */
@Service
@Slf4j
public class MarketDataService {

    private static final List<String> TIME_COLUMNS = List.of("timestamp", "ts", "time", "datetime", "open_time", "date");

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    };

    private final Path dataDir;

    public MarketDataService(@Value("${backtest.data-dir:data}") String dataDir) {
        this.dataDir = Paths.get(dataDir);
    }

    /**
     * Load bars for the given symbol and inclusive UTC date range.
     *
     * @throws IllegalStateException if the file is missing or malformed, or the series breaks the bar contract
     */
    public List<Bar> loadBars(String symbol, LocalDate startDate, LocalDate endDate) {
        log.info("Loading market data for {} from {} to {}", symbol, startDate, endDate);

        Path file = dataDir.resolve(symbol + ".csv");
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("No market data file for " + symbol + " at " + file);
        }
        List<Bar> bars = readCsv(symbol, file);
        log.info("Loaded {} bars for {} from {}", bars.size(), symbol, file);

        List<Bar> filtered = new ArrayList<>();
        for (Bar bar : bars) {
            LocalDate day = bar.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate();
            if (!day.isBefore(startDate) && !day.isAfter(endDate)) {
                filtered.add(bar);
            }
        }
        filtered.sort(Comparator.comparing(Bar::getTimestamp));

        validate(filtered);
        log.info("Prepared {} bars for {}", filtered.size(), symbol);
        return filtered;
    }

    /**
     * Parse an OHLCV CSV file. With a header row, columns are matched by name
     * ({@code timestamp|ts|time|datetime|open_time|date, open, high, low, close, volume});
     * without one they are taken positionally in that order.
     */
    List<Bar> readCsv(String symbol, Path file) {
        List<Bar> bars = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int[] columns = {0, 1, 2, 3, 4, 5};
            String line;
            int lineNumber = 0;
            boolean isFirstLine = true;

            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }

                if (isFirstLine) {
                    isFirstLine = false;
                    if (isHeader(line)) {
                        columns = resolveColumns(line.split(","), file);
                        continue;
                    }
                }

                bars.add(parseCsvLine(symbol, line, columns, file, lineNumber));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read market data file " + file, e);
        }
        return bars;
    }

    private Bar parseCsvLine(String symbol, String line, int[] columns, Path file, int lineNumber) {
        String[] parts = line.split(",");
        try {
            return Bar.builder()
                    .symbol(symbol)
                    .timestamp(parseTimestamp(parts[columns[0]].trim()))
                    .open(new BigDecimal(parts[columns[1]].trim()))
                    .high(new BigDecimal(parts[columns[2]].trim()))
                    .low(new BigDecimal(parts[columns[3]].trim()))
                    .close(new BigDecimal(parts[columns[4]].trim()))
                    .volume(new BigDecimal(parts[columns[5]].trim()))
                    .build();
        } catch (ArrayIndexOutOfBoundsException | IllegalArgumentException | DateTimeParseException e) {
            throw new IllegalStateException("Malformed bar at " + file + ":" + lineNumber + " - " + e.getMessage(), e);
        }
    }

    private boolean isHeader(String line) {
        String first = line.split(",")[0].trim();
        try {
            parseTimestamp(first);
            return false;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return true;
        }
    }

    private int[] resolveColumns(String[] header, Path file) {
        int[] columns = {-1, -1, -1, -1, -1, -1};
        List<String> names = List.of("open", "high", "low", "close", "volume");
        for (int i = 0; i < header.length; i++) {
            String name = header[i].trim().toLowerCase(Locale.ROOT);
            if (columns[0] < 0 && TIME_COLUMNS.contains(name)) {
                columns[0] = i;
            }
            int idx = names.indexOf(name);
            if (idx >= 0) {
                columns[idx + 1] = i;
            }
        }
        for (int column : columns) {
            if (column < 0) {
                throw new IllegalStateException("Missing OHLCV columns in header of " + file
                        + "; expected one of " + TIME_COLUMNS + " and " + names);
            }
        }
        return columns;
    }

    /**
     * Epoch milliseconds, ISO-8601 instants/offset date-times, or plain dates (UTC midnight).
     */
    static Instant parseTimestamp(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        if (value.contains("T")) {
            return value.endsWith("Z") ? Instant.parse(value) : OffsetDateTime.parse(value).toInstant();
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter).atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                // Try next formatter
            }
        }
        throw new IllegalArgumentException("Unable to parse timestamp: " + value);
    }

    /**
     * Enforce the bar contract: positive OHLC, non-negative volume, strictly increasing timestamps.
     */
    static void validate(List<Bar> bars) {
        Instant previous = null;
        for (Bar bar : bars) {
            if (bar.getOpen().signum() <= 0 || bar.getHigh().signum() <= 0
                    || bar.getLow().signum() <= 0 || bar.getClose().signum() <= 0) {
                throw new IllegalStateException("Non-positive price in bar at " + bar.getTimestamp());
            }
            if (bar.getVolume().signum() < 0) {
                throw new IllegalStateException("Negative volume in bar at " + bar.getTimestamp());
            }
            if (previous != null && !bar.getTimestamp().isAfter(previous)) {
                throw new IllegalStateException("Duplicate or out-of-order bar at " + bar.getTimestamp());
            }
            previous = bar.getTimestamp();
        }
    }
}
