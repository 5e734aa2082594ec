package com.quantbacktest.replay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.replay.controller.dto.BacktestRequest;
import com.quantbacktest.replay.controller.dto.BacktestResponse;
import com.quantbacktest.replay.domain.Bar;
import com.quantbacktest.replay.domain.ExecutionSettings;
import com.quantbacktest.replay.domain.SymbolRules;
import com.quantbacktest.replay.domain.Trade;
import com.quantbacktest.replay.domain.TradeSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestServiceImpl focusing on run orchestration and failure handling.
 */
@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 10);

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private SymbolRulesService symbolRulesService;

    @Mock
    private ReportWriter reportWriter;

    @Mock
    private BacktestMetricsService metricsService;

    private BacktestServiceImpl backtestService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        ExecutionSettings defaults = ExecutionSettings.builder()
                .feeBps(new BigDecimal("1.0"))
                .slippageBps(new BigDecimal("5.0"))
                .allocPct(new BigDecimal("0.10"))
                .build();

        backtestService = new BacktestServiceImpl(
                marketDataService,
                symbolRulesService,
                new StrategyFactory(),
                reportWriter,
                metricsService,
                objectMapper,
                defaults);
        ReflectionTestUtils.setField(backtestService, "defaultInitialCapital", new BigDecimal("10000"));
        ReflectionTestUtils.setField(backtestService, "rulesEnabled", false);
        ReflectionTestUtils.setField(backtestService, "logEvery", 10);
        ReflectionTestUtils.setField(backtestService, "useDailyReturns", true);
        ReflectionTestUtils.setField(backtestService, "annualizationDays", 252);
    }

    private static List<Bar> increasingBars(int count) {
        List<Bar> bars = new ArrayList<>();
        Instant start = START.atStartOfDay().toInstant(ZoneOffset.UTC);
        for (int i = 0; i < count; i++) {
            BigDecimal close = BigDecimal.valueOf(100 + i);
            bars.add(Bar.builder()
                    .timestamp(start.plus(i, ChronoUnit.DAYS))
                    .symbol("BTCUSDT")
                    .open(close)
                    .high(close)
                    .low(close)
                    .close(close)
                    .volume(BigDecimal.ONE)
                    .build());
        }
        return bars;
    }

    private static BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .strategyName("buy_second_bar")
                .symbol("BTCUSDT")
                .startDate(START)
                .endDate(END)
                .build();
    }

    @Test
    void testRunBacktest_Success() {
        // Arrange
        when(marketDataService.loadBars("BTCUSDT", START, END)).thenReturn(increasingBars(10));
        when(reportWriter.createRunDirectory("BTCUSDT", "BuySecondBar")).thenReturn(Path.of("reports", "run01"));

        // Act
        BacktestResponse response = backtestService.runBacktest(createValidRequest());

        // Assert
        assertNotNull(response.getRunId());
        assertEquals("BuySecondBar", response.getStrategyName());
        assertEquals(10, response.getBarsProcessed());
        assertEquals(2, response.getTrades().size());
        assertNotNull(response.getMetrics());
        assertEquals(2, response.getMetrics().getTradeCount());
        assertNull(response.getRules());
        assertEquals(Path.of("reports", "run01").toString(), response.getReportDirectory());

        for (Trade trade : response.getTrades()) {
            assertEquals(response.getRunId(), trade.getAudit().getRunId());
        }
        Trade buy = response.getTrades().get(0);
        assertEquals(TradeSide.BUY, buy.getSide());
        assertEquals(0, new BigDecimal("101.0505").compareTo(buy.getPrice()), "5 bps slippage on the 101 close");

        verify(reportWriter).writeReport(eq(Path.of("reports", "run01")), eq(response.getTrades()), any(), any());
        verify(metricsService).recordRunCompleted(anyLong(), eq(2), anyMap());
        verify(metricsService, never()).recordRunFailed();
        verifyNoInteractions(symbolRulesService);
        assertNull(MDC.get(BacktestServiceImpl.RUN_ID_KEY), "MDC is cleared after the run");
    }

    @Test
    void testRunBacktest_SetsRunIdInMdcDuringRun() {
        List<String> seen = new ArrayList<>();
        when(marketDataService.loadBars("BTCUSDT", START, END)).thenAnswer(invocation -> {
            seen.add(MDC.get(BacktestServiceImpl.RUN_ID_KEY));
            return increasingBars(3);
        });
        when(reportWriter.createRunDirectory(any(), any())).thenReturn(Path.of("reports", "run01"));

        BacktestResponse response = backtestService.runBacktest(createValidRequest());

        assertEquals(List.of(response.getRunId()), seen);
    }

    @Test
    void testRunBacktest_UsesExchangeRulesWhenRequested() {
        // Arrange
        SymbolRules rules = SymbolRules.builder()
                .symbol("BTCUSDT")
                .tickSize(new BigDecimal("0.01"))
                .stepSize(new BigDecimal("0.001"))
                .minNotional(new BigDecimal("5"))
                .build();
        BacktestRequest request = createValidRequest();
        request.setUseExchangeRules(true);
        when(symbolRulesService.loadRules("BTCUSDT")).thenReturn(rules);
        when(marketDataService.loadBars("BTCUSDT", START, END)).thenReturn(increasingBars(10));
        when(reportWriter.createRunDirectory(any(), any())).thenReturn(Path.of("reports", "run01"));

        // Act
        BacktestResponse response = backtestService.runBacktest(request);

        // Assert
        assertEquals(rules, response.getRules());
        Trade buy = response.getTrades().get(0);
        assertEquals(0, new BigDecimal("101.05").compareTo(buy.getPrice()), "Price floored to the tick");
        assertEquals(0, buy.getQuantity().remainder(new BigDecimal("0.001")).signum(), "Quantity on the step grid");
        assertEquals(0, new BigDecimal("0.001").compareTo(buy.getAudit().getStepSizeUsed()));
    }

    @Test
    void testRunBacktest_NoBarsFails() {
        when(marketDataService.loadBars("BTCUSDT", START, END)).thenReturn(List.of());

        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> backtestService.runBacktest(createValidRequest()));

        assertTrue(exception.getMessage().contains("No market data"));
        verify(metricsService).recordRunFailed();
        verifyNoInteractions(reportWriter);
        assertNull(MDC.get(BacktestServiceImpl.RUN_ID_KEY));
    }

    @Test
    void testRunBacktest_UpstreamFailurePropagatesUnchanged() {
        UncheckedIOException failure = new UncheckedIOException("disk", new IOException("disk"));
        when(marketDataService.loadBars("BTCUSDT", START, END)).thenThrow(failure);

        UncheckedIOException thrown = assertThrows(UncheckedIOException.class,
                () -> backtestService.runBacktest(createValidRequest()));

        assertSame(failure, thrown);
        verify(metricsService).recordRunFailed();
        verify(metricsService, never()).recordRunCompleted(anyLong(), anyInt(), anyMap());
    }

    @Test
    void testRunBacktest_InvalidStrategyParametersFail() {
        BacktestRequest request = createValidRequest();
        request.setStrategyName("ma_crossover");
        request.setParameters(Map.of("shortPeriod", 20, "longPeriod", 5));

        assertThrows(IllegalArgumentException.class, () -> backtestService.runBacktest(request));

        verify(metricsService).recordRunFailed();
        verifyNoInteractions(marketDataService);
    }

    @Test
    void testResolveSettings_RequestOverridesDefaults() {
        BacktestRequest request = createValidRequest();
        request.setFeeBps(BigDecimal.ZERO);
        request.setAllocPct(new BigDecimal("0.5"));
        request.setRealizedPnlNetFees(true);

        ExecutionSettings settings = backtestService.resolveSettings(request);

        assertEquals(0, settings.getFeeBps().signum());
        assertEquals(new BigDecimal("5.0"), settings.getSlippageBps(), "Unset overrides keep the default");
        assertEquals(new BigDecimal("0.5"), settings.getAllocPct());
        assertTrue(settings.isRealizedPnlNetFees());
    }
}
