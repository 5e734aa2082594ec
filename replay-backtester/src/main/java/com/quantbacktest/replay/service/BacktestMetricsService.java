package com.quantbacktest.replay.service;

import com.quantbacktest.replay.domain.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest execution metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter ordersAcceptedCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed successfully")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs aborted by an error")
                .register(meterRegistry);

        this.ordersAcceptedCounter = Counter.builder("backtest.orders.accepted")
                .description("Orders filled by the simulated execution model")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a completed run with its execution time and order outcomes.
     */
    public void recordRunCompleted(long executionTimeMs, int acceptedOrders,
                                   Map<RejectionReason, Integer> rejectedOrders) {
        runsCompletedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
        ordersAcceptedCounter.increment(acceptedOrders);
        rejectedOrders.forEach((reason, count) -> rejectedCounter(reason).increment(count));
    }

    /**
     * Record a run that ended with an exception.
     */
    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, OrdersAccepted=%d, AvgExecTime=%.2fs",
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) ordersAcceptedCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }

    private Counter rejectedCounter(RejectionReason reason) {
        return Counter.builder("backtest.orders.rejected")
                .description("Orders dropped by the simulated execution model")
                .tag("reason", reason.name())
                .register(meterRegistry);
    }
}
