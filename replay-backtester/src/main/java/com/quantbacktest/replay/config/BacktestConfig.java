package com.quantbacktest.replay.config;

import com.quantbacktest.replay.domain.ExecutionSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Execution defaults and infrastructure beans for backtest runs.
 */
@Configuration
@Slf4j
public class BacktestConfig {

    @Value("${backtest.execution.fee-bps:1.0}")
    private BigDecimal feeBps;

    @Value("${backtest.execution.slippage-bps:5.0}")
    private BigDecimal slippageBps;

    @Value("${backtest.execution.alloc-pct:0.10}")
    private BigDecimal allocPct;

    @Value("${backtest.execution.realized-pnl-net-fees:false}")
    private boolean realizedPnlNetFees;

    @Bean
    public ExecutionSettings defaultExecutionSettings() {
        if (feeBps.signum() < 0 || slippageBps.signum() < 0) {
            throw new IllegalArgumentException("Fee and slippage bps must not be negative");
        }
        BigDecimal clampedAlloc = allocPct.max(BigDecimal.ZERO).min(BigDecimal.ONE);
        if (clampedAlloc.compareTo(allocPct) != 0) {
            log.warn("backtest.execution.alloc-pct={} clamped to {}", allocPct, clampedAlloc);
        }

        ExecutionSettings settings = ExecutionSettings.builder()
                .feeBps(feeBps)
                .slippageBps(slippageBps)
                .allocPct(clampedAlloc)
                .realizedPnlNetFees(realizedPnlNetFees)
                .build();
        log.info("Default execution settings: {}", settings);
        return settings;
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
