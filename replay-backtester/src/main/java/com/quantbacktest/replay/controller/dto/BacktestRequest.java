package com.quantbacktest.replay.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Request DTO for running a backtest.
 * Execution overrides left null fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @NotBlank(message = "Symbol is required")
    @Pattern(regexp = "[A-Z0-9]+", message = "Symbol must be upper-case alphanumeric")
    private String symbol;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    private Map<String, Object> parameters;

    @PositiveOrZero(message = "Initial capital must not be negative")
    private BigDecimal initialCapital;

    @DecimalMin(value = "0", message = "Fee bps must not be negative")
    private BigDecimal feeBps;

    @DecimalMin(value = "0", message = "Slippage bps must not be negative")
    private BigDecimal slippageBps;

    @DecimalMin(value = "0", inclusive = false, message = "Allocation must be greater than 0")
    @DecimalMax(value = "1", message = "Allocation must not exceed 1")
    private BigDecimal allocPct;

    private Boolean realizedPnlNetFees;

    private Boolean useExchangeRules;

    @JsonIgnore
    @AssertTrue(message = "End date must not be before start date")
    public boolean isDateRangeValid() {
        return startDate == null || endDate == null || !endDate.isBefore(startDate);
    }
}
