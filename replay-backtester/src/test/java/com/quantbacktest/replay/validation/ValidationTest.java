package com.quantbacktest.replay.validation;

import com.quantbacktest.replay.controller.dto.BacktestRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for input validation and constraint violations.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    private BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .strategyName("ma_crossover")
                .symbol("BTCUSDT")
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .parameters(Map.of("shortPeriod", 10, "longPeriod", 50))
                .build();
    }

    private static ConstraintViolation<BacktestRequest> single(Set<ConstraintViolation<BacktestRequest>> violations) {
        assertEquals(1, violations.size(), violations.toString());
        return violations.iterator().next();
    }

    @Test
    void testValidRequest_NoViolations() {
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(createValidRequest());

        assertTrue(violations.isEmpty(), "Valid request should have no violations");
    }

    @Test
    void testOptionalFieldsMayBeOmitted() {
        BacktestRequest request = createValidRequest();
        request.setParameters(null);
        request.setInitialCapital(null);

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testMissingStrategyName_Violation() {
        BacktestRequest request = createValidRequest();
        request.setStrategyName("  ");

        ConstraintViolation<BacktestRequest> violation = single(validator.validate(request));

        assertEquals("strategyName", violation.getPropertyPath().toString());
        assertTrue(violation.getMessage().contains("required"));
    }

    @Test
    void testSymbolMustBeUpperCaseAlphanumeric() {
        BacktestRequest request = createValidRequest();
        request.setSymbol("BTC/USDT");

        ConstraintViolation<BacktestRequest> violation = single(validator.validate(request));

        assertEquals("symbol", violation.getPropertyPath().toString());
    }

    @Test
    void testMissingDates_Violation() {
        BacktestRequest request = createValidRequest();
        request.setStartDate(null);
        request.setEndDate(null);

        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        assertEquals(2, violations.size());
    }

    @Test
    void testEndBeforeStart_Violation() {
        BacktestRequest request = createValidRequest();
        request.setEndDate(LocalDate.of(2023, 6, 1));

        ConstraintViolation<BacktestRequest> violation = single(validator.validate(request));

        assertEquals("dateRangeValid", violation.getPropertyPath().toString());
    }

    @Test
    void testSameStartAndEnd_Valid() {
        BacktestRequest request = createValidRequest();
        request.setEndDate(request.getStartDate());

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testNegativeInitialCapital_Violation() {
        BacktestRequest request = createValidRequest();
        request.setInitialCapital(new BigDecimal("-1000"));

        ConstraintViolation<BacktestRequest> violation = single(validator.validate(request));

        assertEquals("initialCapital", violation.getPropertyPath().toString());
    }

    @Test
    void testZeroInitialCapital_Valid() {
        BacktestRequest request = createValidRequest();
        request.setInitialCapital(BigDecimal.ZERO);

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testNegativeFeeAndSlippage_Violation() {
        BacktestRequest request = createValidRequest();
        request.setFeeBps(new BigDecimal("-0.1"));
        request.setSlippageBps(new BigDecimal("-5"));

        assertEquals(2, validator.validate(request).size());
    }

    @Test
    void testAllocationBounds() {
        BacktestRequest request = createValidRequest();

        request.setAllocPct(BigDecimal.ZERO);
        assertEquals(1, validator.validate(request).size(), "Zero allocation is rejected");

        request.setAllocPct(new BigDecimal("1.0001"));
        assertEquals(1, validator.validate(request).size(), "Allocation above 1 is rejected");

        request.setAllocPct(BigDecimal.ONE);
        assertTrue(validator.validate(request).isEmpty());
    }
}
