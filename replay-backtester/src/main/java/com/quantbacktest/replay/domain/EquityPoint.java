package com.quantbacktest.replay.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class EquityPoint {
    Instant timestamp;
    BigDecimal equity;
}
