package com.makemytrade.backtester.backtesting.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class EquityPoint {
    private final Instant timestamp;
    private final double equity;
}
