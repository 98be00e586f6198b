package com.makemytrade.backtester.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "backtester")
public class BacktesterProperties {

    /**
     * Run the configured backtests when the application starts.
     */
    private boolean runOnStartup = true;

    private List<String> instruments = new ArrayList<>(List.of("BTC"));

    /**
     * Bar interval code, e.g. 15m, 1h, 1d.
     */
    private String timeframe = "1h";

    private Instant start = Instant.parse("2024-01-01T00:00:00Z");

    private Instant end = Instant.parse("2025-01-01T00:00:00Z");

    private String strategy = "FILTERED_DONCHIAN";

    private Map<String, Object> strategyParameters = new LinkedHashMap<>();

    private double initialCapital = 10_000;

    private double riskFreeRate = 0.02;

    /**
     * Abort all runs on the first failed instrument instead of skipping it.
     */
    private boolean failFast = false;

    private boolean chartsEnabled = true;

    private String chartDirectory = "./visualizations";
}
