package com.makemytrade.backtester.bar;

import com.bybit.api.client.domain.market.MarketInterval;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Bar intervals the data fetcher can serve. Anything else is rejected while resolving configuration.
 */
@Getter
@AllArgsConstructor
public enum Timeframe {
    ONE_MINUTE("1m", MarketInterval.ONE_MINUTE, Duration.ofMinutes(1)),
    THREE_MINUTES("3m", MarketInterval.THREE_MINUTES, Duration.ofMinutes(3)),
    FIVE_MINUTES("5m", MarketInterval.FIVE_MINUTES, Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", MarketInterval.FIFTEEN_MINUTES, Duration.ofMinutes(15)),
    THIRTY_MINUTES("30m", MarketInterval.HALF_HOURLY, Duration.ofMinutes(30)),
    ONE_HOUR("1h", MarketInterval.HOURLY, Duration.ofHours(1)),
    TWO_HOURS("2h", MarketInterval.TWO_HOURLY, Duration.ofHours(2)),
    FOUR_HOURS("4h", MarketInterval.FOUR_HOURLY, Duration.ofHours(4)),
    SIX_HOURS("6h", MarketInterval.SIX_HOURLY, Duration.ofHours(6)),
    TWELVE_HOURS("12h", MarketInterval.TWELVE_HOURLY, Duration.ofHours(12)),
    ONE_DAY("1d", MarketInterval.DAILY, Duration.ofDays(1)),
    ONE_WEEK("1w", MarketInterval.WEEKLY, Duration.ofDays(7)),
    ONE_MONTH("1M", MarketInterval.MONTHLY, Duration.ofDays(30));

    private final String code;
    private final MarketInterval marketInterval;
    private final Duration duration;

    public static Timeframe fromCode(String code) {
        if (code == null) {
            throw new InvalidConfigurationException("Timeframe is required");
        }
        return Arrays.stream(values())
                .filter(timeframe -> timeframe.code.equals(code.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidConfigurationException(
                        "Unsupported timeframe: " + code + ", expected one of " + Arrays.stream(values())
                                .map(Timeframe::getCode)
                                .collect(Collectors.joining(", "))));
    }
}
