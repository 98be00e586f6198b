package com.makemytrade.backtester.bar;

import reactor.core.publisher.Flux;

import java.time.Instant;

public interface HistoricalDataFetcher {

    /**
     * Bars of the instrument between start and end (inclusive), ascending by timestamp.
     */
    Flux<Bar> fetchHistory(Instant start, Instant end, String instrument, Timeframe timeframe);
}
