package com.makemytrade.backtester.bar;

import com.bybit.api.client.domain.CategoryType;
import com.bybit.api.client.domain.market.request.MarketDataRequest;
import com.bybit.api.client.restApi.BybitApiMarketRestClient;
import com.makemytrade.backtester.bar.cache.BarCache;
import com.makemytrade.backtester.bar.cache.BarCacheKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Historical klines of Bybit linear USDT contracts, served from the bar cache when the same range was fetched before.
 */
@Service
@Slf4j
public class BybitDataFetcher implements HistoricalDataFetcher {
    static final int PAGE_LIMIT = 1000;

    private final BybitApiMarketRestClient marketClient;
    private final BarCache cache;

    public BybitDataFetcher(@Autowired BybitApiMarketRestClient marketClient,
                            @Autowired BarCache cache) {
        this.marketClient = marketClient;
        this.cache = cache;
    }

    @Override
    public Flux<Bar> fetchHistory(Instant start, Instant end, String instrument, Timeframe timeframe) {
        BarCacheKey key = new BarCacheKey(instrument, start, end, timeframe);

        return cache.get(key)
                .doOnNext(bars -> log.info("Retrieved {} cached bars for {}/{}", bars.size(), instrument, timeframe.getCode()))
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("No cached bars found for {}/{}, fetching from Bybit", instrument, timeframe.getCode());
                    return Mono.fromCallable(() -> fetchFromExchange(start, end, instrument, timeframe))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMap(bars -> cache.put(key, bars)
                                    .onErrorResume(e -> {
                                        log.warn("Could not cache bars for {}: {}", key, e.getMessage());
                                        return Mono.empty();
                                    })
                                    .thenReturn(bars));
                }))
                .flatMapMany(Flux::fromIterable);
    }

    List<Bar> fetchFromExchange(Instant start, Instant end, String instrument, Timeframe timeframe) {
        long startMillis = start.toEpochMilli();
        long currentEnd = end.toEpochMilli();
        TreeMap<Long, Bar> barsByTime = new TreeMap<>();

        // Bybit pages backwards from the end of the requested range
        while (currentEnd >= startMillis) {
            MarketDataRequest request = MarketDataRequest.builder()
                    .category(CategoryType.LINEAR)
                    .symbol(toExchangeSymbol(instrument))
                    .marketInterval(timeframe.getMarketInterval())
                    .start(startMillis)
                    .end(currentEnd)
                    .limit(PAGE_LIMIT)
                    .build();

            List<Bar> page = convertResponseToBars(marketClient.getMarketLinesData(request), instrument, timeframe);
            if (page.isEmpty()) {
                break;
            }

            log.debug("Earliest bar timestamp:{}, latest bar timestamp:{}",
                    page.get(0).getTimestamp(), page.get(page.size() - 1).getTimestamp());

            for (Bar bar : page) {
                long time = bar.getTimestamp().toEpochMilli();
                if (time >= startMillis && time <= end.toEpochMilli()) {
                    barsByTime.put(time, bar);
                }
            }

            long earliest = page.get(0).getTimestamp().toEpochMilli();
            if (page.size() < PAGE_LIMIT || earliest <= startMillis) {
                break;
            }
            currentEnd = earliest - 1;
        }

        log.info("Fetched {} bars for {}/{}", barsByTime.size(), instrument, timeframe.getCode());
        return new ArrayList<>(barsByTime.values());
    }

    private List<Bar> convertResponseToBars(Object response, String instrument, Timeframe timeframe) {
        if (!(response instanceof Map)) {
            return List.of();
        }
        Map<String, Map<String, List<List<String>>>> typedResponse = (Map) response;

        Map<String, List<List<String>>> result = typedResponse.get("result");
        List<List<String>> rows = result != null ? result.get("list") : null;
        if (rows == null) {
            return List.of();
        }

        return rows.stream()
                .map(row -> Bar.from(row, instrument, timeframe))
                .sorted(Comparator.comparing(Bar::getTimestamp))
                .toList();
    }

    private static String toExchangeSymbol(String instrument) {
        return instrument.endsWith("USDT") ? instrument : instrument + "USDT";
    }
}
