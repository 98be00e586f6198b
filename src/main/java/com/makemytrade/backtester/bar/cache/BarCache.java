package com.makemytrade.backtester.bar.cache;

import com.makemytrade.backtester.bar.Bar;
import reactor.core.publisher.Mono;

import java.util.List;

public interface BarCache {

    /**
     * @return the cached bars, or an empty Mono on a cache miss
     */
    Mono<List<Bar>> get(BarCacheKey key);

    Mono<Void> put(BarCacheKey key, List<Bar> bars);
}
