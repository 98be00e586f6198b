package com.makemytrade.backtester.bar.cache;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface CachedBarRepository extends ReactiveCrudRepository<CachedBar, Long> {

    Flux<CachedBar> findAllByCacheKeyOrderByBarTimeAsc(String cacheKey);
}
