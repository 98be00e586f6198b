package com.makemytrade.backtester.bar.cache;

import com.makemytrade.backtester.bar.Bar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@Slf4j
public class R2dbcBarCache implements BarCache {
    private final CachedBarRepository repository;

    public R2dbcBarCache(@Autowired CachedBarRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<List<Bar>> get(BarCacheKey key) {
        String hash = key.hash();
        return repository.findAllByCacheKeyOrderByBarTimeAsc(hash)
                .map(CachedBar::toBar)
                .collectList()
                .filter(bars -> !bars.isEmpty())
                .doOnNext(bars -> log.debug("Cache hit for {} ({} bars)", key, bars.size()));
    }

    @Override
    @Transactional
    public Mono<Void> put(BarCacheKey key, List<Bar> bars) {
        String hash = key.hash();
        return repository.saveAll(bars.stream().map(bar -> CachedBar.from(hash, bar)).toList())
                .then()
                .doOnSuccess(ignored -> log.debug("Cached {} bars for {}", bars.size(), key));
    }
}
