package com.covidamp.api;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Bounded, expiring cache of completed count responses.
 *
 * Entries are keyed by request and by the day they were computed on. The all-time max runs
 * through today, so a response from an earlier day is never served.
 */
public class CaffeinePolicyCountCache implements PolicyCountCache {

    private record Key(PolicyCountRequest request, LocalDate day) {}

    private final Cache<Key, PlaceObsList> cache;
    private final Clock clock;

    public CaffeinePolicyCountCache(long maximumSize, Duration expireAfterWrite, Clock clock) {
        this(maximumSize, expireAfterWrite, clock, Ticker.systemTicker(), ForkJoinPool.commonPool());
    }

    CaffeinePolicyCountCache(long maximumSize, Duration expireAfterWrite, Clock clock, Ticker ticker, Executor executor) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(expireAfterWrite)
            .ticker(ticker)
            .executor(executor)
            .build();
    }

    @Override
    public Optional<PlaceObsList> get(PolicyCountRequest key) {
        return Optional.ofNullable(cache.getIfPresent(new Key(key, LocalDate.now(clock))));
    }

    @Override
    public void put(PolicyCountRequest key, PlaceObsList value) {
        cache.put(new Key(key, LocalDate.now(clock)), value);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /** Entry count after pending evictions are applied. */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
