/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * A keyed cache whose entries expire a fixed time after they were created.
 * <p>
 * On a miss, {@link #getOrCreate(Object, Function)} invokes the factory once per key however many
 * threads ask for it concurrently; the other callers wait for and share its result. A factory that
 * throws leaves nothing behind, so the next caller tries again. Expired entries are treated as absent
 * when next looked up.
 * </p>
 * @param <K> key type
 * @param <V> value type
 */
public class TimedCache<K, V> {

    private final Cache<K, V> cache;

    public TimedCache(Duration ttl, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker(clock))
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    private static Ticker ticker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    /**
     * Returns the cached value for {@code key}, creating it with {@code factory} if absent or expired.
     * @throws NullPointerException if the factory returns null
     */
    public V getOrCreate(K key, Function<? super K, ? extends V> factory) {
        return cache.get(key, k -> Objects.requireNonNull(factory.apply(k), "cache factory returned null"));
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    /**
     * Evicts an entry, typically one proven stale by a downstream error.
     */
    public void delete(K key) {
        cache.invalidate(key);
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
