/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.kubecsr.cloud.ResolutionException;
import io.kubecsr.cloud.cache.GroupCache.Membership;
import io.kubecsr.test.MutableClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupCacheTest {

    private final MutableClock clock = new MutableClock();
    private final AtomicInteger loads = new AtomicInteger();
    private final AtomicReference<Map<String, List<String>>> groups = new AtomicReference<>(Map.of("ss-1", List.of("node-a", "node-b")));
    private GroupCache<String> cache;

    @AfterEach
    void tearDown() {
        if (cache != null) {
            cache.close();
        }
    }

    private GroupCache<String> newCache(Duration negativeTtl) {
        cache = new GroupCache<>("test", () -> {
            loads.incrementAndGet();
            return groups.get();
        }, member -> member, clock, negativeTtl);
        return cache;
    }

    @Test
    void missTriggersRefresh() {
        // Given
        newCache(null);

        // When
        var found = cache.find("node-a");

        // Then
        assertThat(found).contains(new Membership<>("ss-1", "node-a"));
        assertThat(loads).hasValue(1);
    }

    @Test
    void hitsDoNotRefresh() {
        // Given
        newCache(null);
        cache.find("node-a");

        // When
        cache.find("node-b");

        // Then
        assertThat(loads).hasValue(1);
    }

    @Test
    void newMembersFoundOnNextMiss() {
        // Given
        newCache(null);
        cache.find("node-a");
        groups.set(Map.of("ss-1", List.of("node-a", "node-b"), "ss-2", List.of("node-c")));

        // When
        var found = cache.find("node-c");

        // Then
        assertThat(found).contains(new Membership<>("ss-2", "node-c"));
        assertThat(loads).hasValue(2);
    }

    @Test
    void absentKeysDoNotRefresh() {
        // Given
        newCache(null);
        assertThat(cache.find("outsider")).isEmpty();
        cache.markAbsent("outsider");

        // When
        clock.advance(Duration.ofDays(365));
        var found = cache.find("outsider");

        // Then
        assertThat(found).isEmpty();
        assertThat(loads).hasValue(1);
    }

    @Test
    void absentKeysExpireWithNegativeTtl() {
        // Given
        newCache(Duration.ofMinutes(10));
        cache.find("outsider");
        cache.markAbsent("outsider");

        // When
        clock.advance(Duration.ofMinutes(10));

        // Then
        assertThat(cache.isAbsent("outsider")).isFalse();
        cache.find("outsider");
        assertThat(loads).hasValue(2);
    }

    @Test
    void keyInTwoGroupsIsAmbiguous() {
        // Given
        groups.set(Map.of("ss-1", List.of("node-a"), "ss-2", List.of("node-a")));
        newCache(null);

        // When/Then
        assertThatThrownBy(() -> cache.find("node-a"))
                .isInstanceOf(ResolutionException.class)
                .extracting(e -> ((ResolutionException) e).kind())
                .isEqualTo(ResolutionException.Kind.AMBIGUOUS);
    }

    @Test
    void failedRefreshKeepsPreviousSnapshot() {
        // Given
        newCache(null);
        cache.find("node-a");
        groups.set(null);

        // When/Then
        assertThatThrownBy(() -> cache.find("node-z")).isInstanceOf(NullPointerException.class);
        assertThat(cache.find("node-a")).isPresent();
    }

    @Test
    void concurrentMissesShareOneRefresh() throws Exception {
        // Given
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        cache = new GroupCache<>("test", () -> {
            loads.incrementAndGet();
            loading.countDown();
            await(release);
            return groups.get();
        }, member -> member, clock, null);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> lookups = new ArrayList<>();
            lookups.add(executor.submit(() -> cache.find("node-a")));
            assertThat(loading.await(10, TimeUnit.SECONDS)).isTrue();
            for (int i = 0; i < 3; i++) {
                lookups.add(executor.submit(() -> cache.find("node-b")));
            }

            // When
            release.countDown();

            // Then
            for (Future<?> lookup : lookups) {
                lookup.get(10, TimeUnit.SECONDS);
            }
            assertThat(loads).hasValue(1);
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    void periodicRefresh() {
        // Given
        newCache(null);

        // When
        cache.start(Duration.ofMillis(20));

        // Then
        Awaitility.await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(loads.get()).isGreaterThanOrEqualTo(2));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
