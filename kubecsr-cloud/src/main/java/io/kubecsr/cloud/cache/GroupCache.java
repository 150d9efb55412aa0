/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kubecsr.cloud.ResolutionException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A snapshot of every group and its members, refreshed as a whole rather than per key.
 * <p>
 * Refreshes happen on a fixed schedule, once {@link #start(Duration)} has been called, and on a lookup miss.
 * The new snapshot is built without holding the snapshot lock and then swapped in, so readers never see
 * a partially built snapshot. Refreshes are serialized; a lookup that waited on somebody else's refresh
 * uses that result instead of starting another.
 * </p>
 * <p>
 * Keys confirmed to belong to no group can be {@link #markAbsent(String) marked absent}. Lookups of absent
 * keys return empty without a refresh, until the optional negative TTL passes; with no TTL a key stays absent
 * for the life of the cache.
 * </p>
 * @param <R> member record type
 */
public class GroupCache<R> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GroupCache.class);

    /**
     * A member and the group it was found in.
     */
    public record Membership<R>(String group, R member) {}

    private record Snapshot<R>(Map<String, Membership<R>> byKey, Set<String> ambiguousKeys, long generation) {}

    private final String name;
    private final Supplier<Map<String, List<R>>> loader;
    private final Function<R, String> keyOf;
    private final Clock clock;
    @Nullable
    private final Duration negativeTtl;

    private final Object lock = new Object();
    private final ReentrantLock refreshLock = new ReentrantLock();
    // guarded by lock
    private Snapshot<R> snapshot = new Snapshot<>(Map.of(), Set.of(), 0);
    // guarded by lock
    private final Map<String, Instant> absent = new HashMap<>();

    @Nullable
    private ScheduledExecutorService scheduler;

    /**
     * @param name used in log messages and thread names
     * @param loader lists every group with its members; may throw {@link ResolutionException}
     * @param keyOf extracts the lookup key from a member
     * @param clock clock for negative entry expiry
     * @param negativeTtl how long a key stays absent, null for ever
     */
    public GroupCache(String name,
                      Supplier<Map<String, List<R>>> loader,
                      Function<R, String> keyOf,
                      Clock clock,
                      @Nullable Duration negativeTtl) {
        this.name = name;
        this.loader = loader;
        this.keyOf = keyOf;
        this.clock = clock;
        this.negativeTtl = negativeTtl;
    }

    /**
     * Schedules a full refresh every {@code interval}, starting after one interval.
     */
    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            throw new IllegalStateException(name + " refresh already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-refresh");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scheduledRefresh, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void scheduledRefresh() {
        try {
            refresh();
        }
        catch (RuntimeException e) {
            LOGGER.warn("Periodic refresh of {} failed, keeping the previous snapshot: {}", name, e.getMessage());
        }
    }

    /**
     * Looks a key up, refreshing once on a miss unless the key is marked absent.
     * @return the membership, or empty if the key is in no group
     * @throws ResolutionException if the key is in more than one group, or a refresh failed
     */
    public Optional<Membership<R>> find(String key) {
        Snapshot<R> current = currentSnapshot();
        Optional<Membership<R>> found = lookup(current, key);
        if (found.isPresent() || isAbsent(key)) {
            return found;
        }
        LOGGER.debug("{} has no entry for {}, refreshing", name, key);
        return lookup(refreshIfUnchangedSince(current.generation()), key);
    }

    /**
     * Rebuilds the snapshot from the loader.
     */
    public void refresh() {
        refreshLock.lock();
        try {
            doRefresh();
        }
        finally {
            refreshLock.unlock();
        }
    }

    private Snapshot<R> refreshIfUnchangedSince(long generation) {
        refreshLock.lock();
        try {
            Snapshot<R> current = currentSnapshot();
            if (current.generation() != generation) {
                return current;
            }
            return doRefresh();
        }
        finally {
            refreshLock.unlock();
        }
    }

    private Snapshot<R> doRefresh() {
        Map<String, List<R>> groups = loader.get();
        Map<String, Membership<R>> byKey = new HashMap<>();
        Set<String> ambiguous = new HashSet<>();
        groups.forEach((group, members) -> {
            for (R member : members) {
                String key = keyOf.apply(member);
                if (byKey.putIfAbsent(key, new Membership<>(group, member)) != null) {
                    ambiguous.add(key);
                }
            }
        });
        synchronized (lock) {
            snapshot = new Snapshot<>(Map.copyOf(byKey), Set.copyOf(ambiguous), snapshot.generation() + 1);
            LOGGER.debug("Refreshed {}: {} groups, {} members", name, groups.size(), byKey.size());
            return snapshot;
        }
    }

    private Snapshot<R> currentSnapshot() {
        synchronized (lock) {
            return snapshot;
        }
    }

    private Optional<Membership<R>> lookup(Snapshot<R> source, String key) {
        if (source.ambiguousKeys().contains(key)) {
            throw new ResolutionException(ResolutionException.Kind.AMBIGUOUS, key + " is a member of more than one group in " + name);
        }
        return Optional.ofNullable(source.byKey().get(key));
    }

    /**
     * Records that {@code key} belongs to no group, so later misses do not force a refresh.
     */
    public void markAbsent(String key) {
        synchronized (lock) {
            absent.put(key, clock.instant());
        }
    }

    public boolean isAbsent(String key) {
        synchronized (lock) {
            Instant markedAt = absent.get(key);
            if (markedAt == null) {
                return false;
            }
            if (negativeTtl != null && !clock.instant().isBefore(markedAt.plus(negativeTtl))) {
                absent.remove(key);
                return false;
            }
            return true;
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
