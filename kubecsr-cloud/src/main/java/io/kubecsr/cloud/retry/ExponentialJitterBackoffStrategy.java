/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.retry;

import java.time.Duration;
import java.util.Random;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Delays grow by {@code multiplier} after each failure, starting from {@code initialDelay}, and each
 * delay is stretched by a random amount of up to {@code jitter} times itself.
 */
public class ExponentialJitterBackoffStrategy implements BackoffStrategy {

    @NonNull
    private final Duration initialDelay;
    @Nullable
    private final Duration maximumDelay;
    private final double multiplier;
    private final double jitter;
    private final Random random;

    public ExponentialJitterBackoffStrategy(@NonNull Duration initialDelay,
                                            @Nullable Duration maximumDelay,
                                            double multiplier,
                                            double jitter,
                                            Random random) {
        this.initialDelay = initialDelay;
        this.maximumDelay = maximumDelay;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier should not reduce the initial delay");
        }
        if (jitter < 0.0) {
            throw new IllegalArgumentException("jitter must not be negative");
        }
    }

    @Override
    public Duration getDelay(int failures) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures must not be negative");
        }
        if (failures == 0) {
            return Duration.ZERO;
        }
        long backoffMillis = (long) (initialDelay.toMillis() * Math.pow(multiplier, failures - 1));
        if (jitter > 0.0) {
            backoffMillis += (long) (random.nextDouble() * jitter * backoffMillis);
        }
        Duration backoff = Duration.ofMillis(backoffMillis);
        return maximumDelay == null || backoff.compareTo(maximumDelay) < 0 ? backoff : maximumDelay;
    }
}
