/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.retry;

import java.time.Duration;
import java.util.Random;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.kubecsr.config.DurationSerde;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Bounded exponential backoff for calls to a cloud provider.
 * @param steps the maximum number of attempts, including the first
 * @param factor the multiplier applied to the delay after each failure
 * @param duration the delay after the first failure
 * @param jitter the fraction of each delay that may be added at random
 */
public record Backoff(int steps,
                      double factor,
                      @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration duration,
                      double jitter) {

    /** A single attempt, no retries. */
    public static final Backoff NONE = new Backoff(1, 1.0, Duration.ZERO, 0.0);

    public Backoff {
        if (steps < 1) {
            throw new IllegalArgumentException("backoff steps must be at least 1");
        }
        if (factor < 1.0) {
            factor = 1.0;
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public BackoffStrategy strategy(Random random) {
        return new ExponentialJitterBackoffStrategy(duration, null, factor, jitter, random);
    }

    public Retrier retrier() {
        return new Retrier(steps, strategy(new Random()), Sleeper.SYSTEM);
    }
}
