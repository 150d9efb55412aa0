/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.config;

import java.time.Duration;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.javaoperatorsdk.operator.processing.retry.GenericRetry;

import io.kubecsr.config.DurationSerde;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Exponential retry of failed reconciliations.
 *
 * @param initialInterval delay before the first retry
 * @param multiplier factor applied to the delay after each failure
 * @param maxInterval upper bound on the delay
 * @param maxAttempts retries before the request is given up until its next change
 */
public record RetryConfig(@JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration initialInterval,
                          @Nullable Double multiplier,
                          @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration maxInterval,
                          @Nullable Integer maxAttempts) {

    public static final RetryConfig DEFAULT = new RetryConfig(null, null, null, null);

    public RetryConfig {
        if (initialInterval == null) {
            initialInterval = Duration.ofMillis(200);
        }
        if (multiplier == null) {
            multiplier = 2.0;
        }
        if (maxInterval == null) {
            maxInterval = Duration.ofSeconds(100);
        }
        if (maxAttempts == null) {
            maxAttempts = 20;
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("retry multiplier must be at least 1.0, was " + multiplier);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("retry maxAttempts must not be negative, was " + maxAttempts);
        }
    }

    public GenericRetry toRetry() {
        return new GenericRetry()
                .setInitialInterval(initialInterval.toMillis())
                .setIntervalMultiplier(multiplier)
                .setMaxInterval(maxInterval.toMillis())
                .setMaxAttempts(maxAttempts);
    }
}
