/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.config;

import java.time.Duration;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.javaoperatorsdk.operator.processing.event.rate.LinearRateLimiter;

import io.kubecsr.config.DurationSerde;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * At most {@code limit} reconciliations of one request per {@code period}.
 */
public record RateLimitConfig(@JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration period,
                              @Nullable Integer limit) {

    public static final RateLimitConfig DEFAULT = new RateLimitConfig(null, null);

    public RateLimitConfig {
        if (period == null) {
            period = Duration.ofSeconds(1);
        }
        if (limit == null) {
            limit = 10;
        }
        if (limit < 1) {
            throw new IllegalArgumentException("rate limit must be at least 1, was " + limit);
        }
    }

    public LinearRateLimiter toRateLimiter() {
        return new LinearRateLimiter(period, limit);
    }
}
