/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.retry;

import java.time.Duration;
import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialJitterBackoffStrategyTest {

    @Test
    void noDelayBeforeFirstFailure() {
        var strategy = new ExponentialJitterBackoffStrategy(Duration.ofMillis(200), null, 2.0, 0.0, new Random(0));
        assertThat(strategy.getDelay(0)).isZero();
    }

    @Test
    void growsExponentiallyWithoutJitter() {
        // Given
        var strategy = new ExponentialJitterBackoffStrategy(Duration.ofSeconds(5), null, 1.5, 0.0, new Random(0));

        // Then
        assertThat(strategy.getDelay(1)).isEqualTo(Duration.ofMillis(5000));
        assertThat(strategy.getDelay(2)).isEqualTo(Duration.ofMillis(7500));
        assertThat(strategy.getDelay(3)).isEqualTo(Duration.ofMillis(11250));
    }

    @Test
    void jitterStretchesDelayByAtMostTheJitterFraction() {
        // Given
        var strategy = new ExponentialJitterBackoffStrategy(Duration.ofSeconds(1), null, 2.0, 1.0, new Random(42));

        // Then
        for (int i = 0; i < 100; i++) {
            assertThat(strategy.getDelay(2)).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(4));
        }
    }

    @Test
    void cappedAtMaximum() {
        var strategy = new ExponentialJitterBackoffStrategy(Duration.ofMillis(200), Duration.ofSeconds(100), 2.0, 0.0, new Random(0));
        assertThat(strategy.getDelay(30)).isEqualTo(Duration.ofSeconds(100));
    }

    @Test
    void rejectsShrinkingMultiplier() {
        assertThatThrownBy(() -> new ExponentialJitterBackoffStrategy(Duration.ofMillis(200), null, 0.5, 0.0, new Random(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
