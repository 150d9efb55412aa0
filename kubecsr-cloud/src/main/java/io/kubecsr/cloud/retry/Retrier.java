/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.retry;

import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kubecsr.cloud.ResolutionException;

/**
 * Retries an action while it fails with a {@link ResolutionException.Kind#TRANSIENT transient}
 * {@link ResolutionException}. Any other failure is rethrown at once. When the attempts are used up
 * the last transient failure is rethrown.
 */
public class Retrier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Retrier.class);

    private final int maxAttempts;
    private final BackoffStrategy backoffStrategy;
    private final Sleeper sleeper;

    public Retrier(int maxAttempts, BackoffStrategy backoffStrategy, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoffStrategy = backoffStrategy;
        this.sleeper = sleeper;
    }

    public static Retrier once() {
        return new Retrier(1, failures -> Duration.ZERO, Sleeper.SYSTEM);
    }

    public <T> T call(String operation, Supplier<T> action) {
        int failures = 0;
        while (true) {
            try {
                return action.get();
            }
            catch (ResolutionException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                failures++;
                if (failures >= maxAttempts) {
                    LOGGER.warn("{} failed after {} attempt(s): {}", operation, failures, e.getMessage());
                    throw e;
                }
                Duration delay = backoffStrategy.getDelay(failures);
                LOGGER.warn("{} failed (attempt {} of {}), retrying in {}: {}", operation, failures, maxAttempts, delay, e.getMessage());
                pause(operation, delay, e);
            }
        }
    }

    private void pause(String operation, Duration delay, ResolutionException cause) {
        try {
            sleeper.sleep(delay);
        }
        catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ResolutionException interrupted = ResolutionException.transientFailure(operation + " interrupted while backing off", ie);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
