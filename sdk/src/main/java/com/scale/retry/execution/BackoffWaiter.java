// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.execution;

import com.scale.retry.cancellation.CancellationSignal;
import com.scale.retry.exception.RetryCancelledException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs the wait between two attempts and computes the delay for the next one.
 *
 * <p>The wait does not hold a thread: it is a timer on the {@link DelayScheduler} completing a future. Cancellation is
 * observed while the timer is pending and once more when it fires.
 */
public final class BackoffWaiter {
    private static final Logger logger = LoggerFactory.getLogger(BackoffWaiter.class);

    private final DelayScheduler scheduler;

    public BackoffWaiter(DelayScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    /**
     * Waits for {@code delay}, honouring cancellation.
     *
     * @param delay how long to wait; zero skips the timer but still checks cancellation
     * @param backoffEnabled whether the next delay is twice this one
     * @param cancellationSignal the signal to observe, if any
     * @return a future completing with the next delay, or exceptionally with {@link RetryCancelledException}; cancelling
     *     it releases the timer and the cancellation registration
     */
    public CompletableFuture<Duration> await(
            Duration delay, boolean backoffEnabled, Optional<CancellationSignal> cancellationSignal) {
        var nextDelay = backoffEnabled ? delay.multipliedBy(2) : delay;
        var signal = cancellationSignal.orElse(null);

        if (signal != null && signal.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new RetryCancelledException(delay));
        }
        if (delay.isZero()) {
            return CompletableFuture.completedFuture(nextDelay);
        }

        logger.debug("Waiting {} ms before the next attempt", delay.toMillis());
        var waitFuture = new CompletableFuture<Duration>();
        Future<?> timer = scheduler.schedule(
                () -> {
                    // the timer and a cancel request may land together; cancellation wins
                    if (signal != null && signal.isCancellationRequested()) {
                        waitFuture.completeExceptionally(new RetryCancelledException(delay));
                    } else {
                        waitFuture.complete(nextDelay);
                    }
                },
                delay);

        // however the wait ends, including cancel() by the caller, release the timer and the registration
        waitFuture.whenComplete((next, error) -> timer.cancel(false));
        if (signal != null) {
            var registration = signal.onCancellation(() -> {
                if (waitFuture.completeExceptionally(new RetryCancelledException(delay))) {
                    logger.debug("Wait of {} ms cancelled", delay.toMillis());
                }
            });
            waitFuture.whenComplete((next, error) -> registration.close());
        }
        return waitFuture;
    }
}
