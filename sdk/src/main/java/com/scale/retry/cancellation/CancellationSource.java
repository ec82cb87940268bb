// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.cancellation;

import com.scale.retry.execution.DelayScheduler;
import com.scale.retry.execution.InternalExecutor;
import com.scale.retry.validation.ParameterValidator;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owning side of a cancellation request. Hand {@link #signal()} to the code that should observe cancellation and keep
 * the source to trigger it.
 *
 * <pre>{@code
 * var source = new CancellationSource();
 * source.cancelAfter(Duration.ofSeconds(30));
 * var config = RetryConfig.builder().cancellationSignal(source.signal()).build();
 * }</pre>
 */
public final class CancellationSource {
    private static final Logger logger = LoggerFactory.getLogger(CancellationSource.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();
    private final CancellationSignal signal = new Signal();

    /** @return the signal observing this source */
    public CancellationSignal signal() {
        return signal;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /** Requests cancellation and runs the registered callbacks. Subsequent calls do nothing. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        logger.debug("Cancellation requested, notifying {} callback(s)", callbacks.size());
        for (var callback : callbacks) {
            fire(callback);
        }
    }

    /**
     * Requests cancellation once {@code delay} has elapsed, using the shared timer.
     *
     * @param delay time until cancellation
     * @return handle that aborts the pending cancellation when cancelled
     */
    public Future<?> cancelAfter(Duration delay) {
        return cancelAfter(delay, InternalExecutor.SCHEDULER);
    }

    /**
     * Requests cancellation once {@code delay} has elapsed on the given scheduler.
     *
     * @param delay time until cancellation
     * @param scheduler timer to use
     * @return handle that aborts the pending cancellation when cancelled
     */
    public Future<?> cancelAfter(Duration delay, DelayScheduler scheduler) {
        ParameterValidator.validateNonNegativeDuration(delay, "delay");
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        return scheduler.schedule(this::cancel, delay);
    }

    private void fire(Callback callback) {
        // removal decides which thread runs the callback
        if (!callbacks.remove(callback)) {
            return;
        }
        try {
            callback.action.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    private static final class Callback {
        private final Runnable action;

        private Callback(Runnable action) {
            this.action = action;
        }
    }

    private final class Signal implements CancellationSignal {
        @Override
        public boolean isCancellationRequested() {
            return cancelled.get();
        }

        @Override
        public Registration onCancellation(Runnable callback) {
            Objects.requireNonNull(callback, "callback cannot be null");
            var entry = new Callback(callback);
            callbacks.add(entry);
            if (cancelled.get()) {
                fire(entry);
            }
            return () -> callbacks.remove(entry);
        }
    }
}
