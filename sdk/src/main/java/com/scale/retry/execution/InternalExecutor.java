// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.execution;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared executors used when a {@code RetryConfig} does not bring its own.
 *
 * <p>{@link #INSTANCE} starts the attempts that follow a wait. {@link #SCHEDULER} only fires wait timers and never runs
 * caller code, so a single thread is enough. Both use daemon threads and hold no per-call state.
 */
public final class InternalExecutor {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    /**
     * Shared executor for attempts after the first. Uses a cached thread pool that creates threads on demand, reuses
     * idle threads, and terminates threads after 60 seconds of inactivity by default.
     */
    public static final Executor INSTANCE = Executors.newCachedThreadPool(runnable -> {
        var thread = new Thread(runnable, "retry-executor-" + THREAD_COUNTER.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    });

    /** Shared timer for inter-attempt waits. Cancelled waits are removed from the queue right away. */
    public static final DelayScheduler SCHEDULER = new ScheduledExecutorDelayScheduler(createTimer());

    private InternalExecutor() {
        // Utility class
    }

    private static ScheduledThreadPoolExecutor createTimer() {
        var timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            var thread = new Thread(runnable, "retry-timer-" + THREAD_COUNTER.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }
}
