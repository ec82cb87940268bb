// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.execution;

import java.time.Duration;
import java.util.concurrent.Future;

/**
 * Timer used for the waits between attempts. The task only completes a future, so implementations may run it on their
 * own timer thread.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * Runs {@code task} once after {@code delay}.
     *
     * @param task the task to run
     * @param delay how long to wait; never negative
     * @return handle whose {@code cancel} drops the task if it has not run yet
     */
    Future<?> schedule(Runnable task, Duration delay);
}
