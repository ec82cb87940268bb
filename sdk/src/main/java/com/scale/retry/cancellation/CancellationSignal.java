// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.cancellation;

/**
 * Read side of a cooperative cancellation request.
 *
 * <p>The retry executor only looks at the signal around the wait between two attempts; an attempt that is already
 * running is never interrupted. Operations that want to stop early can consult the same signal themselves.
 */
public interface CancellationSignal {

    /** @return true once cancellation has been requested; never reverts to false */
    boolean isCancellationRequested();

    /**
     * Registers a callback to run when cancellation is requested. If cancellation was already requested the callback
     * runs on the calling thread before this method returns. Each callback runs at most once.
     *
     * @param callback the action to run on cancellation
     * @return a registration that detaches the callback when closed
     */
    Registration onCancellation(Runnable callback);

    /** Handle returned by {@link #onCancellation(Runnable)}. Closing it more than once is harmless. */
    @FunctionalInterface
    interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
