// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.exception;

import java.time.Duration;

/**
 * Exception signalled when the cancellation signal fires while waiting between attempts, or right as the wait ends.
 *
 * <p>The failure of the attempt that preceded the wait, when known, is attached as a suppressed exception.
 */
public class RetryCancelledException extends RetryException {
    private final Duration interruptedDelay;

    public RetryCancelledException(Duration interruptedDelay) {
        super(formatMessage(interruptedDelay));
        this.interruptedDelay = interruptedDelay;
    }

    /** @return the delay that was being waited when cancellation was observed */
    public Duration getInterruptedDelay() {
        return interruptedDelay;
    }

    private static String formatMessage(Duration delay) {
        return String.format("Retry cancelled while waiting %d ms before the next attempt", delay.toMillis());
    }
}
