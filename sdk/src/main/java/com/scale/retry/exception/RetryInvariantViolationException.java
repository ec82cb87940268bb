// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.exception;

/**
 * Exception signalled when an attempt is about to start past the configured attempt limit. Every path of the retry
 * loop terminates at or before the last attempt, so this is never raised for a valid configuration.
 */
public class RetryInvariantViolationException extends RetryException {
    private final int attemptNumber;
    private final int maxAttempts;

    public RetryInvariantViolationException(int attemptNumber, int maxAttempts) {
        super(String.format("Attempt %d started although maxAttempts is %d", attemptNumber, maxAttempts));
        this.attemptNumber = attemptNumber;
        this.maxAttempts = maxAttempts;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
