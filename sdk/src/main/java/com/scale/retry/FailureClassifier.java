// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a failure is eligible for retry.
 *
 * <p>Matching is on the exact runtime class: configuring {@code IOException} does not make a
 * {@code FileNotFoundException} retryable. List every class that should be retried.
 */
public final class FailureClassifier {

    private FailureClassifier() {}

    /**
     * @param failure the failure raised by an attempt
     * @param retryableFailureKinds the configured kinds; empty means every kind is retryable
     * @return true if the failure may be retried
     */
    public static boolean isRetryable(
            Throwable failure, Optional<Set<Class<? extends Throwable>>> retryableFailureKinds) {
        return retryableFailureKinds
                .map(kinds -> kinds.contains(failure.getClass()))
                .orElse(true);
    }
}
