// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry;

import java.util.concurrent.CompletionStage;

/**
 * Zero-argument asynchronous operation wrapped by {@link RetryExecutor}. Operations without a result use {@code Void}
 * and complete with {@code null}.
 *
 * <p>A failed attempt is either an exception thrown by {@link #call()} or a stage completing exceptionally. Both are
 * handled the same way.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    /**
     * Starts one attempt.
     *
     * @return a stage completing with the attempt's result
     * @throws Exception if the attempt fails before producing a stage
     */
    CompletionStage<T> call() throws Exception;
}
