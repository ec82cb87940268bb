// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.logging;

import java.util.Objects;
import org.slf4j.Logger;

/**
 * {@link RetryLogSink} writing to an SLF4J {@link Logger}. Records carry the MDC keys
 * {@link com.scale.retry.RetryExecutor#MDC_OPERATION} and {@link com.scale.retry.RetryExecutor#MDC_ATTEMPT}, so layouts
 * can print them.
 */
public class Slf4jRetryLogSink implements RetryLogSink {
    private final Logger delegate;

    public Slf4jRetryLogSink(Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    }

    @Override
    public void error(String message, Throwable failure) {
        delegate.error(message, failure);
    }

    @Override
    public void info(String message) {
        delegate.info(message);
    }
}
