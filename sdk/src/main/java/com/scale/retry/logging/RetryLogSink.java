// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.logging;

import org.slf4j.Logger;

/**
 * Receives the log records produced while retrying. Messages arrive fully formatted.
 *
 * <p>Implementations should not throw; if one does, the retry executor reports it and carries on.
 */
public interface RetryLogSink {

    /**
     * Records a failed attempt.
     *
     * @param message the failure message
     * @param failure the failure raised by the attempt
     */
    void error(String message, Throwable failure);

    /**
     * Records retry progress: which attempt failed and what happens next.
     *
     * @param message the progress message
     */
    void info(String message);

    /**
     * Creates a sink writing to an SLF4J logger.
     *
     * @param logger the logger to write to
     * @return a sink backed by {@code logger}
     */
    static RetryLogSink slf4j(Logger logger) {
        return new Slf4jRetryLogSink(logger);
    }
}
