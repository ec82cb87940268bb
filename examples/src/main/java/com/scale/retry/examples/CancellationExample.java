// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import com.scale.retry.RetryConfig;
import com.scale.retry.RetryExecutor;
import com.scale.retry.cancellation.CancellationSource;
import com.scale.retry.exception.RetryCancelledException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example bounding the total time spent retrying with a deadline. The executor has no per-attempt timeout; a
 * {@link CancellationSource} cancelled after the deadline stops the retries at the next wait.
 */
public class CancellationExample {
    private static final Logger logger = LoggerFactory.getLogger(CancellationExample.class);

    private final InventoryClient client;
    private final Duration deadline;

    public CancellationExample(InventoryClient client, Duration deadline) {
        this.client = client;
        this.deadline = deadline;
    }

    /** @return the stock of {@code sku}, or {@code null} when the deadline passed first */
    public Integer handleRequest(String sku) {
        var source = new CancellationSource();
        var timer = source.cancelAfter(deadline);
        var config = RetryConfig.builder()
                .maxAttempts(10)
                .initialDelayMillis(200)
                .cancellationSignal(source.signal())
                .operationName("fetch-stock")
                .logger(logger)
                .build();
        try {
            return RetryExecutor.call(() -> client.fetchStock(sku), config);
        } catch (RetryCancelledException e) {
            logger.warn("Gave up on {} after {} ms: {}", sku, deadline.toMillis(), e.getMessage());
            return null;
        } finally {
            timer.cancel(false);
        }
    }

    public static void main(String[] args) {
        var example = new CancellationExample(new InventoryClient(Integer.MAX_VALUE), Duration.ofMillis(500));
        logger.info("Stock of sku-100: {}", example.handleRequest("sku-100"));
    }
}
