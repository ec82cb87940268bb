// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import com.scale.retry.RetryConfig;
import com.scale.retry.RetryExecutor;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example restricting retries to transient failures.
 *
 * <p>Timeouts are retried. An unknown SKU fails with {@link IllegalArgumentException}, which is not listed, so the
 * caller sees it after a single attempt and can fall back.
 */
public class SelectiveRetryExample {
    private static final Logger logger = LoggerFactory.getLogger(SelectiveRetryExample.class);

    private final InventoryClient client;
    private final RetryConfig config;

    public SelectiveRetryExample(InventoryClient client) {
        this.client = client;
        this.config = RetryConfig.builder()
                .maxAttempts(5)
                .initialDelayMillis(20)
                .retryOn(TimeoutException.class)
                .operationName("fetch-stock")
                .logger(logger)
                .build();
    }

    /** @return the stock of {@code sku}, or -1 when the service does not know it */
    public int handleRequest(String sku) {
        try {
            return RetryExecutor.call(() -> client.fetchStock(sku), config);
        } catch (IllegalArgumentException e) {
            logger.warn("Lookup rejected, not retrying: {}", e.getMessage());
            return -1;
        }
    }

    public static void main(String[] args) {
        var example = new SelectiveRetryExample(new InventoryClient(1));
        logger.info("Stock of sku-999: {}", example.handleRequest("sku-999"));
    }
}
