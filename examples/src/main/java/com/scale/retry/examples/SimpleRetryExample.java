// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import com.scale.retry.RetryConfig;
import com.scale.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example retrying a value-returning lookup against a flaky service with exponential backoff.
 *
 * <p>With two timeouts before the service answers and the defaults of 3 attempts, the lookup waits 100 ms then 200 ms
 * and succeeds on the third attempt.
 */
public class SimpleRetryExample {
    private static final Logger logger = LoggerFactory.getLogger(SimpleRetryExample.class);

    private final InventoryClient client;
    private final RetryConfig config;

    public SimpleRetryExample(InventoryClient client) {
        this.client = client;
        this.config = RetryConfig.builder()
                .initialDelayMillis(100)
                .operationName("fetch-stock")
                .logger(logger)
                .build();
    }

    public int handleRequest(String sku) {
        return RetryExecutor.call(() -> client.fetchStock(sku), config);
    }

    public static void main(String[] args) {
        var example = new SimpleRetryExample(new InventoryClient(2));
        logger.info("Stock of sku-100: {}", example.handleRequest("sku-100"));
    }
}
