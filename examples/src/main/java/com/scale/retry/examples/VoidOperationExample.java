// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import com.scale.retry.RetryConfig;
import com.scale.retry.RetryExecutor;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Example retrying an operation without a result. Such operations are typed {@code Void}. */
public class VoidOperationExample {
    private static final Logger logger = LoggerFactory.getLogger(VoidOperationExample.class);

    private final InventoryClient client;
    private final RetryConfig config;

    public VoidOperationExample(InventoryClient client) {
        this.client = client;
        this.config = RetryConfig.builder()
                .maxAttempts(4)
                .initialDelayMillis(50)
                .backoffEnabled(false)
                .operationName("reserve-stock")
                .logger(logger)
                .build();
    }

    public CompletableFuture<Void> handleRequest(String sku, int quantity) {
        return RetryExecutor.execute(() -> client.reserve(sku, quantity), config)
                .thenRun(() -> logger.info("Reserved {} x {}", quantity, sku));
    }

    public static void main(String[] args) {
        var client = new InventoryClient(1);
        new VoidOperationExample(client).handleRequest("sku-100", 3).join();
        logger.info("Remaining stock of sku-100: {}", client.stockOf("sku-100"));
    }
}
