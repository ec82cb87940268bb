// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stand-in for a remote inventory service. The first {@code failuresBeforeSuccess} lookups time out; later lookups
 * answer from an in-memory table. Unknown SKUs fail with {@link IllegalArgumentException}.
 */
public class InventoryClient {
    private final int failuresBeforeSuccess;
    private final AtomicInteger calls = new AtomicInteger();
    private final Map<String, Integer> stock = new ConcurrentHashMap<>();

    public InventoryClient(int failuresBeforeSuccess) {
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        stock.put("sku-100", 12);
        stock.put("sku-200", 0);
    }

    public CompletableFuture<Integer> fetchStock(String sku) {
        var call = calls.incrementAndGet();
        if (call <= failuresBeforeSuccess) {
            return CompletableFuture.failedFuture(new TimeoutException("inventory service timed out"));
        }
        var quantity = stock.get(sku);
        if (quantity == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("unknown sku " + sku));
        }
        return CompletableFuture.completedFuture(quantity);
    }

    public CompletableFuture<Void> reserve(String sku, int quantity) {
        var call = calls.incrementAndGet();
        if (call <= failuresBeforeSuccess) {
            return CompletableFuture.failedFuture(new TimeoutException("inventory service timed out"));
        }
        stock.merge(sku, -quantity, Integer::sum);
        return CompletableFuture.completedFuture(null);
    }

    public int calls() {
        return calls.get();
    }

    public int stockOf(String sku) {
        return stock.getOrDefault(sku, 0);
    }
}
