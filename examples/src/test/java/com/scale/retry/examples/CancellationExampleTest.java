// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class CancellationExampleTest {

    @Test
    void testDeadlineStopsRetries() {
        var client = new InventoryClient(Integer.MAX_VALUE);
        var example = new CancellationExample(client, Duration.ofMillis(100));

        var start = System.nanoTime();
        assertNull(example.handleRequest("sku-100"));
        var elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals(1, client.calls());
        assertTrue(elapsedMs < 2_000, "cancelled wait should end early, took " + elapsedMs + " ms");
    }

    @Test
    void testAnswerBeforeDeadline() {
        var client = new InventoryClient(0);

        assertEquals(12, new CancellationExample(client, Duration.ofSeconds(5)).handleRequest("sku-100"));
        assertEquals(1, client.calls());
    }
}
