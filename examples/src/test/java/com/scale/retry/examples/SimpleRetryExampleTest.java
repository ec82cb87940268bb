// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class SimpleRetryExampleTest {

    @Test
    void testSucceedsOnThirdAttempt() {
        var client = new InventoryClient(2);
        var example = new SimpleRetryExample(client);

        assertEquals(12, example.handleRequest("sku-100"));
        assertEquals(3, client.calls());
    }

    @Test
    void testExhaustedRetriesRethrowTimeout() {
        var client = new InventoryClient(3);
        var example = new SimpleRetryExample(client);

        var exception = assertThrows(TimeoutException.class, () -> example.handleRequest("sku-100"));

        assertEquals("inventory service timed out", exception.getMessage());
        assertEquals(3, client.calls());
    }
}
