// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.examples;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SelectiveRetryExampleTest {

    @Test
    void testTimeoutRetriedThenKnownSkuAnswered() {
        var client = new InventoryClient(1);

        assertEquals(0, new SelectiveRetryExample(client).handleRequest("sku-200"));
        assertEquals(2, client.calls());
    }

    @Test
    void testUnknownSkuNotRetried() {
        var client = new InventoryClient(1);

        assertEquals(-1, new SelectiveRetryExample(client).handleRequest("sku-999"));
        // one timeout, then a single rejected lookup
        assertEquals(2, client.calls());
    }
}
