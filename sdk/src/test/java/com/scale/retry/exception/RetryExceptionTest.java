// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryExceptionTest {

    @Test
    void cancelledExceptionDescribesInterruptedWait() {
        var exception = new RetryCancelledException(Duration.ofMillis(2000));

        assertInstanceOf(RetryException.class, exception);
        assertEquals(Duration.ofMillis(2000), exception.getInterruptedDelay());
        assertEquals("Retry cancelled while waiting 2000 ms before the next attempt", exception.getMessage());
    }

    @Test
    void invariantViolationReportsAttemptAndLimit() {
        var exception = new RetryInvariantViolationException(4, 3);

        assertInstanceOf(RetryException.class, exception);
        assertEquals(4, exception.getAttemptNumber());
        assertEquals(3, exception.getMaxAttempts());
        assertEquals("Attempt 4 started although maxAttempts is 3", exception.getMessage());
    }

    @Test
    void baseExceptionKeepsCause() {
        var cause = new IllegalStateException("root");

        var exception = new RetryException("wrapped", cause);

        assertEquals("wrapped", exception.getMessage());
        assertSame(cause, exception.getCause());
    }
}
