// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.cancellation;

import static org.junit.jupiter.api.Assertions.*;

import com.scale.retry.execution.RecordingDelayScheduler;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSourceTest {

    @Test
    void startsNotCancelled() {
        var source = new CancellationSource();

        assertFalse(source.isCancellationRequested());
        assertFalse(source.signal().isCancellationRequested());
    }

    @Test
    void cancelIsVisibleThroughSignal() {
        var source = new CancellationSource();

        source.cancel();

        assertTrue(source.isCancellationRequested());
        assertTrue(source.signal().isCancellationRequested());
    }

    @Test
    void callbacksRunOnceEvenWhenCancelledTwice() {
        var source = new CancellationSource();
        var calls = new AtomicInteger();
        source.signal().onCancellation(calls::incrementAndGet);

        source.cancel();
        source.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        var source = new CancellationSource();
        source.cancel();
        var calls = new AtomicInteger();

        source.signal().onCancellation(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void closedRegistrationIsNotNotified() {
        var source = new CancellationSource();
        var calls = new AtomicInteger();
        var registration = source.signal().onCancellation(calls::incrementAndGet);

        registration.close();
        registration.close();
        source.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        var source = new CancellationSource();
        var calls = new AtomicInteger();
        source.signal().onCancellation(() -> {
            throw new IllegalStateException("callback failed");
        });
        source.signal().onCancellation(calls::incrementAndGet);

        source.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void cancelAfterUsesGivenScheduler() {
        var scheduler = RecordingDelayScheduler.manual();
        var source = new CancellationSource();

        source.cancelAfter(Duration.ofSeconds(30), scheduler);

        assertFalse(source.isCancellationRequested());
        assertEquals(List.of(Duration.ofSeconds(30)), scheduler.recordedDelays());
        scheduler.fireNext();
        assertTrue(source.isCancellationRequested());
    }

    @Test
    void cancelAfterCanBeAborted() {
        var scheduler = RecordingDelayScheduler.manual();
        var source = new CancellationSource();

        var pending = source.cancelAfter(Duration.ofSeconds(30), scheduler);
        pending.cancel(false);
        scheduler.fireNext();

        assertFalse(source.isCancellationRequested());
    }

    @Test
    void cancelAfterOnSharedTimer() throws InterruptedException {
        var source = new CancellationSource();
        var latch = new CountDownLatch(1);
        source.signal().onCancellation(latch::countDown);

        source.cancelAfter(Duration.ofMillis(10));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertTrue(source.isCancellationRequested());
    }

    @Test
    void cancelAfterRejectsNegativeDelay() {
        var source = new CancellationSource();

        var exception = assertThrows(IllegalArgumentException.class, () -> source.cancelAfter(Duration.ofMillis(-1)));
        assertEquals("delay cannot be negative, got: PT-0.001S", exception.getMessage());
    }
}
