// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.execution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;

/**
 * Test timer that records every requested delay. In immediate mode tasks run inside {@code schedule}; in manual mode
 * they wait for {@link #fireNext()}.
 */
public class RecordingDelayScheduler implements DelayScheduler {
    private final boolean immediate;
    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private final List<PendingTask> pending = new CopyOnWriteArrayList<>();

    private RecordingDelayScheduler(boolean immediate) {
        this.immediate = immediate;
    }

    public static RecordingDelayScheduler immediate() {
        return new RecordingDelayScheduler(true);
    }

    public static RecordingDelayScheduler manual() {
        return new RecordingDelayScheduler(false);
    }

    @Override
    public Future<?> schedule(Runnable task, Duration delay) {
        delays.add(delay);
        var handle = new CompletableFuture<Void>();
        if (immediate) {
            task.run();
            handle.complete(null);
        } else {
            pending.add(new PendingTask(task, handle));
        }
        return handle;
    }

    /** Runs the oldest pending task unless it was cancelled. */
    public void fireNext() {
        if (pending.isEmpty()) {
            throw new IllegalStateException("No pending task");
        }
        var next = pending.remove(0);
        if (next.handle.complete(null)) {
            next.task.run();
        }
    }

    public List<Duration> recordedDelays() {
        return new ArrayList<>(delays);
    }

    public List<Long> recordedDelayMillis() {
        return delays.stream().map(Duration::toMillis).toList();
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isNextCancelled() {
        return !pending.isEmpty() && pending.get(0).handle.isCancelled();
    }

    private record PendingTask(Runnable task, CompletableFuture<Void> handle) {}
}
