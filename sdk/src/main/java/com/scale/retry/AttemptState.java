// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry;

import java.time.Duration;

/** Progress of one {@link RetryExecutor#execute} call. Confined to that call; attempts never overlap. */
final class AttemptState {
    private int attemptNumber = 1;
    private Duration currentDelay;

    AttemptState(Duration initialDelay) {
        this.currentDelay = initialDelay;
    }

    int attemptNumber() {
        return attemptNumber;
    }

    Duration currentDelay() {
        return currentDelay;
    }

    /** Moves to the next attempt after a completed wait. */
    void advance(Duration nextDelay) {
        attemptNumber++;
        currentDelay = nextDelay;
    }
}
