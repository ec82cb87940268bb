// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry;

/** Classified result of one attempt, driving the next step of the retry loop. */
final class AttemptOutcome<T> {

    enum Type {
        /** The attempt produced a value. */
        SUCCESS,
        /** The attempt failed, is eligible for retry and attempts remain. */
        RETRYABLE_FAILURE,
        /** The attempt failed on the last allowed attempt. */
        TERMINAL_FAILURE,
        /** The attempt failed with a kind outside the retryable set. */
        NON_RETRYABLE_FAILURE,
        /** Cancellation was observed around the wait after a failed attempt. */
        CANCELLED
    }

    private final Type type;
    private final T value;
    private final Throwable failure;

    private AttemptOutcome(Type type, T value, Throwable failure) {
        this.type = type;
        this.value = value;
        this.failure = failure;
    }

    static <T> AttemptOutcome<T> success(T value) {
        return new AttemptOutcome<>(Type.SUCCESS, value, null);
    }

    static <T> AttemptOutcome<T> failure(Type type, Throwable failure) {
        if (type == Type.SUCCESS) {
            throw new IllegalArgumentException("A failure outcome cannot be of type SUCCESS");
        }
        return new AttemptOutcome<>(type, null, failure);
    }

    Type type() {
        return type;
    }

    T value() {
        return value;
    }

    Throwable failure() {
        return failure;
    }

    @Override
    public String toString() {
        return type == Type.SUCCESS
                ? "AttemptOutcome{SUCCESS}"
                : String.format("AttemptOutcome{%s, %s}", type, failure);
    }
}
