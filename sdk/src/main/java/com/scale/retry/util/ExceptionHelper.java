// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Utility class for handling exceptions */
public final class ExceptionHelper {

    private ExceptionHelper() {}

    /**
     * Throws any exception as if it were unchecked using type erasure. This preserves the original exception type and
     * stack trace.
     *
     * @param exception the exception to throw
     * @param <T> the exception type (erased at runtime)
     * @throws T the exception as an unchecked exception
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void sneakyThrow(Throwable exception) throws T {
        throw (T) exception;
    }

    /**
     * unwrap the exception that is wrapped by CompletionException or ExecutionException
     *
     * @param throwable the throwable to unwrap
     * @return the original Throwable; a wrapper without a cause is returned as is
     */
    public static Throwable unwrapCompletableFuture(Throwable throwable) {
        while ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
                && throwable.getCause() != null) {
            throwable = throwable.getCause();
        }
        return throwable;
    }

    /**
     * Describes a failure for a log line.
     *
     * @param throwable the failure
     * @return the message of the failure, or its class name when it has no message
     */
    public static String describe(Throwable throwable) {
        var message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getName();
    }
}
