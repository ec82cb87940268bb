// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry;

import com.scale.retry.AttemptOutcome.Type;
import com.scale.retry.exception.RetryCancelledException;
import com.scale.retry.exception.RetryInvariantViolationException;
import com.scale.retry.execution.BackoffWaiter;
import com.scale.retry.logging.RetryLogSink;
import com.scale.retry.util.ExceptionHelper;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs an asynchronous operation, re-invoking it on failure until it succeeds, fails with a non-retryable kind, or runs
 * out of attempts.
 *
 * <p>Attempts are strictly sequential. Between two attempts the executor waits for the current delay without holding
 * a thread, doubling the delay afterwards when backoff is enabled. No wait follows the last attempt.
 *
 * <p>The returned future completes with:
 *
 * <ul>
 *   <li>the value of the first successful attempt;
 *   <li>the exact failure of the operation, when its kind is not retryable or when it happened on the last attempt;
 *   <li>a {@link RetryCancelledException} when the cancellation signal fires during or right after a wait.
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CompletableFuture<Order> order = RetryExecutor.execute(
 *         () -> client.fetchOrder(orderId),
 *         RetryConfig.builder().maxAttempts(4).initialDelayMillis(250).build());
 * }</pre>
 */
public final class RetryExecutor {
    /** MDC key holding the operation name while a retry record is logged. */
    public static final String MDC_OPERATION = "retryOperation";
    /** MDC key holding the attempt number while a retry record is logged. */
    public static final String MDC_ATTEMPT = "retryAttempt";

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private RetryExecutor() {}

    /**
     * Runs {@code operation} with {@link RetryConfig#defaults()}.
     *
     * @see #execute(AsyncOperation, RetryConfig)
     */
    public static <T> CompletableFuture<T> execute(AsyncOperation<T> operation) {
        return execute(operation, RetryConfig.defaults());
    }

    /**
     * Runs {@code operation} with retries. The first attempt starts on the calling thread.
     *
     * <p>Cancelling the returned future stops further attempts and releases a pending wait; an attempt already running
     * is left to finish.
     *
     * @param operation the operation to run
     * @param config the retry configuration
     * @param <T> the result type, {@code Void} for operations without a result
     * @return a future completing with the outcome of the retried operation
     */
    public static <T> CompletableFuture<T> execute(AsyncOperation<T> operation, RetryConfig config) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        var invocation = new Invocation<>(operation, config);
        invocation.startAttempt();
        return invocation.result;
    }

    /**
     * Blocking form of {@link #execute(AsyncOperation)}.
     *
     * @see #call(AsyncOperation, RetryConfig)
     */
    public static <T> T call(AsyncOperation<T> operation) {
        return call(operation, RetryConfig.defaults());
    }

    /**
     * Runs {@code operation} with retries and waits for the outcome. Failures are rethrown as the very object the
     * operation raised, including checked exceptions, rather than wrapped.
     *
     * @param operation the operation to run
     * @param config the retry configuration
     * @param <T> the result type
     * @return the value of the successful attempt
     */
    public static <T> T call(AsyncOperation<T> operation, RetryConfig config) {
        try {
            return execute(operation, config).join();
        } catch (CompletionException e) {
            ExceptionHelper.sneakyThrow(ExceptionHelper.unwrapCompletableFuture(e));
            throw e;
        }
    }

    /** State machine of a single {@code execute} call. */
    private static final class Invocation<T> {
        private final AsyncOperation<T> operation;
        private final RetryConfig config;
        private final BackoffWaiter waiter;
        private final AttemptState state;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        // attempts requested but not yet run; only the thread moving it away from 0 runs them
        private final AtomicInteger pendingAttempts = new AtomicInteger();
        private volatile CompletableFuture<Duration> pendingWait;
        private boolean logSinkFailureReported;

        private Invocation(AsyncOperation<T> operation, RetryConfig config) {
            this.operation = operation;
            this.config = config;
            this.waiter = new BackoffWaiter(config.delayScheduler());
            this.state = new AttemptState(config.initialDelay());
            result.whenComplete((value, error) -> {
                var wait = pendingWait;
                if (wait != null) {
                    wait.cancel(false);
                }
            });
        }

        /**
         * Runs the next attempt, or hands it to the attempt loop already running further up the stack. Operations and
         * waits that complete synchronously would otherwise nest deeper with every attempt.
         */
        private void startAttempt() {
            if (pendingAttempts.getAndIncrement() != 0) {
                return;
            }
            do {
                try {
                    runAttempt();
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            } while (pendingAttempts.decrementAndGet() != 0);
        }

        private void runAttempt() {
            if (state.attemptNumber() > config.maxAttempts()) {
                result.completeExceptionally(
                        new RetryInvariantViolationException(state.attemptNumber(), config.maxAttempts()));
                return;
            }
            if (result.isDone()) {
                logger.debug(
                        "{} completed by the caller, skipping attempt {}",
                        config.operationName(),
                        state.attemptNumber());
                return;
            }

            logger.debug(
                    "Starting attempt {} of {} for {}",
                    state.attemptNumber(),
                    config.maxAttempts(),
                    config.operationName());
            CompletionStage<T> stage;
            try {
                stage = operation.call();
            } catch (Throwable e) {
                onAttemptComplete(null, e);
                return;
            }
            if (stage == null) {
                onAttemptComplete(null, new NullPointerException("operation returned a null CompletionStage"));
                return;
            }
            stage.whenComplete(this::onAttemptComplete);
        }

        private void onAttemptComplete(T value, Throwable error) {
            handle(
                    error == null
                            ? AttemptOutcome.success(value)
                            : classify(ExceptionHelper.unwrapCompletableFuture(error)));
        }

        private void handle(AttemptOutcome<T> outcome) {
            switch (outcome.type()) {
                case SUCCESS -> result.complete(outcome.value());
                case NON_RETRYABLE_FAILURE -> {
                    logger.debug(
                            "{} failed with non-retryable {}",
                            config.operationName(),
                            outcome.failure().getClass().getName());
                    result.completeExceptionally(outcome.failure());
                }
                case TERMINAL_FAILURE -> {
                    logFailure(outcome.failure());
                    logProgress(String.format(
                            "Final attempt %d of %d for %s failed with %s.",
                            state.attemptNumber(),
                            config.maxAttempts(),
                            config.operationName(),
                            ExceptionHelper.describe(outcome.failure())));
                    result.completeExceptionally(outcome.failure());
                }
                case RETRYABLE_FAILURE -> {
                    logFailure(outcome.failure());
                    logProgress(String.format(
                            "Attempt %d of %d for %s failed with %s. Retrying in %d ms.",
                            state.attemptNumber(),
                            config.maxAttempts(),
                            config.operationName(),
                            ExceptionHelper.describe(outcome.failure()),
                            state.currentDelay().toMillis()));
                    waitAndRetry(outcome.failure());
                }
                case CANCELLED -> result.completeExceptionally(outcome.failure());
            }
        }

        private AttemptOutcome<T> classify(Throwable failure) {
            if (!FailureClassifier.isRetryable(failure, config.retryableFailureKinds())) {
                return AttemptOutcome.failure(Type.NON_RETRYABLE_FAILURE, failure);
            }
            if (state.attemptNumber() >= config.maxAttempts()) {
                return AttemptOutcome.failure(Type.TERMINAL_FAILURE, failure);
            }
            return AttemptOutcome.failure(Type.RETRYABLE_FAILURE, failure);
        }

        private void waitAndRetry(Throwable lastFailure) {
            CompletableFuture<Duration> wait;
            try {
                wait = waiter.await(state.currentDelay(), config.backoffEnabled(), config.cancellationSignal());
            } catch (RuntimeException e) {
                e.addSuppressed(lastFailure);
                result.completeExceptionally(e);
                return;
            }

            pendingWait = wait;
            if (result.isDone()) {
                wait.cancel(false);
            }

            wait.whenCompleteAsync(
                            (nextDelay, waitError) -> {
                                if (waitError == null) {
                                    state.advance(nextDelay);
                                    startAttempt();
                                    return;
                                }
                                var cause = ExceptionHelper.unwrapCompletableFuture(waitError);
                                cause.addSuppressed(lastFailure);
                                if (cause instanceof RetryCancelledException) {
                                    logger.debug(
                                            "{} cancelled after attempt {}",
                                            config.operationName(),
                                            state.attemptNumber());
                                    handle(AttemptOutcome.failure(Type.CANCELLED, cause));
                                } else {
                                    result.completeExceptionally(cause);
                                }
                            },
                            config.executor())
                    .exceptionally(e -> {
                        // executor rejected the continuation, or the next attempt could not be started
                        result.completeExceptionally(ExceptionHelper.unwrapCompletableFuture(e));
                        return null;
                    });
        }

        private void logFailure(Throwable failure) {
            log(sink -> sink.error(failure.getMessage(), failure));
        }

        private void logProgress(String message) {
            log(sink -> sink.info(message));
        }

        private void log(Consumer<RetryLogSink> action) {
            var sink = config.logSink();
            if (sink.isEmpty()) {
                return;
            }
            MDC.put(MDC_OPERATION, config.operationName());
            MDC.put(MDC_ATTEMPT, String.valueOf(state.attemptNumber()));
            try {
                action.accept(sink.get());
            } catch (RuntimeException e) {
                if (!logSinkFailureReported) {
                    logSinkFailureReported = true;
                    logger.warn(
                            "Log sink of {} failed, continuing without it: {}",
                            config.operationName(),
                            e.getMessage(),
                            e);
                }
            } finally {
                MDC.remove(MDC_OPERATION);
                MDC.remove(MDC_ATTEMPT);
            }
        }
    }
}
