// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry;

import com.scale.retry.cancellation.CancellationSignal;
import com.scale.retry.execution.DelayScheduler;
import com.scale.retry.execution.InternalExecutor;
import com.scale.retry.logging.RetryLogSink;
import com.scale.retry.validation.ParameterValidator;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import org.slf4j.Logger;

/**
 * Configuration of a {@link RetryExecutor} call. Instances are immutable and may be shared between calls.
 *
 * <p>Defaults: 3 attempts, 1000 ms before the second attempt, doubling after every wait, every failure kind retryable,
 * no cancellation, no logging.
 *
 * <pre>{@code
 * var config = RetryConfig.builder()
 *     .maxAttempts(5)
 *     .initialDelayMillis(200)
 *     .retryOn(TimeoutException.class, ConnectException.class)
 *     .logger(LoggerFactory.getLogger(InventoryClient.class))
 *     .build();
 * }</pre>
 */
public final class RetryConfig {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(1000);
    public static final boolean DEFAULT_BACKOFF_ENABLED = true;
    public static final String DEFAULT_OPERATION_NAME = "operation";

    private static final RetryConfig DEFAULTS = builder().build();

    private final int maxAttempts;
    private final Duration initialDelay;
    private final boolean backoffEnabled;
    private final Set<Class<? extends Throwable>> retryableFailureKinds;
    private final CancellationSignal cancellationSignal;
    private final RetryLogSink logSink;
    private final String operationName;
    private final Executor executor;
    private final DelayScheduler delayScheduler;

    private RetryConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts != null ? builder.maxAttempts : DEFAULT_MAX_ATTEMPTS;
        this.initialDelay = builder.initialDelay != null ? builder.initialDelay : DEFAULT_INITIAL_DELAY;
        this.backoffEnabled = builder.backoffEnabled != null ? builder.backoffEnabled : DEFAULT_BACKOFF_ENABLED;
        this.retryableFailureKinds =
                builder.retryableFailureKinds != null ? Set.copyOf(builder.retryableFailureKinds) : null;
        this.cancellationSignal = builder.cancellationSignal;
        this.logSink = builder.logSink;
        this.operationName = builder.operationName != null ? builder.operationName : DEFAULT_OPERATION_NAME;
        this.executor = builder.executor != null ? builder.executor : InternalExecutor.INSTANCE;
        this.delayScheduler = builder.delayScheduler != null ? builder.delayScheduler : InternalExecutor.SCHEDULER;
    }

    /** @return the default configuration */
    public static RetryConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder for RetryConfig.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** @return total number of attempts, including the first one */
    public int maxAttempts() {
        return maxAttempts;
    }

    /** @return the wait before the second attempt */
    public Duration initialDelay() {
        return initialDelay;
    }

    /** @return whether the wait doubles after every retried attempt */
    public boolean backoffEnabled() {
        return backoffEnabled;
    }

    /** @return the failure classes eligible for retry, or empty when every failure is retried */
    public Optional<Set<Class<? extends Throwable>>> retryableFailureKinds() {
        return Optional.ofNullable(retryableFailureKinds);
    }

    /** @return the cancellation signal, or empty when the call cannot be cancelled */
    public Optional<CancellationSignal> cancellationSignal() {
        return Optional.ofNullable(cancellationSignal);
    }

    /** @return the log sink, or empty when nothing is logged */
    public Optional<RetryLogSink> logSink() {
        return Optional.ofNullable(logSink);
    }

    /** @return the name of the wrapped operation used in log messages */
    public String operationName() {
        return operationName;
    }

    /** @return the executor starting attempts after a wait (never null) */
    public Executor executor() {
        return executor;
    }

    /** @return the timer used for waits between attempts (never null) */
    public DelayScheduler delayScheduler() {
        return delayScheduler;
    }

    @Override
    public String toString() {
        return String.format(
                "RetryConfig{operationName=%s, maxAttempts=%d, initialDelay=%s, backoffEnabled=%s, retryableFailureKinds=%s}",
                operationName,
                maxAttempts,
                initialDelay,
                backoffEnabled,
                retryableFailureKinds != null ? retryableFailureKinds : "all");
    }

    /** Builder for creating RetryConfig instances. */
    public static final class Builder {
        private Integer maxAttempts;
        private Duration initialDelay;
        private Boolean backoffEnabled;
        private Collection<Class<? extends Throwable>> retryableFailureKinds;
        private CancellationSignal cancellationSignal;
        private RetryLogSink logSink;
        private String operationName;
        private Executor executor;
        private DelayScheduler delayScheduler;

        private Builder() {}

        /**
         * Sets the total number of attempts, including the first. 1 means a single attempt without retry.
         *
         * @param maxAttempts at least 1, defaults to 3
         * @return this builder for method chaining
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the wait before the second attempt.
         *
         * @param initialDelay zero or positive, defaults to 1000 ms
         * @return this builder for method chaining
         * @throws IllegalArgumentException if {@code initialDelay} is null or negative
         */
        public Builder initialDelay(Duration initialDelay) {
            ParameterValidator.validateNonNegativeDuration(initialDelay, "initialDelay");
            this.initialDelay = initialDelay;
            return this;
        }

        /**
         * Sets the wait before the second attempt in milliseconds.
         *
         * @param initialDelayMs zero or positive, defaults to 1000
         * @return this builder for method chaining
         * @throws IllegalArgumentException if {@code initialDelayMs} is negative
         */
        public Builder initialDelayMillis(long initialDelayMs) {
            return initialDelay(Duration.ofMillis(initialDelayMs));
        }

        /**
         * Sets whether the wait doubles after every retried attempt.
         *
         * @param backoffEnabled defaults to true
         * @return this builder for method chaining
         */
        public Builder backoffEnabled(boolean backoffEnabled) {
            this.backoffEnabled = backoffEnabled;
            return this;
        }

        /**
         * Restricts retries to failures whose exact class is listed. Other failures propagate on first occurrence.
         *
         * @param retryableFailureKinds the retryable classes, or null to retry every failure (the default)
         * @return this builder for method chaining
         */
        public Builder retryableFailureKinds(Collection<Class<? extends Throwable>> retryableFailureKinds) {
            this.retryableFailureKinds = retryableFailureKinds;
            return this;
        }

        /**
         * Varargs form of {@link #retryableFailureKinds(Collection)}.
         *
         * @param retryableFailureKinds the retryable classes
         * @return this builder for method chaining
         */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... retryableFailureKinds) {
            return retryableFailureKinds(Arrays.asList(retryableFailureKinds));
        }

        /**
         * Sets the signal checked around each wait.
         *
         * @param cancellationSignal the signal, or null if the call cannot be cancelled (the default)
         * @return this builder for method chaining
         */
        public Builder cancellationSignal(CancellationSignal cancellationSignal) {
            this.cancellationSignal = cancellationSignal;
            return this;
        }

        /**
         * Sets the sink receiving retry log records.
         *
         * @param logSink the sink, or null to disable logging (the default)
         * @return this builder for method chaining
         */
        public Builder logSink(RetryLogSink logSink) {
            this.logSink = logSink;
            return this;
        }

        /**
         * Logs retry records to an SLF4J logger.
         *
         * @param logger the logger, or null to disable logging
         * @return this builder for method chaining
         */
        public Builder logger(Logger logger) {
            return logSink(logger != null ? RetryLogSink.slf4j(logger) : null);
        }

        /**
         * Sets the name of the wrapped operation used in log messages.
         *
         * @param operationName defaults to "operation"
         * @return this builder for method chaining
         */
        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        /**
         * Sets the executor starting attempts after a wait.
         *
         * @param executor the executor, or null for the shared daemon pool
         * @return this builder for method chaining
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Sets the timer used for waits.
         *
         * @param delayScheduler the timer, or null for the shared daemon timer
         * @return this builder for method chaining
         */
        public Builder delayScheduler(DelayScheduler delayScheduler) {
            this.delayScheduler = delayScheduler;
            return this;
        }

        /**
         * Builds the RetryConfig instance.
         *
         * @return a new RetryConfig with the configured options
         * @throws IllegalArgumentException if an option is out of range
         */
        public RetryConfig build() {
            if (maxAttempts != null) {
                ParameterValidator.validatePositiveInteger(maxAttempts, "maxAttempts");
            }
            if (retryableFailureKinds != null) {
                ParameterValidator.validateNoNullElements(retryableFailureKinds, "retryableFailureKinds");
            }
            return new RetryConfig(this);
        }
    }
}
