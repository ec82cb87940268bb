// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.scale.retry.validation;

import java.time.Duration;
import java.util.Collection;

/**
 * Utility class for validating retry configuration parameters.
 *
 * <p>Provides common validation methods to ensure consistent error messages and validation logic across the library.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a duration is present and not negative.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public static void validateNonNegativeDuration(Duration duration, String parameterName) {
        if (duration == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " cannot be negative, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is positive (greater than 0).
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or not positive
     */
    public static void validatePositiveInteger(Integer value, String parameterName) {
        if (value == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a collection is present and holds no null element.
     *
     * @param values the collection to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if the collection or one of its elements is null
     */
    public static void validateNoNullElements(Collection<?> values, String parameterName) {
        if (values == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        for (var value : values) {
            if (value == null) {
                throw new IllegalArgumentException(parameterName + " cannot contain null elements");
            }
        }
    }
}
