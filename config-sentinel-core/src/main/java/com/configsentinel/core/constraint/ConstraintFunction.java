package com.configsentinel.core.constraint;

import com.configsentinel.core.model.ValidationError;

import java.util.List;

/**
 * Pure check of one value.
 *
 * @param <T> type of the checked value
 */
@FunctionalInterface
public interface ConstraintFunction<T> {

    /**
     * Checks a value.
     *
     * @param value value to check
     * @param fieldName name of the field holding the value, used in messages
     * @return diagnostics, empty if the value passes
     */
    List<ValidationError> apply(T value, String fieldName);
}
