package com.formulagraph.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.*;

/**
 * Outcome of evaluating one formula: a number, string or boolean value, or a typed error.
 * References that were missing from the context and replaced by the fallback value are
 * listed in defaultedReferences, so a caller can tell fallback-based results from
 * results computed on real data.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EvaluationResult {

    private final Object value;
    private final EvaluationErrorType errorType;
    private final String errorMessage;
    private final List<String> defaultedReferences;

    private EvaluationResult(Object value, EvaluationErrorType errorType, String errorMessage,
                             Collection<QualifiedAddress> defaulted) {
        this.value = value;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        List<String> keys = new ArrayList<>();
        for (QualifiedAddress address : defaulted) {
            keys.add(address.toString());
        }
        this.defaultedReferences = Collections.unmodifiableList(keys);
    }

    public static EvaluationResult success(Object value, Collection<QualifiedAddress> defaulted) {
        return new EvaluationResult(value, null, null, defaulted);
    }

    public static EvaluationResult success(Object value) {
        return success(value, Collections.emptyList());
    }

    public static EvaluationResult failure(EvaluationErrorType type, String message,
                                           Collection<QualifiedAddress> defaulted) {
        return new EvaluationResult(null, Objects.requireNonNull(type, "type"), message, defaulted);
    }

    public static EvaluationResult failure(EvaluationErrorType type, String message) {
        return failure(type, message, Collections.emptyList());
    }

    public Object getValue() {
        return value;
    }

    public EvaluationErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<String> getDefaultedReferences() {
        return defaultedReferences;
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    /**
     * True when at least one reference was evaluated with the fallback value.
     */
    public boolean isDefaulted() {
        return !defaultedReferences.isEmpty();
    }

    @Override
    public String toString() {
        String body = isSuccess() ? String.valueOf(value) : errorType + ": " + errorMessage;
        return isDefaulted() ? body + " (defaulted " + defaultedReferences + ")" : body;
    }
}
