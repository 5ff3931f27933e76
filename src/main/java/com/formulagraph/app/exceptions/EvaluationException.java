package com.formulagraph.app.exceptions;

import com.formulagraph.app.models.EvaluationErrorType;

/**
 * Thrown inside the expression evaluator to abort one formula.
 * The evaluator converts it into an EvaluationResult; it never reaches callers.
 */
public class EvaluationException extends RuntimeException {

    private final EvaluationErrorType type;

    public EvaluationException(EvaluationErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public EvaluationErrorType getType() {
        return type;
    }
}
