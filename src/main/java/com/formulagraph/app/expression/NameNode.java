package com.formulagraph.app.expression;

import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.models.EvaluationErrorType;

/**
 * A bare identifier that is neither a cell nor a function call, e.g. a named range.
 * Names are never looked up, so evaluating one fails.
 */
final class NameNode extends ExprNode {

    private final String name;

    NameNode(String name) {
        this.name = name;
    }

    @Override
    Object evaluate(EvaluationScope scope) {
        throw new EvaluationException(EvaluationErrorType.UNRESOLVED_REFERENCE, "Unknown name: " + name);
    }
}
