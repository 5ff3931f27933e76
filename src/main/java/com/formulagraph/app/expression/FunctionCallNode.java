package com.formulagraph.app.expression;

import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.models.EvaluationErrorType;

import java.util.Collections;
import java.util.List;

final class FunctionCallNode extends ExprNode {

    private final String name;
    // null when the name is outside the supported set
    private final BuiltinFunction function;
    private final List<ExprNode> arguments;

    FunctionCallNode(String name, List<ExprNode> arguments) {
        this.name = name;
        this.function = BuiltinFunction.lookup(name);
        this.arguments = Collections.unmodifiableList(arguments);
    }

    String getName() {
        return name;
    }

    boolean isSupported() {
        return function != null;
    }

    @Override
    Object evaluate(EvaluationScope scope) {
        if (function == null) {
            throw new EvaluationException(EvaluationErrorType.UNSUPPORTED_FUNCTION, "Unsupported function: " + name);
        }
        function.checkArity(arguments.size());
        return function.call(arguments, scope);
    }

    @Override
    List<ExprNode> children() {
        return arguments;
    }
}
