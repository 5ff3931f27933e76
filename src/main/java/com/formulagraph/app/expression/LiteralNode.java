package com.formulagraph.app.expression;

/**
 * A number, string or boolean constant.
 */
final class LiteralNode extends ExprNode {

    private final Object value;

    LiteralNode(Object value) {
        this.value = value;
    }

    @Override
    Object evaluate(EvaluationScope scope) {
        return value;
    }
}
