package com.formulagraph.app.expression;

import java.util.Collections;
import java.util.List;

/**
 * Prefix negation / plus and postfix percent.
 */
final class UnaryNode extends ExprNode {

    private final String operator;
    private final ExprNode operand;

    UnaryNode(String operator, ExprNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    Object evaluate(EvaluationScope scope) {
        double value = Values.toNumber(operand.evaluate(scope));
        switch (operator) {
            case "-":
                return -value;
            case "%":
                return value / 100;
            default:
                return value;
        }
    }

    @Override
    List<ExprNode> children() {
        return Collections.singletonList(operand);
    }
}
