package com.formulagraph.app.expression;

import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.models.EvaluationErrorType;
import com.formulagraph.app.models.Operator;

import java.util.Arrays;
import java.util.List;

final class BinaryNode extends ExprNode {

    private final Operator operator;
    private final ExprNode left;
    private final ExprNode right;

    BinaryNode(Operator operator, ExprNode left, ExprNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    Object evaluate(EvaluationScope scope) {
        Object l = left.evaluate(scope);
        Object r = right.evaluate(scope);
        switch (operator) {
            case ADD:
                return Values.checked(Values.toNumber(l) + Values.toNumber(r), "Addition");
            case SUBTRACT:
                return Values.checked(Values.toNumber(l) - Values.toNumber(r), "Subtraction");
            case MULTIPLY:
                return Values.checked(Values.toNumber(l) * Values.toNumber(r), "Multiplication");
            case DIVIDE:
                double divisor = Values.toNumber(r);
                if (divisor == 0) {
                    throw new EvaluationException(EvaluationErrorType.DIVISION_BY_ZERO, "Division by zero");
                }
                return Values.checked(Values.toNumber(l) / divisor, "Division");
            case POWER:
                return power(Values.toNumber(l), Values.toNumber(r));
            case CONCATENATE:
                return Values.toText(l) + Values.toText(r);
            case EQUAL:
                return Values.compare(l, r) == 0;
            case NOT_EQUAL:
                return Values.compare(l, r) != 0;
            case LESS_THAN:
                return Values.compare(l, r) < 0;
            case LESS_OR_EQUAL:
                return Values.compare(l, r) <= 0;
            case GREATER_THAN:
                return Values.compare(l, r) > 0;
            case GREATER_OR_EQUAL:
                return Values.compare(l, r) >= 0;
            default:
                throw Values.mismatch("Operator " + operator.getSymbol() + " is not binary");
        }
    }

    static double power(double base, double exponent) {
        if (base == 0 && exponent < 0) {
            throw new EvaluationException(EvaluationErrorType.DIVISION_BY_ZERO, "Zero raised to a negative power");
        }
        return Values.checked(Math.pow(base, exponent), "Power");
    }

    @Override
    List<ExprNode> children() {
        return Arrays.asList(left, right);
    }
}
