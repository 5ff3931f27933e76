package com.formulagraph.app.expression;

import com.formulagraph.app.models.RangeReference;

final class RangeNode extends ExprNode {

    private final RangeReference reference;

    RangeNode(RangeReference reference) {
        this.reference = reference;
    }

    RangeReference getReference() {
        return reference;
    }

    @Override
    Object evaluate(EvaluationScope scope) {
        return new RangeValue(scope.range(reference));
    }
}
