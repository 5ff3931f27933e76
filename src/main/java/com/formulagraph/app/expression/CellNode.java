package com.formulagraph.app.expression;

import com.formulagraph.app.models.CellReference;

final class CellNode extends ExprNode {

    private final CellReference reference;

    CellNode(CellReference reference) {
        this.reference = reference;
    }

    CellReference getReference() {
        return reference;
    }

    @Override
    Object evaluate(EvaluationScope scope) {
        return scope.cell(reference);
    }
}
