package com.formulagraph.app.expression;

import java.util.Collections;
import java.util.List;

/**
 * Node of the typed expression tree.
 */
abstract class ExprNode {

    // Height of the subtree rooted here, set by the parser
    private int depth = 1;

    int getDepth() {
        return depth;
    }

    void setDepth(int depth) {
        this.depth = depth;
    }

    abstract Object evaluate(EvaluationScope scope);

    List<ExprNode> children() {
        return Collections.emptyList();
    }
}
