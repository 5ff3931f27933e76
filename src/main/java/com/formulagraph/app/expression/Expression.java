package com.formulagraph.app.expression;

import com.formulagraph.app.models.CellReference;
import com.formulagraph.app.models.RangeReference;

import java.util.*;

/**
 * A parsed formula: a typed expression tree over the closed operator and function set.
 * Parsing fails with EvaluationException(MALFORMED_EXPRESSION); nothing is executed
 * until {@link #evaluate(EvaluationScope)} is called.
 */
public final class Expression {

    private final ExprNode root;
    private final Set<CellReference> cells = new LinkedHashSet<>();
    private final Set<RangeReference> ranges = new LinkedHashSet<>();
    private final Set<String> unsupportedFunctions = new LinkedHashSet<>();

    private Expression(ExprNode root) {
        this.root = root;
        collect(root);
    }

    /**
     * Parses a formula body, the text after the leading '='.
     */
    public static Expression parse(String body) {
        if (body == null || body.isBlank()) {
            throw Values.mismatch("Empty formula");
        }
        return new Expression(new Parser(new Lexer(body).tokenize()).parse());
    }

    public Set<CellReference> getCellReferences() {
        return Collections.unmodifiableSet(cells);
    }

    public Set<RangeReference> getRangeReferences() {
        return Collections.unmodifiableSet(ranges);
    }

    /**
     * Function names outside the supported set, checked before anything is evaluated.
     */
    public Set<String> getUnsupportedFunctions() {
        return Collections.unmodifiableSet(unsupportedFunctions);
    }

    /**
     * Evaluates to a Double, String or Boolean.
     */
    public Object evaluate(EvaluationScope scope) {
        Object value = root.evaluate(scope);
        if (value instanceof RangeValue) {
            throw Values.mismatch("A formula cannot evaluate to a whole range");
        }
        return value;
    }

    // Iterative walk, so deeply nested formulas cannot exhaust the stack here
    private void collect(ExprNode start) {
        Deque<ExprNode> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            ExprNode node = pending.pop();
            if (node instanceof CellNode) {
                cells.add(((CellNode) node).getReference());
            } else if (node instanceof RangeNode) {
                ranges.add(((RangeNode) node).getReference());
            } else if (node instanceof FunctionCallNode && !((FunctionCallNode) node).isSupported()) {
                unsupportedFunctions.add(((FunctionCallNode) node).getName());
            }
            List<ExprNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }
}
