package com.formulagraph.app.expression;

import com.formulagraph.app.models.CellReference;
import com.formulagraph.app.models.ConditionalMode;
import com.formulagraph.app.models.RangeReference;

import java.util.List;

/**
 * What an expression can see while it evaluates: already-substituted reference values
 * and the conditional mode. Nothing else of the host is reachable.
 */
public interface EvaluationScope {

    /**
     * The value bound to a single-cell reference.
     * Throws EvaluationException(UNRESOLVED_REFERENCE) for unresolved cells.
     */
    Object cell(CellReference reference);

    /**
     * The values present inside a range, row by row.
     */
    List<Object> range(RangeReference reference);

    ConditionalMode conditionalMode();
}
