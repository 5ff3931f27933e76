package com.formulagraph.app.services;

import com.formulagraph.app.config.AnalysisProperties;
import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.expression.EvaluationScope;
import com.formulagraph.app.expression.Expression;
import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Re-evaluates a formula against externally supplied cell values.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>parse into a typed expression tree (MALFORMED_EXPRESSION on failure)</li>
 *   <li>reject any function outside the supported set (UNSUPPORTED_FUNCTION), before evaluating anything</li>
 *   <li>substitute every reference with its context value; references missing from the
 *       context get the fallback value and are recorded as defaulted</li>
 *   <li>evaluate over arithmetic, comparison and the supported functions only</li>
 * </ol>
 * Failures come back as an EvaluationResult, never as an exception.
 */
@Service
public class SafeEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(SafeEvaluator.class);

    private final ConditionalMode conditionalMode;
    private final double fallbackValue;

    @Autowired
    public SafeEvaluator(AnalysisProperties properties) {
        this(properties.getEvaluation().getConditionalMode(), properties.getEvaluation().getFallbackValue());
    }

    public SafeEvaluator(ConditionalMode conditionalMode, double fallbackValue) {
        this.conditionalMode = conditionalMode;
        this.fallbackValue = fallbackValue;
    }

    public ConditionalMode getConditionalMode() {
        return conditionalMode;
    }

    /**
     * Evaluates one formula. Text without the leading '=' is returned as a literal string.
     */
    public EvaluationResult evaluate(String formula, EvaluationContext context) {
        if (!Cell.isFormulaText(formula)) {
            return EvaluationResult.success(formula);
        }
        Expression expression;
        try {
            expression = Expression.parse(formula.substring(Cell.FORMULA_MARKER.length()));
        } catch (EvaluationException e) {
            logger.debug("Cannot parse {}: {}", formula, e.getMessage());
            return EvaluationResult.failure(e.getType(), e.getMessage());
        }

        if (!expression.getUnsupportedFunctions().isEmpty()) {
            return EvaluationResult.failure(EvaluationErrorType.UNSUPPORTED_FUNCTION,
                    "Unsupported function(s): " + String.join(", ", expression.getUnsupportedFunctions()));
        }

        BoundScope scope = bind(expression, context);
        try {
            Object value = expression.evaluate(scope);
            return EvaluationResult.success(value, scope.defaulted);
        } catch (EvaluationException e) {
            logger.debug("Evaluation of {} failed: {} {}", formula, e.getType(), e.getMessage());
            return EvaluationResult.failure(e.getType(), e.getMessage(), scope.defaulted);
        }
    }

    /**
     * Substitutes every reference of the expression up front.
     */
    private BoundScope bind(Expression expression, EvaluationContext context) {
        String home = context.getHomeSheet();
        BoundScope scope = new BoundScope(conditionalMode);

        for (CellReference reference : expression.getCellReferences()) {
            QualifiedAddress address = reference.resolve(home);
            if (context.isUnresolved(address)) {
                scope.unresolved.add(reference);
            } else if (context.contains(address)) {
                scope.cells.put(reference, context.get(address));
            } else {
                scope.cells.put(reference, fallbackValue);
                scope.defaulted.add(address);
            }
        }

        for (RangeReference reference : expression.getRangeReferences()) {
            String sheet = reference.getSheet() == null ? home : reference.getSheet();
            if (!context.unresolvedIn(sheet, reference.getStart(), reference.getEnd()).isEmpty()) {
                scope.unresolvedRanges.add(reference);
            } else {
                // Empty cells inside a range are skipped, not defaulted
                scope.ranges.put(reference,
                        new ArrayList<>(context.valuesIn(sheet, reference.getStart(), reference.getEnd()).values()));
            }
        }
        return scope;
    }

    /**
     * Reference values fixed before evaluation starts.
     */
    private static final class BoundScope implements EvaluationScope {
        private final ConditionalMode mode;
        private final Map<CellReference, Object> cells = new HashMap<>();
        private final Map<RangeReference, List<Object>> ranges = new HashMap<>();
        private final Set<CellReference> unresolved = new HashSet<>();
        private final Set<RangeReference> unresolvedRanges = new HashSet<>();
        private final Set<QualifiedAddress> defaulted = new LinkedHashSet<>();

        private BoundScope(ConditionalMode mode) {
            this.mode = mode;
        }

        @Override
        public Object cell(CellReference reference) {
            if (unresolved.contains(reference)) {
                throw new EvaluationException(EvaluationErrorType.UNRESOLVED_REFERENCE,
                        "Reference " + reference + " has no resolvable value");
            }
            return cells.get(reference);
        }

        @Override
        public List<Object> range(RangeReference reference) {
            if (unresolvedRanges.contains(reference)) {
                throw new EvaluationException(EvaluationErrorType.UNRESOLVED_REFERENCE,
                        "Range " + reference + " contains unresolvable cells");
            }
            return ranges.getOrDefault(reference, Collections.emptyList());
        }

        @Override
        public ConditionalMode conditionalMode() {
            return mode;
        }
    }
}
