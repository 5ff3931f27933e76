package com.formulagraph.app.services;

import com.formulagraph.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for formula evaluation against a context of resolved values.
 */
class SafeEvaluatorTest {

    private SafeEvaluator evaluator;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new SafeEvaluator(ConditionalMode.EAGER, 0);
        context = new EvaluationContext("Sheet1");
    }

    private Object value(String formula) {
        EvaluationResult result = evaluator.evaluate(formula, context);
        assertTrue(result.isSuccess(), () -> formula + " failed: " + result);
        return result.getValue();
    }

    private EvaluationErrorType error(String formula) {
        EvaluationResult result = evaluator.evaluate(formula, context);
        assertFalse(result.isSuccess(), () -> formula + " should fail but gave " + result.getValue());
        return result.getErrorType();
    }

    /**
     * Operator precedence and the basic functions.
     */
    @Test
    void testArithmeticAndFunctions() {
        assertEquals(14.0, value("=2+3*4"));
        assertEquals(4.0, value("=SQRT(16)"));
        assertEquals("SAFE", value("=IF(1>0,\"SAFE\",\"UNSAFE\")"));
        assertEquals(4.0, value("=-2^2"));
        assertEquals(0.5, value("=50%"));
        assertEquals(3.0, value("=ROUND(2.5)"));
        assertEquals(-3.0, value("=ROUND(-2.5,0)"));
        assertEquals(2.0, value("=LOG(100)"));
        assertEquals(3.0, value("=LOG(8,2)"));
        assertEquals(Math.PI, value("=PI()"));
        assertEquals(8.0, value("=POWER(2,3)"));
        assertEquals(true, value("=AND(1,TRUE,2>1)"));
        assertEquals(false, value("=OR(FALSE,0)"));
        assertEquals("L=12", value("=\"L=\"&12"));
    }

    /**
     * Unqualified references resolve on the home sheet, qualified ones on their own sheet.
     */
    @Test
    void testReferencesFromContext() {
        context.put("B2", 10).put("Sheet2!B2", 3).put("'Load Data'!A1", "kN");

        EvaluationResult result = evaluator.evaluate("=B2*Sheet2!B2", context);
        assertEquals(30.0, result.getValue());
        assertFalse(result.isDefaulted());

        assertEquals("kN", value("='Load Data'!A1"));
    }

    /**
     * Missing references use the fallback value and are reported as defaulted.
     */
    @Test
    void testFallbackIsFlagged() {
        context.put("A1", 5);

        EvaluationResult result = evaluator.evaluate("=A1+C9", context);

        assertTrue(result.isSuccess());
        assertEquals(5.0, result.getValue());
        assertTrue(result.isDefaulted());
        assertEquals(Collections.singletonList("Sheet1!C9"), result.getDefaultedReferences());
    }

    /**
     * A non-zero fallback value is used as configured.
     */
    @Test
    void testConfiguredFallback() {
        SafeEvaluator withOne = new SafeEvaluator(ConditionalMode.EAGER, 1);
        assertEquals(7.0, withOne.evaluate("=X1*7", context).getValue());
    }

    /**
     * Ranges aggregate the values inside them; empty cells are skipped.
     */
    @Test
    void testRanges() {
        context.put("A1", 2).put("A2", 4).put("A3", "label").put("Sheet2!C1", 9);

        assertEquals(6.0, value("=SUM(A1:A5)"));
        assertEquals(3.0, value("=AVERAGE(A1:A5)"));
        assertEquals(9.0, value("=MAX(A1:A3,Sheet2!C1:C4)"));
        assertEquals(EvaluationErrorType.DIVISION_BY_ZERO, error("=AVERAGE(B1:B4)"));
        assertFalse(evaluator.evaluate("=SUM(A1:A5)", context).isDefaulted());
    }

    /**
     * Functions outside the supported set fail before anything is evaluated.
     */
    @Test
    void testUnsupportedFunction() {
        EvaluationResult result = evaluator.evaluate("=VLOOKUP(A1,B1:C9,2)+1/0", context);

        assertEquals(EvaluationErrorType.UNSUPPORTED_FUNCTION, result.getErrorType());
        assertTrue(result.getErrorMessage().contains("VLOOKUP"));
    }

    /**
     * Typed errors for division by zero and malformed input.
     */
    @Test
    void testTypedErrors() {
        assertEquals(EvaluationErrorType.DIVISION_BY_ZERO, error("=1/0"));
        assertEquals(EvaluationErrorType.DIVISION_BY_ZERO, error("=1/A1"));
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, error("=2+"));
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, error("=(1+2"));
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, error("=SQRT(-1)"));
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, error("=\"abc\"*2"));
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, error("=SQRT(1,2)"));
        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, error("=Span*2"));
    }

    /**
     * Formulas nested or chained too deeply come back malformed instead of overflowing the stack.
     */
    @Test
    void testNestingLimit() {
        assertEquals(1.0, value("=" + "(".repeat(200) + "1" + ")".repeat(200)));
        assertEquals(501.0, value("=1" + "+1".repeat(500)));

        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION,
                error("=" + "(".repeat(20000) + "1" + ")".repeat(20000)));
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION,
                error("=" + "ABS(".repeat(5000) + "1" + ")".repeat(5000)));
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, error("=1" + "+1".repeat(20000)));
    }

    /**
     * ROUND accepts any digit count; beyond the double range the result no longer changes.
     */
    @Test
    void testRoundExtremeDigits() {
        assertEquals(1.5, value("=ROUND(1.5,2000000000)"));
        assertEquals(0.0, value("=ROUND(1234.5,-2000000000)"));
        assertEquals(1200.0, value("=ROUND(1234.5,-2)"));
    }

    /**
     * Cells marked unresolved make every formula reading them unresolved.
     */
    @Test
    void testUnresolvedReference() {
        context.markUnresolved(QualifiedAddress.of("Sheet1", "B1"));

        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, error("=B1+1"));
        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, error("=SUM(A1:C3)"));
    }

    /**
     * Eager IF evaluates both branches; short-circuit only the chosen one.
     */
    @Test
    void testConditionalModes() {
        assertEquals(EvaluationErrorType.DIVISION_BY_ZERO, error("=IF(1>0,1,1/0)"));

        SafeEvaluator shortCircuit = new SafeEvaluator(ConditionalMode.SHORT_CIRCUIT, 0);
        EvaluationResult result = shortCircuit.evaluate("=IF(1>0,1,1/0)", context);
        assertTrue(result.isSuccess());
        assertEquals(1.0, result.getValue());
    }

    /**
     * Text without the formula marker is returned as it is.
     */
    @Test
    void testLiteralText() {
        assertEquals("Design load", value("Design load"));
    }
}
