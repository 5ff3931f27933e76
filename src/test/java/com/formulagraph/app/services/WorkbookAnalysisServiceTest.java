package com.formulagraph.app.services;

import com.formulagraph.app.exceptions.InvalidWorkbookException;
import com.formulagraph.app.exceptions.WorkbookNotFoundException;
import com.formulagraph.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the per-document pipeline, using an in-memory approach
 * (no HTTP or external server).
 */
class WorkbookAnalysisServiceTest {

    private WorkbookAnalysisService analysisService;

    @BeforeEach
    void setUp() {
        analysisService = new WorkbookAnalysisService(
                new FormulaAnalyzer(new ReferenceTokenizer()),
                new DependencyGraphBuilder(),
                new CycleDetector(),
                new SafeEvaluator(ConditionalMode.EAGER, 0),
                new FormulaValidator(),
                10_000);
    }

    static WorkbookInput input(String documentId, List<String> sheets, CellInput... cells) {
        WorkbookInput input = new WorkbookInput();
        input.setDocumentId(documentId);
        input.setSheetNames(sheets);
        input.setCells(Arrays.asList(cells));
        return input;
    }

    private static QualifiedAddress at(String address) {
        return QualifiedAddress.parse(address);
    }

    /**
     * Sheet2!B6 reads Sheet1!B15, a literal: one cross-sheet edge, no cycles, one valid formula.
     */
    @Test
    void testCrossSheetReference() {
        WorkbookAnalysis analysis = analysisService.analyze(input("bridge.xlsx", Arrays.asList("Sheet1", "Sheet2"),
                CellInput.literal("Sheet1", "B15", 12.5),
                CellInput.formula("Sheet2", "B6", "=Sheet1!B15")));

        DependencyGraph graph = analysis.getGraph();
        assertEquals(1, graph.getEdgeCount());
        assertEquals(1, graph.getCrossSheetEdgeCount());
        assertEquals(Collections.singleton(at("Sheet1!B15")), graph.getDependencies(at("Sheet2!B6")));
        assertTrue(analysis.getCycles().isEmpty());

        ValidationResult validation = analysis.getValidation();
        assertEquals(1, validation.getTotalFormulas());
        assertEquals(1, validation.getValidFormulas());
        assertEquals(0, validation.getErrorFormulas());
        assertEquals(Optional.of(12.5), analysis.resolve(at("Sheet2!B6")));
    }

    /**
     * A1 = B1 + 1 and B1 = A1 + 1: one cycle with both cells, both unresolved.
     */
    @Test
    void testTwoCellCycle() {
        WorkbookAnalysis analysis = analysisService.analyze(input("loop", Collections.singletonList("Sheet1"),
                CellInput.formula("Sheet1", "A1", "=B1+1"),
                CellInput.formula("Sheet1", "B1", "=A1+1"),
                CellInput.formula("Sheet1", "C1", "=A1*2")));

        assertEquals(1, analysis.getCycles().size());
        Cycle cycle = analysis.getCycles().get(0);
        assertTrue(cycle.contains(at("Sheet1!A1")));
        assertTrue(cycle.contains(at("Sheet1!B1")));

        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, analysis.getResult(at("Sheet1!A1")).getErrorType());
        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, analysis.getResult(at("Sheet1!B1")).getErrorType());
        // Reading a cell on the cycle is unresolved too
        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, analysis.getResult(at("Sheet1!C1")).getErrorType());

        ValidationResult validation = analysis.getValidation();
        assertEquals(2, validation.getErrorFormulas());
        assertEquals(1, validation.getCycles().size());
        assertTrue(validation.getEvaluationErrors().containsKey("Sheet1!C1"));
        assertFalse(analysis.resolve(at("Sheet1!A1")).isPresent());
    }

    /**
     * Formulas are evaluated after the formulas they read, whatever the loader order.
     */
    @Test
    void testDependencyOrder() {
        WorkbookAnalysis analysis = analysisService.analyze(input("chain", Arrays.asList("Calc", "Input"),
                CellInput.formula("Calc", "B3", "=B2*2"),
                CellInput.formula("Calc", "B2", "=Input!A1+B1"),
                CellInput.literal("Calc", "B1", 1),
                CellInput.literal("Input", "A1", 4),
                CellInput.formula("Calc", "B4", "=IF(B3>=10,\"OK\",\"LOW\")")));

        assertEquals(5.0, analysis.getResult(at("Calc!B2")).getValue());
        assertEquals(10.0, analysis.getResult(at("Calc!B3")).getValue());
        assertEquals("OK", analysis.getResult(at("Calc!B4")).getValue());
        assertFalse(analysis.getResult(at("Calc!B3")).isDefaulted());
    }

    /**
     * A syntax error is reported, never evaluated, and makes its readers unresolved.
     */
    @Test
    void testSyntaxErrorIsExcluded() {
        WorkbookAnalysis analysis = analysisService.analyze(input("typo", Collections.singletonList("Sheet1"),
                CellInput.formula("Sheet1", "A1", "=SUM(B1:B3"),
                CellInput.formula("Sheet1", "A2", "=A1+1")));

        ValidationResult validation = analysis.getValidation();
        assertEquals(1, validation.getSyntaxErrors().size());
        assertEquals(at("Sheet1!A1"), validation.getSyntaxErrors().get(0).getAddress());
        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, analysis.getResult(at("Sheet1!A1")).getErrorType());
        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, analysis.getResult(at("Sheet1!A2")).getErrorType());
        assertEquals(1, validation.getErrorFormulas());
        assertEquals(1, validation.getValidFormulas());
    }

    /**
     * Missing cells are warnings; the formula is still evaluated with the fallback value.
     */
    @Test
    void testMissingReferenceWarning() {
        WorkbookAnalysis analysis = analysisService.analyze(input("gaps", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", 3),
                CellInput.formula("Sheet1", "B1", "=A1+A2+Other!C1")));

        ValidationResult validation = analysis.getValidation();
        assertEquals(1, validation.getWarningFormulas());
        assertEquals(0, validation.getValidFormulas());
        // Qualified references are found before bare ones
        assertEquals(Arrays.asList(at("Other!C1"), at("Sheet1!A2")), validation.getMissingReferences().get(0).getMissing());

        EvaluationResult result = analysis.getResult(at("Sheet1!B1"));
        assertEquals(3.0, result.getValue());
        assertEquals(Arrays.asList("Sheet1!A2", "Other!C1"), result.getDefaultedReferences());
    }

    /**
     * Evaluation failures are listed but do not abort the document.
     */
    @Test
    void testEvaluationErrorsAreCollected() {
        WorkbookAnalysis analysis = analysisService.analyze(input("errors", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", 0),
                CellInput.formula("Sheet1", "B1", "=10/A1"),
                CellInput.formula("Sheet1", "B2", "=VLOOKUP(A1,A1:A1,1)"),
                CellInput.formula("Sheet1", "B3", "=A1+1")));

        ValidationResult validation = analysis.getValidation();
        assertEquals(EvaluationErrorType.DIVISION_BY_ZERO,
                validation.getEvaluationErrors().get("Sheet1!B1").getErrorType());
        assertEquals(EvaluationErrorType.UNSUPPORTED_FUNCTION,
                validation.getEvaluationErrors().get("Sheet1!B2").getErrorType());
        assertEquals(Optional.of(1.0), analysis.resolve(at("Sheet1!B3")));
        assertEquals(3, validation.getValidFormulas());
    }

    /**
     * A formula inside a range is evaluated before the formula that reads the range,
     * even though the graph only links the range corners.
     */
    @Test
    void testRangeInteriorFormulaIsEvaluatedFirst() {
        WorkbookAnalysis analysis = analysisService.analyze(input("interior", Collections.singletonList("Sheet1"),
                CellInput.formula("Sheet1", "C1", "=SUM(A1:A3)"),
                CellInput.literal("Sheet1", "A1", 1),
                CellInput.formula("Sheet1", "A2", "=100"),
                CellInput.literal("Sheet1", "A3", 1)));

        EvaluationResult sum = analysis.getResult(at("Sheet1!C1"));
        assertEquals(102.0, sum.getValue());
        assertFalse(sum.isDefaulted());
    }

    /**
     * A formula reading a range it sits in cannot see its own value and is unresolved.
     */
    @Test
    void testFormulaInsideItsOwnRange() {
        WorkbookAnalysis analysis = analysisService.analyze(input("own-range", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", 1),
                CellInput.formula("Sheet1", "A2", "=SUM(A1:A3)"),
                CellInput.literal("Sheet1", "A3", 1)));

        assertEquals(EvaluationErrorType.UNRESOLVED_REFERENCE, analysis.getResult(at("Sheet1!A2")).getErrorType());
    }

    /**
     * One pathologically nested formula is reported malformed; the rest of the document still evaluates.
     */
    @Test
    void testDeeplyNestedFormulaDoesNotAbortDocument() {
        WorkbookAnalysis analysis = analysisService.analyze(input("nested", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", 2),
                CellInput.formula("Sheet1", "B1", "=" + "(".repeat(20000) + "A1" + ")".repeat(20000)),
                CellInput.formula("Sheet1", "B2", "=ROUND(A1/3,2000000000)+A1")));

        assertEquals(EvaluationErrorType.MALFORMED_EXPRESSION, analysis.getResult(at("Sheet1!B1")).getErrorType());
        assertTrue(analysis.getResult(at("Sheet1!B2")).isSuccess());
        assertEquals(1, analysis.getValidation().getEvaluationErrors().size());
    }

    /**
     * Ad-hoc evaluation sees the document's resolved values.
     */
    @Test
    void testAdHocEvaluation() {
        analysisService.analyze(input("adhoc", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", 6),
                CellInput.formula("Sheet1", "A2", "=A1*7")));

        EvaluationResult result = analysisService.evaluate("adhoc", "Sheet1", "=SQRT(A2-6)");

        assertEquals(6.0, result.getValue());
        assertFalse(result.isDefaulted());
    }

    /**
     * Sessions are stored by document id until discarded.
     */
    @Test
    void testSessionLifecycle() {
        analysisService.analyze(input("kept", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", 1)));

        assertEquals("kept", analysisService.getAnalysis("kept").getDocumentId());
        analysisService.discard("kept");
        assertThrows(WorkbookNotFoundException.class, () -> analysisService.getAnalysis("kept"));
        assertThrows(WorkbookNotFoundException.class, () -> analysisService.discard("kept"));
    }

    /**
     * Loader contract violations throw.
     */
    @Test
    void testBrokenLoaderInput() {
        assertThrows(InvalidWorkbookException.class, () -> analysisService.analyze(
                input(null, Collections.singletonList("Sheet1"))));
        assertThrows(InvalidWorkbookException.class, () -> analysisService.analyze(
                input("dup", Collections.singletonList("Sheet1"),
                        CellInput.literal("Sheet1", "A1", 1),
                        CellInput.literal("Sheet1", "$A$1", 2))));
        assertThrows(InvalidWorkbookException.class, () -> analysisService.analyze(
                input("bad", Collections.singletonList("Sheet1"),
                        CellInput.literal("Sheet1", "1A", 1))));
    }
}
