package com.formulagraph.app.services;

import com.formulagraph.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static com.formulagraph.app.services.WorkbookAnalysisServiceTest.input;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for topic queries, categorization and the Markdown documentation.
 */
class FormulaQueryServiceTest {

    private FormulaQueryService queryService;
    private WorkbookAnalysis analysis;

    @BeforeEach
    void setUp() {
        queryService = new FormulaQueryService();
        WorkbookAnalysisService analysisService = new WorkbookAnalysisService(
                new FormulaAnalyzer(new ReferenceTokenizer()),
                new DependencyGraphBuilder(),
                new CycleDetector(),
                new SafeEvaluator(ConditionalMode.EAGER, 0),
                new FormulaValidator(),
                10_000);
        analysis = analysisService.analyze(input("pier", Arrays.asList("Design", "Soil"),
                CellInput.literal("Design", "A1", "Design load (kN)"),
                CellInput.formula("Design", "C1", "=B2*1.5"),
                CellInput.literal("Design", "A2", "Bending moment"),
                CellInput.formula("Design", "B2", "=12*4"),
                CellInput.literal("Design", "A3", "Deck area"),
                CellInput.formula("Design", "B3", "=8.5*24"),
                CellInput.formula("Soil", "B1", "=ROUND(Design!C1/200,2)")));
    }

    private static List<String> addresses(Collection<FormulaRecord> records) {
        List<String> addresses = new ArrayList<>();
        for (FormulaRecord record : records) {
            addresses.add(record.getAddress().toString());
        }
        return addresses;
    }

    /**
     * Keywords match the row label or the formula text, ignoring case.
     */
    @Test
    void testFormulasReferencing() {
        assertEquals(Arrays.asList("Design!C1", "Design!B2"),
                addresses(queryService.formulasReferencing(analysis, new LinkedHashSet<>(Arrays.asList("LOAD", "moment")))));
        assertEquals(Collections.singletonList("Soil!B1"),
                addresses(queryService.formulasReferencing(analysis, Collections.singleton("round"))));
        assertTrue(queryService.formulasReferencing(analysis, Collections.emptySet()).isEmpty());
        assertTrue(queryService.formulasReferencing(analysis, Collections.singleton("  ")).isEmpty());
    }

    /**
     * Every category is present; a formula can sit in several.
     */
    @Test
    void testCategorize() {
        Map<EngineeringCategory, List<FormulaRecord>> categories = queryService.categorize(analysis);

        assertEquals(EngineeringCategory.values().length, categories.size());
        assertEquals(Arrays.asList("Design!C1", "Design!B2"), addresses(categories.get(EngineeringCategory.STRUCTURAL)));
        assertEquals(Collections.singletonList("Design!B3"), addresses(categories.get(EngineeringCategory.GEOMETRIC)));
        assertTrue(categories.get(EngineeringCategory.HYDRAULIC).isEmpty());
    }

    /**
     * The documentation lists the categories and the cross-sheet dependencies.
     */
    @Test
    void testDocumentation() {
        String doc = new FormulaDocumentationService(queryService).document(analysis);

        assertTrue(doc.startsWith("# Formula Documentation: pier\n"));
        assertTrue(doc.contains("- Total formulas: 4\n"));
        assertTrue(doc.contains("### Structural (2 formulas)"));
        assertTrue(doc.contains("**Design!B3**\n```\n=8.5*24\n```"));
        assertTrue(doc.contains("- **Soil** depends on: Design"));
        assertFalse(doc.contains("Hydraulic"));
    }

    /**
     * Long categories are cut after five formulas.
     */
    @Test
    void testDocumentationLimitsEachCategory() {
        List<CellInput> cells = new ArrayList<>();
        for (int row = 1; row <= 7; row++) {
            cells.add(CellInput.literal("Sheet1", "A" + row, "Load case " + row));
            cells.add(CellInput.formula("Sheet1", "B" + row, "=" + row + "*10"));
        }
        WorkbookAnalysisService analysisService = new WorkbookAnalysisService(
                new FormulaAnalyzer(new ReferenceTokenizer()), new DependencyGraphBuilder(), new CycleDetector(),
                new SafeEvaluator(ConditionalMode.EAGER, 0), new FormulaValidator(), 10_000);
        WorkbookAnalysis loads = analysisService.run(input("loads", Collections.singletonList("Sheet1"),
                cells.toArray(new CellInput[0])));

        String doc = new FormulaDocumentationService(queryService).document(loads);

        assertTrue(doc.contains("### Structural (7 formulas)"));
        assertTrue(doc.contains("**Sheet1!B5**"));
        assertFalse(doc.contains("**Sheet1!B6**"));
        assertTrue(doc.contains("... and 2 more formulas"));
    }
}
