package com.formulagraph.app.services;

import com.formulagraph.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for building dependency graphs from formula metadata.
 */
class DependencyGraphBuilderTest {

    private DependencyGraphBuilder builder;
    private FormulaAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilder();
        analyzer = new FormulaAnalyzer(new ReferenceTokenizer());
    }

    private Workbook workbook(String documentId, List<String> sheets, CellInput... cells) {
        WorkbookInput input = new WorkbookInput();
        input.setDocumentId(documentId);
        input.setSheetNames(sheets);
        input.setCells(Arrays.asList(cells));
        return Workbook.from(input);
    }

    private DependencyGraph build(Workbook workbook) {
        Map<QualifiedAddress, FormulaMetadata> metadata = new LinkedHashMap<>();
        for (Cell cell : workbook.formulaCells()) {
            metadata.put(cell.getQualifiedAddress(), analyzer.analyze(cell.getFormula()));
        }
        return builder.build(workbook, metadata);
    }

    /**
     * Ranges contribute their two corners only.
     */
    @Test
    void testRangeBecomesCorners() {
        Workbook workbook = workbook("doc", Collections.singletonList("Sheet1"),
                CellInput.formula("Sheet1", "C1", "=SUM(A1:B10)+A5"));

        DependencyGraph graph = build(workbook);
        QualifiedAddress c1 = QualifiedAddress.of("Sheet1", "C1");

        assertEquals(new LinkedHashSet<>(Arrays.asList(
                        QualifiedAddress.of("Sheet1", "A5"),
                        QualifiedAddress.of("Sheet1", "A1"),
                        QualifiedAddress.of("Sheet1", "B10"))),
                graph.getDependencies(c1));
        assertEquals(3, graph.getEdgeCount());
        assertEquals(Collections.singleton(c1), graph.getDependents(QualifiedAddress.of("Sheet1", "B10")));
        assertTrue(graph.isFormulaNode(c1));
        assertFalse(graph.isFormulaNode(QualifiedAddress.of("Sheet1", "A5")));
    }

    /**
     * References to sheets the document does not have become dangling nodes.
     */
    @Test
    void testUnknownSheetIsDangling() {
        Workbook workbook = workbook("doc", Arrays.asList("Sheet1", "Sheet2"),
                CellInput.formula("Sheet1", "A1", "=Sheet2!B1+Missing!C3"));

        DependencyGraph graph = build(workbook);

        assertEquals(Collections.singleton(QualifiedAddress.of("Missing", "C3")), graph.getDanglingNodes());
        assertEquals(2, graph.getCrossSheetEdgeCount());
        assertEquals(Collections.singletonMap("Sheet1", Arrays.asList("Sheet2", "Missing")),
                graph.getSheetDependencies());
    }

    /**
     * Every edge needs a formula at its source.
     */
    @Test
    void testEdgeSourceNeedsMetadata() {
        DependencyGraph.Builder graph = DependencyGraph.builder();
        assertThrows(IllegalStateException.class, () ->
                graph.addDependency(QualifiedAddress.of("Sheet1", "A1"), QualifiedAddress.of("Sheet1", "B1")));
    }

    /**
     * Two documents with the same addresses stay apart; only advisory links join them.
     */
    @Test
    void testIntegrationGraphKeepsDocumentsApart() {
        Workbook first = workbook("bridge", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", "Span length"),
                CellInput.literal("Sheet1", "B1", 24),
                CellInput.formula("Sheet1", "C1", "=B1*2"));
        Workbook second = workbook("pier", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", "Span length (m)"),
                CellInput.formula("Sheet1", "B1", "=20+4"),
                CellInput.formula("Sheet1", "C1", "=B1/2"));

        Map<String, DependencyGraph> graphs = new LinkedHashMap<>();
        graphs.put("bridge", build(first));
        graphs.put("pier", build(second));
        IntegrationIndex index = new IntegrationIndexService().buildIndex(Arrays.asList(first, second));

        IntegrationGraph integration = builder.buildIntegrationGraph(graphs, index);

        assertEquals(new LinkedHashSet<>(Arrays.asList("bridge", "pier")), integration.getDocumentIds());
        assertEquals(2, integration.getGraph().getEdgeCount());
        assertEquals(Collections.singleton(QualifiedAddress.parse("pier#Sheet1!B1")),
                integration.getGraph().getDependencies(QualifiedAddress.parse("pier#Sheet1!C1")));
        assertEquals(1, integration.getLinks().size());
        IntegrationLink link = integration.getLinks().get(0);
        assertEquals(IntegrationParameter.SPAN_LENGTH, link.getParameter());
        assertEquals(QualifiedAddress.parse("bridge#Sheet1!B1"), link.getFrom());
        assertEquals(QualifiedAddress.parse("pier#Sheet1!B1"), link.getTo());
    }
}
