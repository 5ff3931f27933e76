package com.formulagraph.app.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formulagraph.app.exceptions.InvalidWorkbookException;
import com.formulagraph.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.formulagraph.app.services.WorkbookAnalysisServiceTest.input;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the flat export document and its round trip.
 */
class FormulaExportServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private WorkbookAnalysisService analysisService;
    private FormulaExportService exportService;
    private WorkbookAnalysis analysis;

    @BeforeEach
    void setUp() {
        analysisService = new WorkbookAnalysisService(
                new FormulaAnalyzer(new ReferenceTokenizer()),
                new DependencyGraphBuilder(),
                new CycleDetector(),
                new SafeEvaluator(ConditionalMode.EAGER, 0),
                new FormulaValidator(),
                10_000);
        exportService = new FormulaExportService(objectMapper);
        analysis = analysisService.analyze(input("bridge.xlsx", Arrays.asList("Input", "Load Data"),
                CellInput.literal("Input", "A1", "Span length"),
                CellInput.literal("Input", "B1", 24),
                CellInput.formula("Input", "B2", "=B1*1.5"),
                CellInput.formula("Load Data", "C3", "=SUM(Input!B1:B2)/2"),
                CellInput.formula("Load Data", "C4", "=IF(C3>20,\"Heavy, \"\"check\"\"\",\"ok\")")));
    }

    /**
     * Export, read back, and the formula map is unchanged.
     */
    @Test
    void testFormulaMapRoundTrip() {
        String json = exportService.toJson(analysis);

        Map<String, String> formulas = exportService.readFormulaMap(json);

        assertEquals(analysis.getFormulaMap(), formulas);
        assertEquals("=B1*1.5", formulas.get("bridge.xlsx#Input!B2"));
        assertEquals("=SUM(Input!B1:B2)/2", formulas.get("bridge.xlsx#Load Data!C3"));
    }

    /**
     * Re-importing the exported map as a document and exporting again gives the same map.
     */
    @Test
    void testReimportRoundTrip() {
        Map<String, String> formulas = exportService.readFormulaMap(exportService.toJson(analysis));

        WorkbookAnalysis reimported = analysisService.run(exportService.toWorkbookInput(formulas));

        assertEquals("bridge.xlsx", reimported.getDocumentId());
        assertEquals(formulas, exportService.readFormulaMap(exportService.toJson(reimported)));
    }

    /**
     * Sheet names survive the round trip exactly, surrounding spaces included;
     * a document id with '#' is refused up front since its keys could not be read back.
     */
    @Test
    void testReimportKeepsSheetNames() {
        WorkbookAnalysis padded = analysisService.run(input("calc_v2", Arrays.asList(" Summary ", "Input"),
                CellInput.literal("Input", "A1", 4),
                CellInput.formula(" Summary ", "B2", "=Input!A1*2")));

        Map<String, String> formulas = exportService.readFormulaMap(exportService.toJson(padded));
        assertEquals("=Input!A1*2", formulas.get("calc_v2# Summary !B2"));

        WorkbookInput reimported = exportService.toWorkbookInput(formulas);
        assertEquals("calc_v2", reimported.getDocumentId());
        assertEquals(Collections.singletonList(" Summary "), reimported.getSheetNames());
        assertEquals(formulas, exportService.readFormulaMap(exportService.toJson(analysisService.run(reimported))));

        assertThrows(InvalidWorkbookException.class, () -> analysisService.run(input("calc#v2",
                Collections.singletonList("Sheet1"), CellInput.formula("Sheet1", "A1", "=1"))));
    }

    /**
     * The export is a plain record of records with flat string keys.
     */
    @Test
    void testExportShape() throws Exception {
        JsonNode root = objectMapper.readTree(exportService.toJson(analysis));

        assertEquals("bridge.xlsx", root.get("documentId").asText());
        assertEquals(3, root.get("validation").get("totalFormulas").asInt());
        assertTrue(root.get("dependencies").has("Load Data!C3"));
        assertEquals("Input", root.get("sheetDependencies").get("Load Data").get(0).asText());
        assertTrue(root.get("cycles").isArray());
    }

    @Test
    void testRejectsForeignInput() {
        assertThrows(InvalidWorkbookException.class, () -> exportService.readFormulaMap("{\"documentId\":\"x\"}"));
        assertThrows(InvalidWorkbookException.class, () -> exportService.readFormulaMap("not json"));

        Map<String, String> mixed = new LinkedHashMap<>();
        mixed.put("a#Sheet1!A1", "=1");
        mixed.put("b#Sheet1!A1", "=2");
        assertThrows(InvalidWorkbookException.class, () -> exportService.toWorkbookInput(mixed));
        assertThrows(InvalidWorkbookException.class, () ->
                exportService.toWorkbookInput(Collections.singletonMap("Sheet1!A1", "=1")));
    }

    /**
     * The master mapping holds the formulas of every document under global keys.
     */
    @Test
    void testMasterMapping() {
        WorkbookAnalysis other = analysisService.run(input("pier.xlsx", Collections.singletonList("Sheet1"),
                CellInput.literal("Sheet1", "A1", "Span length"),
                CellInput.formula("Sheet1", "B1", "=12*2")));
        IntegrationIndex index = new IntegrationIndexService().buildIndex(
                Arrays.asList(analysis.getWorkbook(), other.getWorkbook()));

        MasterFormulaMapping mapping = exportService.masterMapping(Arrays.asList(analysis, other), index);

        assertEquals(4, mapping.getGlobalFormulas().size());
        assertEquals("=12*2", mapping.getGlobalFormulas().get("pier.xlsx#Sheet1!B1"));
        assertEquals(2, mapping.getDocumentsProcessed());
        assertEquals(Arrays.asList("bridge.xlsx#Input!B1", "pier.xlsx#Sheet1!B1"),
                mapping.getIntegrationPoints().get("span_length"));
        assertEquals(Collections.singletonList("Input"),
                mapping.getSheetDependencies().get("bridge.xlsx").get("Load Data"));
    }
}
