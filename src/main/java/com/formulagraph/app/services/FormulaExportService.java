package com.formulagraph.app.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formulagraph.app.exceptions.InvalidAddressException;
import com.formulagraph.app.exceptions.InvalidWorkbookException;
import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Converts analysis sessions into the flat export documents and reads formula maps back.
 */
@Service
public class FormulaExportService {

    private static final Logger logger = LoggerFactory.getLogger(FormulaExportService.class);

    private final ObjectMapper objectMapper;

    public FormulaExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FormulaExport export(WorkbookAnalysis analysis) {
        DependencyGraph graph = analysis.getGraph();
        Map<QualifiedAddress, Set<QualifiedAddress>> forward = new LinkedHashMap<>();
        for (Map.Entry<QualifiedAddress, Set<QualifiedAddress>> entry : graph.getForwardGraph().entrySet()) {
            if (graph.isFormulaNode(entry.getKey())) {
                forward.put(entry.getKey(), entry.getValue());
            }
        }
        return new FormulaExport(
                analysis.getDocumentId(),
                analysis.getFormulaMap(),
                analysis.getValidation(),
                DependencyGraph.render(forward),
                graph.getSheetDependencies(),
                analysis.getCycles());
    }

    public String toJson(WorkbookAnalysis analysis) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export(analysis));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize export of " + analysis.getDocumentId(), e);
        }
    }

    /**
     * Reads the "formulas" record of an exported document back into a flat address -> formula map.
     */
    public Map<String, String> readFormulaMap(String json) {
        try {
            JsonNode formulas = objectMapper.readTree(json).get("formulas");
            if (formulas == null || !formulas.isObject()) {
                throw new InvalidWorkbookException("Export document has no formulas record");
            }
            return objectMapper.convertValue(formulas, new TypeReference<LinkedHashMap<String, String>>() {
            });
        } catch (JsonProcessingException e) {
            throw new InvalidWorkbookException("Cannot read export document: " + e.getOriginalMessage());
        }
    }

    /**
     * Turns a flat formula map of one document back into loader input, one formula cell
     * per key. Every key must carry the same document id.
     */
    public WorkbookInput toWorkbookInput(Map<String, String> formulas) {
        WorkbookInput input = new WorkbookInput();
        List<String> sheetNames = new ArrayList<>();
        List<CellInput> cells = new ArrayList<>();
        String documentId = null;
        for (Map.Entry<String, String> entry : formulas.entrySet()) {
            QualifiedAddress address;
            try {
                address = QualifiedAddress.parse(entry.getKey());
            } catch (InvalidAddressException e) {
                throw new InvalidWorkbookException("Bad formula key " + entry.getKey() + ": " + e.getMessage());
            }
            if (address.getDocumentId() == null) {
                throw new InvalidWorkbookException("Formula key without document id: " + entry.getKey());
            }
            if (documentId == null) {
                documentId = address.getDocumentId();
            } else if (!documentId.equals(address.getDocumentId())) {
                throw new InvalidWorkbookException("Formula map mixes documents " + documentId
                        + " and " + address.getDocumentId());
            }
            if (!sheetNames.contains(address.getSheet())) {
                sheetNames.add(address.getSheet());
            }
            cells.add(CellInput.formula(address.getSheet(), address.getCell().toString(), entry.getValue()));
        }
        input.setDocumentId(documentId);
        input.setSheetNames(sheetNames);
        input.setCells(cells);
        return input;
    }

    /**
     * Global formula map over several documents plus their advisory integration points.
     */
    public MasterFormulaMapping masterMapping(Collection<WorkbookAnalysis> analyses, IntegrationIndex index) {
        Map<String, String> globalFormulas = new LinkedHashMap<>();
        Map<String, Map<String, List<String>>> sheetDependencies = new LinkedHashMap<>();
        for (WorkbookAnalysis analysis : analyses) {
            globalFormulas.putAll(analysis.getFormulaMap());
            sheetDependencies.put(analysis.getDocumentId(), analysis.getGraph().getSheetDependencies());
        }
        logger.info("Master mapping over {} documents: {} formulas, {} integration points",
                analyses.size(), globalFormulas.size(), index.getPoints().size());
        return new MasterFormulaMapping(globalFormulas, sheetDependencies, index.toFlatMap(),
                analyses.size(), Instant.now().toString());
    }
}
