package com.formulagraph.app.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of analysing several documents together: one session per document plus the
 * shared, advisory cross-document structures built after all sessions finished.
 */
public class BatchAnalysis {

    private final Map<String, WorkbookAnalysis> analyses;
    private final IntegrationIndex index;
    private final IntegrationGraph integrationGraph;
    private final MasterFormulaMapping mapping;

    public BatchAnalysis(Map<String, WorkbookAnalysis> analyses, IntegrationIndex index,
                         IntegrationGraph integrationGraph, MasterFormulaMapping mapping) {
        this.analyses = Collections.unmodifiableMap(new LinkedHashMap<>(analyses));
        this.index = index;
        this.integrationGraph = integrationGraph;
        this.mapping = mapping;
    }

    public Map<String, WorkbookAnalysis> getAnalyses() {
        return analyses;
    }

    public WorkbookAnalysis getAnalysis(String documentId) {
        return analyses.get(documentId);
    }

    public IntegrationIndex getIndex() {
        return index;
    }

    public IntegrationGraph getIntegrationGraph() {
        return integrationGraph;
    }

    public MasterFormulaMapping getMapping() {
        return mapping;
    }
}
