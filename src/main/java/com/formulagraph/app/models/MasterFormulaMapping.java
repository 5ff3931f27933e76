package com.formulagraph.app.models;

import java.util.List;
import java.util.Map;

/**
 * Formulas of several documents under one global key space, with the advisory
 * integration points that relate the documents.
 */
public class MasterFormulaMapping {

    private final Map<String, String> globalFormulas;
    private final Map<String, Map<String, List<String>>> sheetDependencies;
    private final Map<String, List<String>> integrationPoints;
    private final int documentsProcessed;
    private final String createdAt;

    public MasterFormulaMapping(Map<String, String> globalFormulas,
                                Map<String, Map<String, List<String>>> sheetDependencies,
                                Map<String, List<String>> integrationPoints,
                                int documentsProcessed,
                                String createdAt) {
        this.globalFormulas = globalFormulas;
        this.sheetDependencies = sheetDependencies;
        this.integrationPoints = integrationPoints;
        this.documentsProcessed = documentsProcessed;
        this.createdAt = createdAt;
    }

    /**
     * "doc#Sheet!A1" -> formula text, over every document.
     */
    public Map<String, String> getGlobalFormulas() {
        return globalFormulas;
    }

    /**
     * Document id -> sheet -> sheets its formulas read from.
     */
    public Map<String, Map<String, List<String>>> getSheetDependencies() {
        return sheetDependencies;
    }

    public Map<String, List<String>> getIntegrationPoints() {
        return integrationPoints;
    }

    public int getDocumentsProcessed() {
        return documentsProcessed;
    }

    public String getCreatedAt() {
        return createdAt;
    }
}
