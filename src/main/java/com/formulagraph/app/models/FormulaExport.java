package com.formulagraph.app.models;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat, serializable view of one analysed document for report and export tools.
 * Addresses are plain "doc#Sheet!A1" strings so consumers need no graph model.
 */
public class FormulaExport {

    private final String documentId;
    private final Map<String, String> formulas;
    private final ValidationResult validation;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, List<String>> sheetDependencies;
    private final List<Cycle> cycles;

    public FormulaExport(String documentId,
                         Map<String, String> formulas,
                         ValidationResult validation,
                         Map<String, Set<String>> dependencies,
                         Map<String, List<String>> sheetDependencies,
                         List<Cycle> cycles) {
        this.documentId = documentId;
        this.formulas = formulas;
        this.validation = validation;
        this.dependencies = dependencies;
        this.sheetDependencies = sheetDependencies;
        this.cycles = cycles;
    }

    public String getDocumentId() {
        return documentId;
    }

    public Map<String, String> getFormulas() {
        return formulas;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    public Map<String, Set<String>> getDependencies() {
        return dependencies;
    }

    public Map<String, List<String>> getSheetDependencies() {
        return sheetDependencies;
    }

    public List<Cycle> getCycles() {
        return cycles;
    }
}
