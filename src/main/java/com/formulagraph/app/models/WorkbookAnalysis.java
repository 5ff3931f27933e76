package com.formulagraph.app.models;

import java.util.*;

/**
 * The processing session of one document: the workbook, the analysis of each formula,
 * the dependency graph, its cycles, the evaluated results and the validation report.
 * Nothing here is shared with the sessions of other documents.
 */
public class WorkbookAnalysis {

    private final Workbook workbook;
    private final Map<QualifiedAddress, FormulaMetadata> metadata;
    private final DependencyGraph graph;
    private final List<Cycle> cycles;
    private final Map<QualifiedAddress, EvaluationResult> results;
    private final ValidationResult validation;

    public WorkbookAnalysis(Workbook workbook,
                            Map<QualifiedAddress, FormulaMetadata> metadata,
                            DependencyGraph graph,
                            List<Cycle> cycles,
                            Map<QualifiedAddress, EvaluationResult> results,
                            ValidationResult validation) {
        this.workbook = workbook;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.graph = graph;
        this.cycles = Collections.unmodifiableList(new ArrayList<>(cycles));
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.validation = validation;
    }

    public String getDocumentId() {
        return workbook.getDocumentId();
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public Map<QualifiedAddress, FormulaMetadata> getMetadata() {
        return metadata;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public List<Cycle> getCycles() {
        return cycles;
    }

    public Map<QualifiedAddress, EvaluationResult> getResults() {
        return results;
    }

    public EvaluationResult getResult(QualifiedAddress address) {
        return results.get(address.withoutDocument());
    }

    public ValidationResult getValidation() {
        return validation;
    }

    /**
     * Value of a cell after evaluation: the computed value of a formula cell that evaluated
     * successfully, or the literal value of a plain cell. Empty for failed formulas,
     * empty cells and unknown addresses. A document id on the address must match this document.
     */
    public Optional<Object> resolve(QualifiedAddress address) {
        if (address.getDocumentId() != null && !address.getDocumentId().equals(getDocumentId())) {
            return Optional.empty();
        }
        QualifiedAddress local = address.withoutDocument();
        Cell cell = workbook.getCell(local);
        if (cell == null) {
            return Optional.empty();
        }
        if (cell.isFormula()) {
            EvaluationResult result = results.get(local);
            return result != null && result.isSuccess() ? Optional.ofNullable(result.getValue()) : Optional.empty();
        }
        return Optional.ofNullable(cell.getValue());
    }

    /**
     * Every formula of the document, in loader order.
     */
    public List<FormulaRecord> getFormulaRecords() {
        List<FormulaRecord> records = new ArrayList<>();
        for (Map.Entry<QualifiedAddress, FormulaMetadata> entry : metadata.entrySet()) {
            records.add(new FormulaRecord(entry.getKey(), entry.getValue().getRaw(), entry.getValue()));
        }
        return records;
    }

    /**
     * Flat "doc#Sheet!A1" -> formula text map.
     */
    public Map<String, String> getFormulaMap() {
        Map<String, String> formulas = new LinkedHashMap<>();
        for (Map.Entry<QualifiedAddress, FormulaMetadata> entry : metadata.entrySet()) {
            formulas.put(entry.getKey().withDocument(getDocumentId()).toString(), entry.getValue().getRaw());
        }
        return formulas;
    }
}
