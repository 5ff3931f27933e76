package com.formulagraph.app.controllers;

import com.formulagraph.app.exceptions.CellNotFoundException;
import com.formulagraph.app.models.*;
import com.formulagraph.app.services.FormulaDocumentationService;
import com.formulagraph.app.services.FormulaExportService;
import com.formulagraph.app.services.FormulaQueryService;
import com.formulagraph.app.services.WorkbookAnalysisService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * REST endpoints for analysing documents and reading their analysis.
 * "/workbook" is the base path; documents are addressed by their document id.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookAnalysisService analysisService;

    @Autowired
    private FormulaExportService exportService;

    @Autowired
    private FormulaQueryService queryService;

    @Autowired
    private FormulaDocumentationService documentationService;

    /**
     * POST /workbook
     * Body: the loader output {documentId, sheetNames, cells}.
     * Runs the whole analysis and returns the validation report.
     * A broken loader contract is turned into a 400 by the GlobalExceptionHandler.
     */
    @PostMapping
    public ResponseEntity<ValidationResult> analyze(@RequestBody WorkbookInput input) {
        WorkbookAnalysis analysis = analysisService.analyze(input);
        return ResponseEntity.ok(analysis.getValidation());
    }

    /**
     * GET /workbook/{documentId}/formulas
     * Returns { "doc#Sheet1!B2": "=B1*2", ... }.
     */
    @GetMapping("/{documentId}/formulas")
    public ResponseEntity<Map<String, String>> getFormulas(@PathVariable String documentId) {
        return ResponseEntity.ok(analysisService.getAnalysis(documentId).getFormulaMap());
    }

    /**
     * GET /workbook/{documentId}/forwardDependencies
     * For each formula cell, the set of cells it references.
     */
    @GetMapping("/{documentId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable String documentId) {
        DependencyGraph graph = analysisService.getAnalysis(documentId).getGraph();
        return ResponseEntity.ok(DependencyGraph.render(graph.getForwardGraph()));
    }

    /**
     * GET /workbook/{documentId}/reverseDependencies
     * For each cell, the set of formula cells that read it.
     */
    @GetMapping("/{documentId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable String documentId) {
        DependencyGraph graph = analysisService.getAnalysis(documentId).getGraph();
        return ResponseEntity.ok(DependencyGraph.render(graph.getReverseGraph()));
    }

    @GetMapping("/{documentId}/cycles")
    public ResponseEntity<List<Cycle>> getCycles(@PathVariable String documentId) {
        return ResponseEntity.ok(analysisService.getAnalysis(documentId).getCycles());
    }

    @GetMapping("/{documentId}/validation")
    public ResponseEntity<ValidationResult> getValidation(@PathVariable String documentId) {
        return ResponseEntity.ok(analysisService.getAnalysis(documentId).getValidation());
    }

    @GetMapping("/{documentId}/export")
    public ResponseEntity<FormulaExport> export(@PathVariable String documentId) {
        return ResponseEntity.ok(exportService.export(analysisService.getAnalysis(documentId)));
    }

    /**
     * GET /workbook/{documentId}/resolve?address=Sheet1!B2
     * Returns the evaluated or literal value of one cell; 404 when it has none.
     */
    @GetMapping("/{documentId}/resolve")
    public ResponseEntity<Object> resolve(@PathVariable String documentId, @RequestParam String address) {
        WorkbookAnalysis analysis = analysisService.getAnalysis(documentId);
        Object value = analysis.resolve(QualifiedAddress.parse(address))
                .orElseThrow(() -> new CellNotFoundException("No resolved value at " + address + " in " + documentId));
        return ResponseEntity.ok(value);
    }

    /**
     * GET /workbook/{documentId}/formulas/search?keywords=load,moment
     */
    @GetMapping("/{documentId}/formulas/search")
    public ResponseEntity<List<FormulaRecord>> search(@PathVariable String documentId,
                                                      @RequestParam List<String> keywords) {
        WorkbookAnalysis analysis = analysisService.getAnalysis(documentId);
        return ResponseEntity.ok(queryService.formulasReferencing(analysis, new LinkedHashSet<>(keywords)));
    }

    @GetMapping("/{documentId}/categories")
    public ResponseEntity<Map<EngineeringCategory, List<FormulaRecord>>> categorize(@PathVariable String documentId) {
        return ResponseEntity.ok(queryService.categorize(analysisService.getAnalysis(documentId)));
    }

    @GetMapping(value = "/{documentId}/documentation", produces = "text/markdown")
    public ResponseEntity<String> documentation(@PathVariable String documentId) {
        return ResponseEntity.ok(documentationService.document(analysisService.getAnalysis(documentId)));
    }

    /**
     * POST /workbook/{documentId}/evaluate
     * Body: { "sheet": "Sheet1", "formula": "=B2*2" }.
     * Evaluates the formula against the document's resolved values. Evaluation problems
     * come back inside the result, not as an error status.
     */
    @PostMapping(value = "/{documentId}/evaluate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EvaluationResult> evaluate(@PathVariable String documentId,
                                                     @RequestBody Map<String, String> request) {
        EvaluationResult result = analysisService.evaluate(documentId, request.get("sheet"), request.get("formula"));
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> discard(@PathVariable String documentId) {
        analysisService.discard(documentId);
        return ResponseEntity.noContent().build();
    }
}
