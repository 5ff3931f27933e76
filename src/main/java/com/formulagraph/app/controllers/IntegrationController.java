package com.formulagraph.app.controllers;

import com.formulagraph.app.models.BatchAnalysis;
import com.formulagraph.app.models.MasterFormulaMapping;
import com.formulagraph.app.services.BatchAnalysisService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Relates documents that were already analysed through POST /workbook.
 */
@RestController
@RequestMapping("/integration")
public class IntegrationController {

    @Autowired
    private BatchAnalysisService batchService;

    /**
     * POST /integration
     * Body: ["bridge.xlsx", "hydraulics.xlsx"].
     * Returns the master formula mapping with the advisory integration points.
     */
    @PostMapping
    public ResponseEntity<MasterFormulaMapping> integrate(@RequestBody List<String> documentIds) {
        BatchAnalysis batch = batchService.integrateStored(documentIds);
        return ResponseEntity.ok(batch.getMapping());
    }
}
