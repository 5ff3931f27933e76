package com.formulagraph.app.services;

import com.formulagraph.app.config.AnalysisProperties;
import com.formulagraph.app.exceptions.InvalidWorkbookException;
import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.*;

/**
 * Analyzes several documents in parallel and relates them afterwards.
 *
 * <p>Fan-out: each document runs through the whole pipeline on a worker of a fixed pool,
 * owning its session. Fan-in: once every session is done, a single reducer pass builds the
 * integration index, the integration graph and the master formula mapping.
 */
@Service
public class BatchAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final WorkbookAnalysisService analysisService;
    private final IntegrationIndexService indexService;
    private final DependencyGraphBuilder graphBuilder;
    private final FormulaExportService exportService;
    private final int parallelism;

    @Autowired
    public BatchAnalysisService(WorkbookAnalysisService analysisService, IntegrationIndexService indexService,
                                DependencyGraphBuilder graphBuilder, FormulaExportService exportService,
                                AnalysisProperties properties) {
        this(analysisService, indexService, graphBuilder, exportService, properties.getBatch().getParallelism());
    }

    public BatchAnalysisService(WorkbookAnalysisService analysisService, IntegrationIndexService indexService,
                                DependencyGraphBuilder graphBuilder, FormulaExportService exportService,
                                int parallelism) {
        this.analysisService = analysisService;
        this.indexService = indexService;
        this.graphBuilder = graphBuilder;
        this.exportService = exportService;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Analyzes every input on the worker pool, then integrates the results.
     * The sessions are not stored. A loader contract violation in any input fails the batch.
     */
    public BatchAnalysis analyzeAll(List<WorkbookInput> inputs) {
        Set<String> ids = new HashSet<>();
        for (WorkbookInput input : inputs) {
            if (input != null && input.getDocumentId() != null && !ids.add(input.getDocumentId())) {
                throw new InvalidWorkbookException("Document " + input.getDocumentId() + " appears twice in the batch");
            }
        }

        ExecutorService workers = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, inputs.size())));
        try {
            List<Future<WorkbookAnalysis>> futures = new ArrayList<>();
            for (WorkbookInput input : inputs) {
                futures.add(workers.submit(() -> analysisService.run(input)));
            }
            List<WorkbookAnalysis> analyses = new ArrayList<>();
            for (Future<WorkbookAnalysis> future : futures) {
                analyses.add(await(future));
            }
            logger.info("Analyzed {} documents on {} workers", analyses.size(), parallelism);
            return integrate(analyses);
        } finally {
            workers.shutdownNow();
        }
    }

    /**
     * Integrates the stored sessions of the given documents.
     */
    public BatchAnalysis integrateStored(Collection<String> documentIds) {
        List<WorkbookAnalysis> analyses = new ArrayList<>();
        for (String documentId : new LinkedHashSet<>(documentIds)) {
            analyses.add(analysisService.getAnalysis(documentId));
        }
        return integrate(analyses);
    }

    /**
     * The single reducer pass over finished sessions.
     */
    public BatchAnalysis integrate(List<WorkbookAnalysis> analyses) {
        Map<String, WorkbookAnalysis> byDocument = new LinkedHashMap<>();
        Map<String, DependencyGraph> graphs = new LinkedHashMap<>();
        List<Workbook> workbooks = new ArrayList<>();
        for (WorkbookAnalysis analysis : analyses) {
            byDocument.put(analysis.getDocumentId(), analysis);
            graphs.put(analysis.getDocumentId(), analysis.getGraph());
            workbooks.add(analysis.getWorkbook());
        }
        IntegrationIndex index = indexService.buildIndex(workbooks);
        IntegrationGraph integrationGraph = graphBuilder.buildIntegrationGraph(graphs, index);
        MasterFormulaMapping mapping = exportService.masterMapping(byDocument.values(), index);
        return new BatchAnalysis(byDocument, index, integrationGraph, mapping);
    }

    private static WorkbookAnalysis await(Future<WorkbookAnalysis> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for document analysis", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Document analysis failed", cause);
        }
    }
}
