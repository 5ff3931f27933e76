package com.formulagraph.app.services;

import com.formulagraph.app.config.AnalysisProperties;
import com.formulagraph.app.exceptions.WorkbookNotFoundException;
import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the per-document pipeline and keeps the resulting sessions in memory:
 * load -> tokenize/analyze -> build graph -> detect cycles -> evaluate -> validate.
 * Sessions live until the caller discards them.
 */
@Service
public class WorkbookAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookAnalysisService.class);

    // All sessions live here in memory, keyed by document id
    private final Map<String, WorkbookAnalysis> sessions = new ConcurrentHashMap<>();

    private final FormulaAnalyzer analyzer;
    private final DependencyGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector;
    private final SafeEvaluator evaluator;
    private final FormulaValidator validator;
    private final int formulaCellLimit;

    @Autowired
    public WorkbookAnalysisService(FormulaAnalyzer analyzer, DependencyGraphBuilder graphBuilder,
                                   CycleDetector cycleDetector, SafeEvaluator evaluator,
                                   FormulaValidator validator, AnalysisProperties properties) {
        this(analyzer, graphBuilder, cycleDetector, evaluator, validator, properties.getFormulaCellLimit());
    }

    public WorkbookAnalysisService(FormulaAnalyzer analyzer, DependencyGraphBuilder graphBuilder,
                                   CycleDetector cycleDetector, SafeEvaluator evaluator,
                                   FormulaValidator validator, int formulaCellLimit) {
        this.analyzer = analyzer;
        this.graphBuilder = graphBuilder;
        this.cycleDetector = cycleDetector;
        this.evaluator = evaluator;
        this.validator = validator;
        this.formulaCellLimit = formulaCellLimit;
    }

    /**
     * Analyzes a document and stores the session under its document id,
     * replacing any earlier session of the same document.
     */
    public WorkbookAnalysis analyze(WorkbookInput input) {
        WorkbookAnalysis analysis = run(input);
        sessions.put(analysis.getDocumentId(), analysis);
        return analysis;
    }

    /**
     * Analyzes a document without storing it. Safe to call from several threads at once;
     * each call owns all the state it creates.
     */
    public WorkbookAnalysis run(WorkbookInput input) {
        Workbook workbook = Workbook.from(input);
        List<Cell> formulaCells = workbook.formulaCells();
        if (formulaCells.size() > formulaCellLimit) {
            logger.warn("Document {} has {} formulas, above the configured limit of {}",
                    workbook.getDocumentId(), formulaCells.size(), formulaCellLimit);
        }

        Map<QualifiedAddress, FormulaMetadata> metadata = new LinkedHashMap<>();
        for (Cell cell : formulaCells) {
            metadata.put(cell.getQualifiedAddress(), analyzer.analyze(cell.getFormula()));
        }

        DependencyGraph graph = graphBuilder.build(workbook, metadata);
        List<Cycle> cycles = cycleDetector.detect(graph);
        Map<QualifiedAddress, EvaluationResult> results = evaluateAll(workbook, graph, cycles);
        ValidationResult validation = validator.validate(workbook, graph, cycles, results);

        logger.info("Analyzed {}: {} sheets, {} formulas, {} dependencies ({} cross-sheet)",
                workbook.getDocumentId(), workbook.getSheets().size(), formulaCells.size(),
                graph.getEdgeCount(), graph.getCrossSheetEdgeCount());
        return new WorkbookAnalysis(workbook, metadata, graph, cycles, results, validation);
    }

    /**
     * Retrieves a session by document id. Throws if not found.
     */
    public WorkbookAnalysis getAnalysis(String documentId) {
        WorkbookAnalysis analysis = sessions.get(documentId);
        if (analysis == null) {
            throw new WorkbookNotFoundException("No analysis for document: " + documentId);
        }
        return analysis;
    }

    public Collection<WorkbookAnalysis> getAnalyses() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public void discard(String documentId) {
        if (sessions.remove(documentId) == null) {
            throw new WorkbookNotFoundException("No analysis for document: " + documentId);
        }
        logger.info("Discarded analysis of {}", documentId);
    }

    /**
     * Evaluates a formula that is not part of the document against the document's
     * resolved values, with the given sheet as home sheet.
     */
    public EvaluationResult evaluate(String documentId, String sheet, String formula) {
        WorkbookAnalysis analysis = getAnalysis(documentId);
        return evaluator.evaluate(formula, resolvedContext(analysis).onSheet(sheet));
    }

    /**
     * Full evaluation pass in dependency order: a formula is evaluated after every formula
     * it reads, including the formula cells inside the ranges it reads. Cells on a cycle and
     * cells failing the syntax check are not evaluated and count as unresolved for the
     * formulas that read them; so does any formula whose evaluation failed.
     */
    private Map<QualifiedAddress, EvaluationResult> evaluateAll(Workbook workbook, DependencyGraph graph,
                                                               List<Cycle> cycles) {
        EvaluationContext context = new EvaluationContext(null);
        for (Cell cell : workbook.allCells()) {
            if (cell.isFormula()) {
                // Pending until evaluated; a read that runs ahead of it fails instead of skipping it
                context.markUnresolved(cell.getQualifiedAddress());
            } else if (cell.getValue() != null) {
                context.put(cell.getQualifiedAddress(), cell.getValue());
            }
        }

        Map<QualifiedAddress, EvaluationResult> results = new LinkedHashMap<>();
        Set<QualifiedAddress> circular = CycleDetector.members(cycles);
        for (Cell cell : workbook.formulaCells()) {
            QualifiedAddress address = cell.getQualifiedAddress();
            if (circular.contains(address)) {
                results.put(address, EvaluationResult.failure(EvaluationErrorType.UNRESOLVED_REFERENCE,
                        "Cell " + address + " is part of a circular reference"));
                context.markUnresolved(address);
                continue;
            }
            Optional<String> syntaxError = validator.checkSyntax(cell.getFormula());
            if (syntaxError.isPresent()) {
                results.put(address, EvaluationResult.failure(EvaluationErrorType.MALFORMED_EXPRESSION,
                        syntaxError.get()));
                context.markUnresolved(address);
            }
        }

        for (QualifiedAddress address : evaluationOrder(workbook, graph, results.keySet())) {
            Cell cell = workbook.getCell(address);
            EvaluationResult result = evaluator.evaluate(cell.getFormula(), context.onSheet(address.getSheet()));
            results.put(address, result);
            if (result.isSuccess()) {
                context.put(address, result.getValue());
            } else {
                context.markUnresolved(address);
            }
        }

        // Keep loader order for reports
        Map<QualifiedAddress, EvaluationResult> ordered = new LinkedHashMap<>();
        for (Cell cell : workbook.formulaCells()) {
            ordered.put(cell.getQualifiedAddress(), results.get(cell.getQualifiedAddress()));
        }
        return ordered;
    }

    /**
     * Formula nodes outside 'excluded' in post-order of an explicit-stack depth-first
     * traversal, so dependencies come before their dependents. Besides the graph edges, a
     * formula that reads a range also waits for every formula cell inside that range; the
     * graph only records the corners. With cycle members excluded the remaining formula
     * graph has no cycle.
     */
    private List<QualifiedAddress> evaluationOrder(Workbook workbook, DependencyGraph graph,
                                                   Set<QualifiedAddress> excluded) {
        Map<String, List<QualifiedAddress>> formulasBySheet = new HashMap<>();
        for (Cell cell : workbook.formulaCells()) {
            formulasBySheet.computeIfAbsent(cell.getSheet(), k -> new ArrayList<>()).add(cell.getQualifiedAddress());
        }

        List<QualifiedAddress> order = new ArrayList<>();
        Set<QualifiedAddress> seen = new HashSet<>(excluded);
        for (QualifiedAddress root : graph.getNodes()) {
            if (!graph.isFormulaNode(root) || !seen.add(root)) {
                continue;
            }
            Deque<QualifiedAddress> nodes = new ArrayDeque<>();
            Deque<Iterator<QualifiedAddress>> pending = new ArrayDeque<>();
            nodes.push(root);
            pending.push(predecessors(graph, root, formulasBySheet).iterator());
            while (!nodes.isEmpty()) {
                Iterator<QualifiedAddress> dependencies = pending.peek();
                if (dependencies.hasNext()) {
                    QualifiedAddress next = dependencies.next();
                    if (graph.isFormulaNode(next) && seen.add(next)) {
                        nodes.push(next);
                        pending.push(predecessors(graph, next, formulasBySheet).iterator());
                    }
                } else {
                    pending.pop();
                    order.add(nodes.pop());
                }
            }
        }
        return order;
    }

    private static List<QualifiedAddress> predecessors(DependencyGraph graph, QualifiedAddress node,
                                                       Map<String, List<QualifiedAddress>> formulasBySheet) {
        List<QualifiedAddress> predecessors = new ArrayList<>(graph.getDependencies(node));
        FormulaMetadata metadata = graph.getMetadata(node);
        if (metadata == null) {
            return predecessors;
        }
        for (RangeReference range : metadata.getReferencedRanges()) {
            String sheet = range.getSheet() == null ? node.getSheet() : range.getSheet();
            for (QualifiedAddress formula : formulasBySheet.getOrDefault(sheet, Collections.emptyList())) {
                if (range.contains(formula.getCell()) && !formula.equals(node)) {
                    predecessors.add(formula);
                }
            }
        }
        return predecessors;
    }

    /**
     * Context holding every literal value and every successful formula result of the document.
     */
    private EvaluationContext resolvedContext(WorkbookAnalysis analysis) {
        EvaluationContext context = new EvaluationContext(null);
        for (Cell cell : analysis.getWorkbook().allCells()) {
            QualifiedAddress address = cell.getQualifiedAddress();
            if (!cell.isFormula()) {
                if (cell.getValue() != null) {
                    context.put(address, cell.getValue());
                }
                continue;
            }
            EvaluationResult result = analysis.getResult(address);
            if (result != null && result.isSuccess()) {
                context.put(address, result.getValue());
            } else {
                context.markUnresolved(address);
            }
        }
        return context;
    }
}
