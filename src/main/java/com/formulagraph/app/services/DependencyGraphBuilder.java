package com.formulagraph.app.services;

import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Converts per-formula reference lists into dependency edges.
 * - single cells become one edge each
 * - ranges become two edges, one per corner (interior cells are not enumerated)
 * - unqualified references resolve to the formula's own sheet
 * - references to sheets the document does not have become dangling nodes
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    /**
     * Builds the graph of one document from the metadata of its formula cells.
     */
    public DependencyGraph build(Workbook workbook, Map<QualifiedAddress, FormulaMetadata> formulas) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (Map.Entry<QualifiedAddress, FormulaMetadata> entry : formulas.entrySet()) {
            QualifiedAddress source = entry.getKey();
            builder.addFormula(source, entry.getValue());
            for (QualifiedAddress target : referencedNodes(source.getSheet(), entry.getValue())) {
                builder.addDependency(source, target);
                if (!workbook.hasSheet(target.getSheet())) {
                    builder.markDangling(target);
                }
            }
        }
        DependencyGraph graph = builder.build();
        logger.debug("Built dependency graph for {}: {} nodes, {} edges, {} dangling",
                workbook.getDocumentId(), graph.getNodes().size(), graph.getEdgeCount(),
                graph.getDanglingNodes().size());
        return graph;
    }

    /**
     * Targets of one formula: its cells plus the two corners of each range.
     */
    public Set<QualifiedAddress> referencedNodes(String homeSheet, FormulaMetadata metadata) {
        Set<QualifiedAddress> targets = new LinkedHashSet<>();
        for (CellReference cell : metadata.getReferencedCells()) {
            targets.add(cell.resolve(homeSheet));
        }
        for (RangeReference range : metadata.getReferencedRanges()) {
            targets.addAll(range.corners(homeSheet));
        }
        return targets;
    }

    /**
     * Merges per-document graphs into one graph whose nodes carry their document id.
     * Documents are joined only through the advisory integration index: every pair of
     * candidates for the same parameter in two different documents becomes one link.
     */
    public IntegrationGraph buildIntegrationGraph(Map<String, DependencyGraph> documents, IntegrationIndex index) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (Map.Entry<String, DependencyGraph> document : documents.entrySet()) {
            String documentId = document.getKey();
            DependencyGraph graph = document.getValue();
            for (QualifiedAddress node : graph.getNodes()) {
                if (graph.isFormulaNode(node)) {
                    builder.addFormula(node.withDocument(documentId), graph.getMetadata(node));
                }
            }
            for (QualifiedAddress node : graph.getNodes()) {
                for (QualifiedAddress target : graph.getDependencies(node)) {
                    builder.addDependency(node.withDocument(documentId), target.withDocument(documentId));
                }
            }
            for (QualifiedAddress dangling : graph.getDanglingNodes()) {
                builder.markDangling(dangling.withDocument(documentId));
            }
        }

        List<IntegrationLink> links = new ArrayList<>();
        for (Map.Entry<IntegrationParameter, List<ParameterMatch>> point : index.getPoints().entrySet()) {
            List<ParameterMatch> matches = point.getValue();
            for (int i = 0; i < matches.size(); i++) {
                for (int j = i + 1; j < matches.size(); j++) {
                    QualifiedAddress from = matches.get(i).getAddress();
                    QualifiedAddress to = matches.get(j).getAddress();
                    if (!Objects.equals(from.getDocumentId(), to.getDocumentId())) {
                        links.add(new IntegrationLink(point.getKey(), from, to));
                    }
                }
            }
        }
        logger.info("Built integration graph over {} documents with {} advisory links",
                documents.size(), links.size());
        return new IntegrationGraph(builder.build(), links);
    }
}
