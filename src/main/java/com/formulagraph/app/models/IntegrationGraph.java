package com.formulagraph.app.models;

import java.util.*;

/**
 * Dependency graph across independently loaded documents.
 * Every node carries its document id. Documents are connected only by advisory
 * integration links, never by matching addresses.
 */
public class IntegrationGraph {

    private final DependencyGraph graph;
    private final List<IntegrationLink> links;

    public IntegrationGraph(DependencyGraph graph, List<IntegrationLink> links) {
        this.graph = graph;
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public List<IntegrationLink> getLinks() {
        return links;
    }

    public Set<String> getDocumentIds() {
        Set<String> documents = new LinkedHashSet<>();
        for (QualifiedAddress node : graph.getNodes()) {
            documents.add(node.getDocumentId());
        }
        return documents;
    }
}
