package com.formulagraph.app.models;

import java.util.*;

/**
 * Directed dependency graph of one document (or one document inside an integration graph):
 * - nodes: formula cells and every cell a formula reads
 * - forward adjacency: formula cell -> cells it references
 * - reverse adjacency: referenced cell -> formula cells that read it
 * - dangling nodes: targets on sheets the document does not have
 * Immutable once built; use {@link Builder}.
 */
public class DependencyGraph {

    private final Map<QualifiedAddress, Set<QualifiedAddress>> forward;
    private final Map<QualifiedAddress, Set<QualifiedAddress>> reverse;
    private final Map<QualifiedAddress, FormulaMetadata> metadata;
    private final Set<QualifiedAddress> dangling;

    private DependencyGraph(Builder builder) {
        this.forward = freeze(builder.forward);
        this.reverse = freeze(builder.reverse);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.dangling = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dangling));
    }

    private static Map<QualifiedAddress, Set<QualifiedAddress>> freeze(Map<QualifiedAddress, Set<QualifiedAddress>> adjacency) {
        Map<QualifiedAddress, Set<QualifiedAddress>> frozen = new LinkedHashMap<>();
        for (Map.Entry<QualifiedAddress, Set<QualifiedAddress>> entry : adjacency.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Every node, in the order it was first seen.
     */
    public Set<QualifiedAddress> getNodes() {
        return forward.keySet();
    }

    public Set<QualifiedAddress> getDependencies(QualifiedAddress node) {
        return forward.getOrDefault(node, Collections.emptySet());
    }

    public Set<QualifiedAddress> getDependents(QualifiedAddress node) {
        return reverse.getOrDefault(node, Collections.emptySet());
    }

    public Map<QualifiedAddress, Set<QualifiedAddress>> getForwardGraph() {
        return forward;
    }

    public Map<QualifiedAddress, Set<QualifiedAddress>> getReverseGraph() {
        return reverse;
    }

    public FormulaMetadata getMetadata(QualifiedAddress node) {
        return metadata.get(node);
    }

    public boolean isFormulaNode(QualifiedAddress node) {
        return metadata.containsKey(node);
    }

    public Set<QualifiedAddress> getDanglingNodes() {
        return dangling;
    }

    public int getEdgeCount() {
        int edges = 0;
        for (Set<QualifiedAddress> targets : forward.values()) {
            edges += targets.size();
        }
        return edges;
    }

    /**
     * Edges whose source and target live on different sheets.
     */
    public int getCrossSheetEdgeCount() {
        int edges = 0;
        for (Map.Entry<QualifiedAddress, Set<QualifiedAddress>> entry : forward.entrySet()) {
            for (QualifiedAddress target : entry.getValue()) {
                if (!target.getSheet().equals(entry.getKey().getSheet())) {
                    edges++;
                }
            }
        }
        return edges;
    }

    /**
     * Sheet -> other sheets its formulas read from, in first-seen order.
     */
    public Map<String, List<String>> getSheetDependencies() {
        Map<String, Set<String>> bySheet = new LinkedHashMap<>();
        for (Map.Entry<QualifiedAddress, Set<QualifiedAddress>> entry : forward.entrySet()) {
            String source = entry.getKey().getSheet();
            for (QualifiedAddress target : entry.getValue()) {
                if (!target.getSheet().equals(source)) {
                    bySheet.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target.getSheet());
                }
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        bySheet.forEach((sheet, targets) -> result.put(sheet, new ArrayList<>(targets)));
        return result;
    }

    /**
     * Adjacency rendered with string keys, the shape reports and JSON consumers use.
     */
    public static Map<String, Set<String>> render(Map<QualifiedAddress, Set<QualifiedAddress>> adjacency) {
        Map<String, Set<String>> rendered = new LinkedHashMap<>();
        for (Map.Entry<QualifiedAddress, Set<QualifiedAddress>> entry : adjacency.entrySet()) {
            Set<String> targets = new LinkedHashSet<>();
            for (QualifiedAddress target : entry.getValue()) {
                targets.add(target.toString());
            }
            rendered.put(entry.getKey().toString(), targets);
        }
        return rendered;
    }

    /**
     * Mutable accumulator for one build pass.
     */
    public static class Builder {
        private final Map<QualifiedAddress, Set<QualifiedAddress>> forward = new LinkedHashMap<>();
        private final Map<QualifiedAddress, Set<QualifiedAddress>> reverse = new LinkedHashMap<>();
        private final Map<QualifiedAddress, FormulaMetadata> metadata = new LinkedHashMap<>();
        private final Set<QualifiedAddress> dangling = new LinkedHashSet<>();

        private Builder() {
        }

        /**
         * Registers a formula node, even when it references nothing.
         */
        public Builder addFormula(QualifiedAddress node, FormulaMetadata formulaMetadata) {
            metadata.put(node, formulaMetadata);
            forward.putIfAbsent(node, new LinkedHashSet<>());
            reverse.putIfAbsent(node, new LinkedHashSet<>());
            return this;
        }

        /**
         * Adds an edge from 'source' -> 'target' in the forward graph,
         * and 'target' -> 'source' in the reverse graph.
         * The source must already be registered with addFormula.
         */
        public Builder addDependency(QualifiedAddress source, QualifiedAddress target) {
            if (!metadata.containsKey(source)) {
                throw new IllegalStateException("Edge source " + source + " has no formula metadata");
            }
            // FORWARD: source -> target
            forward.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
            forward.putIfAbsent(target, new LinkedHashSet<>());

            // REVERSE: target -> source
            reverse.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
            reverse.putIfAbsent(source, new LinkedHashSet<>());
            return this;
        }

        public Builder markDangling(QualifiedAddress node) {
            dangling.add(node);
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(this);
        }
    }
}
