package com.formulagraph.app.models;

import java.util.*;

/**
 * Raw tokenizer output for one formula, before classification.
 * Sets keep first-occurrence order so repeated tokenization compares equal.
 */
public final class FormulaTokens {

    private final String raw;
    private final Set<CellReference> cells;
    private final Set<RangeReference> ranges;
    private final Set<String> functions;
    private final Set<Operator> operators;
    private final List<Double> constants;

    public FormulaTokens(String raw,
                         Set<CellReference> cells,
                         Set<RangeReference> ranges,
                         Set<String> functions,
                         Set<Operator> operators,
                         List<Double> constants) {
        this.raw = raw;
        this.cells = Collections.unmodifiableSet(new LinkedHashSet<>(cells));
        this.ranges = Collections.unmodifiableSet(new LinkedHashSet<>(ranges));
        this.functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        this.operators = Collections.unmodifiableSet(new LinkedHashSet<>(operators));
        this.constants = Collections.unmodifiableList(new ArrayList<>(constants));
    }

    public static FormulaTokens empty(String raw) {
        return new FormulaTokens(raw, Collections.emptySet(), Collections.emptySet(),
                Collections.emptySet(), Collections.emptySet(), Collections.emptyList());
    }

    public String getRaw() {
        return raw;
    }

    public Set<CellReference> getCells() {
        return cells;
    }

    public Set<RangeReference> getRanges() {
        return ranges;
    }

    public Set<String> getFunctions() {
        return functions;
    }

    public Set<Operator> getOperators() {
        return operators;
    }

    public List<Double> getConstants() {
        return constants;
    }

    public boolean hasReferences() {
        return !cells.isEmpty() || !ranges.isEmpty();
    }
}
