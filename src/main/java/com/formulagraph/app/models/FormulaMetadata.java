package com.formulagraph.app.models;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-formula analysis: the tokens found in the formula text, its type and a
 * diagnostic complexity score
 * (1 per cell reference, 2 per range, 3 per function, 1 per operator).
 */
public final class FormulaMetadata {

    private final String raw;
    private final Set<CellReference> referencedCells;
    private final Set<RangeReference> referencedRanges;
    private final Set<String> functions;
    private final Set<Operator> operators;
    private final List<Double> constants;
    private final FormulaType formulaType;
    private final int complexityScore;

    public FormulaMetadata(FormulaTokens tokens, FormulaType formulaType, int complexityScore) {
        this.raw = tokens.getRaw();
        this.referencedCells = tokens.getCells();
        this.referencedRanges = tokens.getRanges();
        this.functions = tokens.getFunctions();
        this.operators = tokens.getOperators();
        this.constants = tokens.getConstants();
        this.formulaType = formulaType;
        this.complexityScore = complexityScore;
    }

    public String getRaw() {
        return raw;
    }

    public Set<CellReference> getReferencedCells() {
        return referencedCells;
    }

    public Set<RangeReference> getReferencedRanges() {
        return referencedRanges;
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

    public FormulaType getFormulaType() {
        return formulaType;
    }

    public int getComplexityScore() {
        return complexityScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaMetadata)) {
            return false;
        }
        FormulaMetadata that = (FormulaMetadata) o;
        return complexityScore == that.complexityScore
                && Objects.equals(raw, that.raw)
                && referencedCells.equals(that.referencedCells)
                && referencedRanges.equals(that.referencedRanges)
                && functions.equals(that.functions)
                && operators.equals(that.operators)
                && constants.equals(that.constants)
                && formulaType == that.formulaType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, referencedCells, referencedRanges, functions, operators,
                constants, formulaType, complexityScore);
    }

    @Override
    public String toString() {
        return "FormulaMetadata{" + raw + ", type=" + formulaType + ", score=" + complexityScore + "}";
    }
}
