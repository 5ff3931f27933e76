package com.formulagraph.app.models;

/**
 * One formula cell with its analysis, as handed to report sections.
 */
public final class FormulaRecord {

    private final QualifiedAddress address;
    private final String formula;
    private final FormulaMetadata metadata;

    public FormulaRecord(QualifiedAddress address, String formula, FormulaMetadata metadata) {
        this.address = address;
        this.formula = formula;
        this.metadata = metadata;
    }

    public QualifiedAddress getAddress() {
        return address;
    }

    public String getFormula() {
        return formula;
    }

    public FormulaMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return address + " " + formula;
    }
}
