package com.formulagraph.app.models;

/**
 * Represents a single normalized spreadsheet cell.
 * Stores:
 * - which sheet and which address (column letters + row)
 * - the literal value the loader read (String, Double, Boolean or null)
 * - the raw formula text, only when it starts with the formula marker '='
 */
public class Cell {

    public static final String FORMULA_MARKER = "=";

    private final String sheet;
    private final CellAddress address;
    private final Object value;
    // Raw formula text such as "=B2*B3", null for literal cells
    private final String formula;

    public Cell(String sheet, CellAddress address, Object value, String formula) {
        this.sheet = sheet;
        this.address = address;
        this.value = value;
        this.formula = isFormulaText(formula) ? formula : null;
    }

    public static boolean isFormulaText(String text) {
        return text != null && text.startsWith(FORMULA_MARKER);
    }

    public String getSheet() {
        return sheet;
    }

    public CellAddress getAddress() {
        return address;
    }

    public QualifiedAddress getQualifiedAddress() {
        return QualifiedAddress.of(sheet, address);
    }

    public Object getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public boolean isFormula() {
        return formula != null;
    }

    /**
     * True for literal cells holding text, the kind of cell that labels a parameter.
     */
    public boolean isText() {
        return formula == null && value instanceof String;
    }
}
