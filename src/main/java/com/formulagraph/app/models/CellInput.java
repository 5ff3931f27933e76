package com.formulagraph.app.models;

/**
 * One cell as enumerated by the external workbook loader:
 * (sheet, address, literal value or null, raw formula text or null, formula flag).
 */
public class CellInput {
    private String sheet;
    private String address;
    private Object value;
    private String formula;
    private boolean formulaCell;

    // Default constructor needed for JSON (de)serialization
    public CellInput() {
    }

    public CellInput(String sheet, String address, Object value, String formula, boolean formulaCell) {
        this.sheet = sheet;
        this.address = address;
        this.value = value;
        this.formula = formula;
        this.formulaCell = formulaCell;
    }

    public static CellInput literal(String sheet, String address, Object value) {
        return new CellInput(sheet, address, value, null, false);
    }

    public static CellInput formula(String sheet, String address, String formula) {
        return new CellInput(sheet, address, null, formula, true);
    }

    public String getSheet() {
        return sheet;
    }
    public String getAddress() {
        return address;
    }
    public Object getValue() {
        return value;
    }
    public String getFormula() {
        return formula;
    }
    public boolean isFormulaCell() {
        return formulaCell;
    }
    public void setSheet(String sheet) {
        this.sheet = sheet;
    }
    public void setAddress(String address) {
        this.address = address;
    }
    public void setValue(Object value) {
        this.value = value;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setFormulaCell(boolean formulaCell) {
        this.formulaCell = formulaCell;
    }
}
