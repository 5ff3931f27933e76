package com.formulagraph.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the external workbook loader hands over for one document:
 * its id, the declared sheet names and the ordered cell enumeration.
 */
public class WorkbookInput {
    private String documentId;
    private List<String> sheetNames = new ArrayList<>();
    private List<CellInput> cells = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public WorkbookInput() {
    }

    public WorkbookInput(String documentId, List<String> sheetNames, List<CellInput> cells) {
        this.documentId = documentId;
        this.sheetNames = sheetNames;
        this.cells = cells;
    }

    public String getDocumentId() {
        return documentId;
    }
    public List<String> getSheetNames() {
        return sheetNames;
    }
    public List<CellInput> getCells() {
        return cells;
    }
    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }
    public void setSheetNames(List<String> sheetNames) {
        this.sheetNames = sheetNames;
    }
    public void setCells(List<CellInput> cells) {
        this.cells = cells;
    }
}
