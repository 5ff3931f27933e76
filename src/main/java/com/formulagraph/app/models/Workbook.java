package com.formulagraph.app.models;

import com.formulagraph.app.exceptions.InvalidAddressException;
import com.formulagraph.app.exceptions.InvalidWorkbookException;

import java.util.*;

/**
 * An immutable, normalized document: the cell stream of one loader pass grouped by sheet.
 * Numeric literals are normalized to Double so evaluation sees one number type.
 */
public class Workbook {

    private final String documentId;
    private final List<String> sheetNames;
    private final Map<String, Sheet> sheets;

    private Workbook(String documentId, List<String> sheetNames, Map<String, Sheet> sheets) {
        this.documentId = documentId;
        this.sheetNames = Collections.unmodifiableList(sheetNames);
        this.sheets = Collections.unmodifiableMap(sheets);
    }

    /**
     * Builds a workbook from the loader enumeration.
     * Throws InvalidWorkbookException when the loader contract is broken
     * (no document id, '#' in the document id, unparseable address, duplicate address).
     */
    public static Workbook from(WorkbookInput input) {
        if (input == null || input.getDocumentId() == null || input.getDocumentId().isBlank()) {
            throw new InvalidWorkbookException("Workbook input must carry a document id");
        }
        if (input.getDocumentId().indexOf('#') >= 0) {
            throw new InvalidWorkbookException("Document id must not contain '#': " + input.getDocumentId());
        }
        List<String> names = new ArrayList<>();
        Map<String, Sheet> sheets = new LinkedHashMap<>();
        if (input.getSheetNames() != null) {
            for (String name : input.getSheetNames()) {
                if (!sheets.containsKey(name)) {
                    names.add(name);
                    sheets.put(name, new Sheet(name));
                }
            }
        }
        List<CellInput> cells = input.getCells() == null ? Collections.emptyList() : input.getCells();
        for (CellInput cellInput : cells) {
            String sheetName = cellInput.getSheet();
            if (sheetName == null || sheetName.isEmpty()) {
                throw new InvalidWorkbookException("Cell " + cellInput.getAddress() + " has no sheet");
            }
            // Sheets missing from the declared list still hold their cells
            Sheet sheet = sheets.computeIfAbsent(sheetName, Sheet::new);
            CellAddress address;
            try {
                address = CellAddress.parse(cellInput.getAddress());
            } catch (InvalidAddressException e) {
                throw new InvalidWorkbookException("Bad address in sheet " + sheetName + ": " + e.getMessage());
            }
            String formula = cellInput.getFormula();
            if (formula == null && cellInput.isFormulaCell() && cellInput.getValue() instanceof String) {
                formula = (String) cellInput.getValue();
            }
            sheet.addCell(new Cell(sheetName, address, normalizeLiteral(cellInput.getValue()), formula));
        }
        return new Workbook(input.getDocumentId(), names, sheets);
    }

    private static Object normalizeLiteral(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    public String getDocumentId() {
        return documentId;
    }

    /**
     * The sheet names the loader declared, in declaration order.
     */
    public List<String> getSheetNames() {
        return sheetNames;
    }

    /**
     * True for declared sheets and for sheets that only showed up through their cells.
     */
    public boolean hasSheet(String name) {
        return sheets.containsKey(name);
    }

    public Collection<Sheet> getSheets() {
        return sheets.values();
    }

    public Sheet getSheet(String name) {
        return sheets.get(name);
    }

    public Cell getCell(QualifiedAddress address) {
        Sheet sheet = sheets.get(address.getSheet());
        return sheet == null ? null : sheet.getCell(address.getCell());
    }

    public boolean contains(QualifiedAddress address) {
        return getCell(address) != null;
    }

    /**
     * All cells of all sheets, sheet by sheet in loader order.
     */
    public List<Cell> allCells() {
        List<Cell> all = new ArrayList<>();
        for (Sheet sheet : sheets.values()) {
            all.addAll(sheet.getCells());
        }
        return all;
    }

    public List<Cell> formulaCells() {
        List<Cell> formulas = new ArrayList<>();
        for (Cell cell : allCells()) {
            if (cell.isFormula()) {
                formulas.add(cell);
            }
        }
        return formulas;
    }
}
