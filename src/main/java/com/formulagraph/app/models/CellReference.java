package com.formulagraph.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A single-cell reference found in a formula, with its optional sheet qualifier.
 * "B15" has no sheet; "Sheet1!B15" and "'Load Data'!B15" do.
 */
public final class CellReference {

    private final String sheet; // null when unqualified
    private final CellAddress cell;

    public CellReference(String sheet, CellAddress cell) {
        this.sheet = sheet;
        this.cell = Objects.requireNonNull(cell, "cell");
    }

    public String getSheet() {
        return sheet;
    }

    public CellAddress getCell() {
        return cell;
    }

    /**
     * Resolves against the sheet the formula lives in.
     */
    public QualifiedAddress resolve(String homeSheet) {
        return QualifiedAddress.of(sheet == null ? homeSheet : sheet, cell);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference that = (CellReference) o;
        return Objects.equals(sheet, that.sheet) && cell.equals(that.cell);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, cell);
    }

    @JsonValue
    @Override
    public String toString() {
        return sheet == null ? cell.toString() : sheet + "!" + cell;
    }
}
