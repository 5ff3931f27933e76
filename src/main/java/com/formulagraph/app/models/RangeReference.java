package com.formulagraph.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular range reference "A1:C5", with its optional sheet qualifier.
 * Corners are normalized so start is top-left and end is bottom-right.
 */
public final class RangeReference {

    private final String sheet; // null when unqualified
    private final CellAddress start;
    private final CellAddress end;

    public RangeReference(String sheet, CellAddress first, CellAddress second) {
        this.sheet = sheet;
        this.start = new CellAddress(Math.min(first.getColumn(), second.getColumn()),
                Math.min(first.getRow(), second.getRow()));
        this.end = new CellAddress(Math.max(first.getColumn(), second.getColumn()),
                Math.max(first.getRow(), second.getRow()));
    }

    public String getSheet() {
        return sheet;
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    /**
     * The two anchor cells used as dependencies. A one-cell range yields a single corner.
     */
    public List<QualifiedAddress> corners(String homeSheet) {
        String target = sheet == null ? homeSheet : sheet;
        List<QualifiedAddress> corners = new ArrayList<>(2);
        corners.add(QualifiedAddress.of(target, start));
        if (!start.equals(end)) {
            corners.add(QualifiedAddress.of(target, end));
        }
        return corners;
    }

    public boolean contains(CellAddress cell) {
        return cell.getRow() >= start.getRow() && cell.getRow() <= end.getRow()
                && cell.getColumn() >= start.getColumn() && cell.getColumn() <= end.getColumn();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeReference)) {
            return false;
        }
        RangeReference that = (RangeReference) o;
        return Objects.equals(sheet, that.sheet) && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, start, end);
    }

    @JsonValue
    @Override
    public String toString() {
        String range = start + ":" + end;
        return sheet == null ? range : sheet + "!" + range;
    }
}
