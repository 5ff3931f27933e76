package com.formulagraph.app.models;

import com.formulagraph.app.exceptions.InvalidWorkbookException;

import java.util.*;

/**
 * Represents one sheet of a loaded document:
 * - its name
 * - an ordered map of address -> Cell, unique per address
 */
public class Sheet {

    private final String name;
    // Insertion order follows the loader's enumeration order
    private final Map<CellAddress, Cell> cells = new LinkedHashMap<>();

    public Sheet(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Adds a cell. A second cell at the same address breaks the loader contract.
     */
    public void addCell(Cell cell) {
        if (cells.putIfAbsent(cell.getAddress(), cell) != null) {
            throw new InvalidWorkbookException("Duplicate cell " + cell.getAddress() + " in sheet " + name);
        }
    }

    public Cell getCell(CellAddress address) {
        return cells.get(address);
    }

    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    /**
     * Cells on the same row to the left of the given column, nearest first.
     */
    public List<Cell> cellsLeftOf(CellAddress address) {
        List<Cell> left = new ArrayList<>();
        for (int column = address.getColumn() - 1; column >= 1; column--) {
            Cell cell = cells.get(new CellAddress(column, address.getRow()));
            if (cell != null) {
                left.add(cell);
            }
        }
        return left;
    }

    /**
     * Cells on the same row to the right of the given column, nearest first.
     */
    public List<Cell> cellsRightOf(CellAddress address) {
        List<Cell> right = new ArrayList<>();
        for (Cell cell : cells.values()) {
            CellAddress other = cell.getAddress();
            if (other.getRow() == address.getRow() && other.getColumn() > address.getColumn()) {
                right.add(cell);
            }
        }
        right.sort(Comparator.comparing(Cell::getAddress));
        return right;
    }
}
