package com.formulagraph.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.formulagraph.app.exceptions.InvalidAddressException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A (column, row) position inside one sheet.
 * Canonical string form is column letters followed by the row number, e.g. "B15".
 * Absolute-reference markers ("$B$15") are accepted on input and dropped.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?(\\d+)$");

    // Column is 1-based: A=1, Z=26, AA=27
    private final int column;
    private final int row;

    public CellAddress(int column, int row) {
        if (column <= 0 || row <= 0) {
            throw new InvalidAddressException("Column and row must be positive, got column="
                    + column + ", row=" + row);
        }
        this.column = column;
        this.row = row;
    }

    /**
     * Parses "B15", "$B$15" or "b15". Throws InvalidAddressException otherwise.
     */
    @JsonCreator
    public static CellAddress parse(String text) {
        if (text == null) {
            throw new InvalidAddressException("Cell address cannot be null");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidAddressException("Not a cell address: " + text);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidAddressException("Row out of range in address: " + text);
        }
        return new CellAddress(columnLettersToNumber(matcher.group(1)), row);
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public String getColumnLetters() {
        return numberToColumnLetters(column);
    }

    /**
     * Convert column number to column letters (1 -> A, 27 -> AA).
     */
    public static String numberToColumnLetters(int columnNumber) {
        StringBuilder result = new StringBuilder();
        int remaining = columnNumber;
        while (remaining > 0) {
            remaining--; // make it 0-based
            result.insert(0, (char) ('A' + (remaining % 26)));
            remaining /= 26;
        }
        return result.toString();
    }

    /**
     * Convert column letters to column number (A -> 1, AA -> 27).
     */
    public static int columnLettersToNumber(String columnLetters) {
        String upper = columnLetters.toUpperCase();
        int result = 0;
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new InvalidAddressException("Invalid column letter: " + c);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result;
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @JsonValue
    @Override
    public String toString() {
        return getColumnLetters() + row;
    }
}
