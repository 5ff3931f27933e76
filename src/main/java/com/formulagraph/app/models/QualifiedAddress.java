package com.formulagraph.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.formulagraph.app.exceptions.InvalidAddressException;

import java.util.Objects;

/**
 * A fully-qualified cell address:
 * - "Sheet1!B15" when resolving within one document
 * - "bridge.xlsx#Sheet1!B15" when the document matters (exports, integration)
 * The document part runs up to the first '#', the cell part starts after the last '!'.
 * Document ids therefore never contain '#'; sheet names are kept exactly, spaces included.
 */
public final class QualifiedAddress implements Comparable<QualifiedAddress> {

    private final String documentId; // null inside a single document
    private final String sheet;
    private final CellAddress cell;

    public QualifiedAddress(String documentId, String sheet, CellAddress cell) {
        if (sheet == null || sheet.isEmpty()) {
            throw new InvalidAddressException("Sheet name cannot be empty");
        }
        this.documentId = documentId;
        this.sheet = sheet;
        this.cell = Objects.requireNonNull(cell, "cell");
    }

    public static QualifiedAddress of(String sheet, CellAddress cell) {
        return new QualifiedAddress(null, sheet, cell);
    }

    public static QualifiedAddress of(String sheet, String cell) {
        return new QualifiedAddress(null, sheet, CellAddress.parse(cell));
    }

    @JsonCreator
    public static QualifiedAddress parse(String text) {
        if (text == null) {
            throw new InvalidAddressException("Qualified address cannot be null");
        }
        int bang = text.lastIndexOf('!');
        if (bang <= 0 || bang == text.length() - 1) {
            throw new InvalidAddressException("Expected <sheet>!<cell>, got: " + text);
        }
        String prefix = text.substring(0, bang);
        String documentId = null;
        int hash = prefix.indexOf('#');
        if (hash >= 0) {
            documentId = prefix.substring(0, hash);
            prefix = prefix.substring(hash + 1);
        }
        return new QualifiedAddress(documentId, unquoteSheet(prefix), CellAddress.parse(text.substring(bang + 1)));
    }

    /**
     * Strips the quotes that spreadsheet formulas put around sheet names with spaces: 'My Sheet'.
     */
    public static String unquoteSheet(String sheet) {
        if (sheet.length() >= 2 && sheet.startsWith("'") && sheet.endsWith("'")) {
            return sheet.substring(1, sheet.length() - 1).replace("''", "'");
        }
        return sheet;
    }

    public QualifiedAddress withDocument(String documentId) {
        return new QualifiedAddress(documentId, sheet, cell);
    }

    public QualifiedAddress withoutDocument() {
        return documentId == null ? this : new QualifiedAddress(null, sheet, cell);
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getSheet() {
        return sheet;
    }

    public CellAddress getCell() {
        return cell;
    }

    @Override
    public int compareTo(QualifiedAddress other) {
        int byDocument = String.valueOf(documentId).compareTo(String.valueOf(other.documentId));
        if (byDocument != 0) {
            return byDocument;
        }
        int bySheet = sheet.compareTo(other.sheet);
        if (bySheet != 0) {
            return bySheet;
        }
        return cell.compareTo(other.cell);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualifiedAddress)) {
            return false;
        }
        QualifiedAddress that = (QualifiedAddress) o;
        return Objects.equals(documentId, that.documentId)
                && sheet.equals(that.sheet)
                && cell.equals(that.cell);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, sheet, cell);
    }

    @JsonValue
    @Override
    public String toString() {
        String local = sheet + "!" + cell;
        return documentId == null ? local : documentId + "#" + local;
    }
}
