package com.formulagraph.app.exceptions;

/**
 * Thrown by the REST lookup when an address has no resolved value.
 */
public class CellNotFoundException extends RuntimeException {
    public CellNotFoundException(String message) {
        super(message);
    }
}
