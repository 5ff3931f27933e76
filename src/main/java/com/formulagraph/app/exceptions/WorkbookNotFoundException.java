package com.formulagraph.app.exceptions;

/**
 * Thrown when attempting to access a document id
 * that has no analysis session in the in-memory store.
 */
public class WorkbookNotFoundException extends RuntimeException {
    public WorkbookNotFoundException(String message) {
        super(message);
    }
}
