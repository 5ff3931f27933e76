package com.formulagraph.app.exceptions;

/**
 * Thrown when the loader input breaks its contract:
 * no document id, an unparseable address or two cells at one address.
 * Problems inside formulas never throw; they end up in the ValidationResult.
 */
public class InvalidWorkbookException extends RuntimeException {
    public InvalidWorkbookException(String message) {
        super(message);
    }
}
