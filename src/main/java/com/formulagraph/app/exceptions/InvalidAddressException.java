package com.formulagraph.app.exceptions;

/**
 * Thrown when text cannot be read as a cell or qualified address.
 */
public class InvalidAddressException extends RuntimeException {
    public InvalidAddressException(String message) {
        super(message);
    }
}
