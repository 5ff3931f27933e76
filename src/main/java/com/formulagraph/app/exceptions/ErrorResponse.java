package com.formulagraph.app.exceptions;

/**
 * Error body returned by the REST host, a code plus a message.
 * For example:
 * {
 *   "code": "WORKBOOK_NOT_FOUND",
 *   "message": "No analysis for document: bridge.xlsx"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
