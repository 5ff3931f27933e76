package com.formulagraph.app.models;

/**
 * Typed evaluation failures. Always returned as a value, never thrown to callers.
 */
public enum EvaluationErrorType {
    // A referenced cell has no usable value (circular, failed, or an unknown name)
    UNRESOLVED_REFERENCE,
    // The formula calls a function outside the supported set
    UNSUPPORTED_FUNCTION,
    DIVISION_BY_ZERO,
    // Unparseable text, wrong argument counts, type mismatches, out-of-domain math
    MALFORMED_EXPRESSION
}
