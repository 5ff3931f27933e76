package com.formulagraph.app.models;

/**
 * Classification used by downstream reporting to group formulas.
 * Assigned first-match-wins in declaration order of the checks:
 * FUNCTION, then COMPLEX_REFERENCE, then COMPLEX_ARITHMETIC, else SIMPLE.
 */
public enum FormulaType {
    SIMPLE,
    FUNCTION,
    COMPLEX_REFERENCE,
    COMPLEX_ARITHMETIC
}
