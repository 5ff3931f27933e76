package com.formulagraph.app.models;

/**
 * How IF treats its branches.
 * EAGER evaluates both branches before choosing, so an error in the unused branch
 * still fails the formula. SHORT_CIRCUIT evaluates only the chosen branch.
 */
public enum ConditionalMode {
    EAGER,
    SHORT_CIRCUIT
}
