package com.formulagraph.app.models;

import java.util.Locale;

/**
 * Closed vocabulary of parameters that calculation documents commonly share.
 * Matching is keyword based and therefore only a hint.
 */
public enum IntegrationParameter {
    SPAN_LENGTH("span length"),
    BRIDGE_WIDTH("bridge width"),
    DESIGN_LOAD("design load"),
    CONCRETE_GRADE("concrete grade"),
    STEEL_GRADE("steel grade"),
    HFL("hfl"),
    DISCHARGE("discharge"),
    BEARING_CAPACITY("bearing capacity"),
    UNIT_WEIGHT("unit weight");

    private final String phrase;

    IntegrationParameter(String phrase) {
        this.phrase = phrase;
    }

    public String getPhrase() {
        return phrase;
    }

    public boolean matches(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(phrase);
    }
}
