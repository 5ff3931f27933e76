package com.formulagraph.app.expression;

import java.util.Collections;
import java.util.List;

/**
 * The values of a range reference. Only aggregate functions accept it.
 */
final class RangeValue {

    private final List<Object> values;

    RangeValue(List<Object> values) {
        this.values = Collections.unmodifiableList(values);
    }

    List<Object> getValues() {
        return values;
    }
}
