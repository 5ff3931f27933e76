package com.formulagraph.app.models;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Topic buckets for calculation formulas, each with the keywords that suggest it.
 * A formula can fall in several categories; the grouping is a hint, not a classification.
 */
public enum EngineeringCategory {
    STRUCTURAL("moment", "shear", "stress", "strain", "deflection", "force", "load"),
    HYDRAULIC("discharge", "velocity", "flow", "pressure", "head", "regime", "afflux"),
    GEOTECHNICAL("bearing", "settlement", "earth", "pressure", "friction", "cohesion"),
    MATERIAL("concrete", "steel", "strength", "modulus", "grade", "density"),
    GEOMETRIC("area", "volume", "length", "width", "height", "thickness", "span");

    private final List<String> keywords;

    EngineeringCategory(String... keywords) {
        this.keywords = Collections.unmodifiableList(Arrays.asList(keywords));
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * True when any keyword occurs in one of the texts, ignoring case.
     */
    public boolean matches(String... texts) {
        for (String text : texts) {
            if (text == null) {
                continue;
            }
            String lower = text.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (lower.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    public String getTitle() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
