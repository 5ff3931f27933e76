package com.formulagraph.app.expression;

import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.models.EvaluationErrorType;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Coercions between the three value types (Double, String, Boolean), following
 * spreadsheet conventions: TRUE is 1 in arithmetic, numeric text is a number,
 * and ordering across types is number < text < boolean.
 */
final class Values {

    private Values() {
    }

    static double toNumber(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw mismatch("Expected a number, got text \"" + value + "\"");
            }
        }
        throw mismatch("A range cannot be used as a single value");
    }

    static boolean toBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim().toUpperCase(Locale.ROOT);
            if (text.equals("TRUE")) {
                return true;
            }
            if (text.equals("FALSE")) {
                return false;
            }
            throw mismatch("Expected a logical value, got text \"" + value + "\"");
        }
        throw mismatch("A range cannot be used as a logical value");
    }

    static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        if (value instanceof Number) {
            return formatNumber(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            return (String) value;
        }
        throw mismatch("A range cannot be used as text");
    }

    /**
     * 14.0 renders as "14", 0.5 as "0.5".
     */
    static String formatNumber(double number) {
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    static int compare(Object left, Object right) {
        int leftRank = rank(left);
        int rightRank = rank(right);
        if (leftRank != rightRank) {
            return Integer.compare(leftRank, rightRank);
        }
        switch (leftRank) {
            case 0:
                return Double.compare(toNumber(left), toNumber(right));
            case 1:
                return toText(left).compareToIgnoreCase(toText(right));
            default:
                return Boolean.compare(toBoolean(left), toBoolean(right));
        }
    }

    private static int rank(Object value) {
        if (value == null || value instanceof Number) {
            return 0;
        }
        if (value instanceof String) {
            return 1;
        }
        if (value instanceof Boolean) {
            return 2;
        }
        throw mismatch("A range cannot be compared");
    }

    /**
     * Rejects NaN and infinities, which the host would otherwise let through silently.
     */
    static double checked(double result, String operation) {
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw mismatch(operation + " has no finite result");
        }
        return result;
    }

    static EvaluationException mismatch(String message) {
        return new EvaluationException(EvaluationErrorType.MALFORMED_EXPRESSION, message);
    }
}
