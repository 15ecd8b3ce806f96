package com.solstice.formulac.compiler.reform;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Helpers for date-versioned values and the JSON scalars they hold.
 */
public final class DatedValues {

    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private DatedValues() {
    }

    public static boolean isDate(String key) {
        return key != null && DATE.matcher(key).matches();
    }

    /**
     * The latest date not after {@code instant}, or null when every date is
     * later. Dates compare as strings, which orders {@code YYYY-MM-DD} correctly.
     */
    public static String latestOnOrBefore(Collection<String> dates, String instant) {
        String best = null;
        for (String date : dates) {
            if (date.compareTo(instant) <= 0 && (best == null || date.compareTo(best) > 0)) {
                best = date;
            }
        }
        return best;
    }

    /**
     * Java value of a scalar node: Long for integral numbers that fit, Double
     * for other numbers, Boolean, String, or null.
     *
     * @throws IllegalArgumentException if the node is an array or object
     */
    public static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw new IllegalArgumentException("Expected a scalar but found " + node.getNodeType());
    }

    public static boolean isScalar(JsonNode node) {
        return node.isValueNode() || node.isNull();
    }
}
