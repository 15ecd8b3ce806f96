package com.solstice.formulac.compiler.synthesis;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

import java.math.BigDecimal;

/**
 * Renders resolved parameter values and defaults as source literals.
 *
 * <p>Numbers are written as plain decimals ({@code 0.2}, {@code 12570}), never
 * in exponent form; negative numbers are parenthesized so they stay correct
 * next to unary and power operators.
 */
public abstract class LiteralFormatter {

    public static final LiteralFormatter PYTHON = new LiteralFormatter() {
        @Override
        protected String constant(Boolean value) {
            if (value == null) return "None";
            return value ? "True" : "False";
        }

        @Override
        protected String nonFinite(double value) {
            if (Double.isNaN(value)) return "float('nan')";
            return value > 0 ? "float('inf')" : "float('-inf')";
        }
    };

    public static final LiteralFormatter JAVASCRIPT = new LiteralFormatter() {
        @Override
        protected String constant(Boolean value) {
            if (value == null) return "null";
            return value ? "true" : "false";
        }

        @Override
        protected String nonFinite(double value) {
            if (Double.isNaN(value)) return "NaN";
            return value > 0 ? "Infinity" : "(-Infinity)";
        }
    };

    public String format(Object value) {
        if (value == null) {
            return constant(null);
        }
        if (value instanceof Boolean b) {
            return constant(b);
        }
        if (value instanceof Number n) {
            return number(n);
        }
        return quote(String.valueOf(value));
    }

    protected abstract String constant(Boolean value);

    protected abstract String nonFinite(double value);

    private String number(Number n) {
        String plain;
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return nonFinite(d);
            }
            plain = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        } else if (n instanceof BigDecimal bd) {
            plain = bd.stripTrailingZeros().toPlainString();
        } else {
            plain = n.toString();
        }
        return plain.startsWith("-") ? "(" + plain + ")" : plain;
    }

    private static String quote(String s) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(s)) + "\"";
    }
}
