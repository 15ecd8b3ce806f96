package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.compiler.analysis.CallSites;
import com.solstice.formulac.compiler.config.CompilerConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates the remaining formula-dialect syntax of an expression into
 * JavaScript.
 *
 * <ul>
 *   <li>math helpers through the configured function mapping, longest name first</li>
 *   <li>{@code a // b} to {@code Math.floor(a / b)}, operands taken with Python precedence</li>
 *   <li>{@code not x} to {@code !(x)}, {@code and} / {@code or} to {@code &&} / {@code ||}</li>
 *   <li>{@code True}, {@code False}, {@code None} to {@code true}, {@code false}, {@code null}</li>
 *   <li>digit separators dropped from numbers ({@code 12_570} to {@code 12570})</li>
 * </ul>
 * {@code **} is valid JavaScript and kept. String literals are never touched.
 */
public class JavaScriptExpressionTranslator {

    private static final Pattern NUMBER = Pattern.compile("\\b\\d[\\d_]*(?:\\.\\d[\\d_]*)?(?:[eE][+-]?\\d[\\d_]*)?");
    private static final Pattern AND = Pattern.compile("\\band\\b");
    private static final Pattern OR = Pattern.compile("\\bor\\b");
    private static final Pattern NOT = Pattern.compile("(?<![\\w.])not\\b\\s*");
    private static final Pattern TRUE = Pattern.compile("(?<![\\w.])True\\b");
    private static final Pattern FALSE = Pattern.compile("(?<![\\w.])False\\b");
    private static final Pattern NONE = Pattern.compile("(?<![\\w.])None\\b");
    private static final Pattern EXPONENT_MANTISSA = Pattern.compile("\\d[\\d_]*(?:\\.[\\d_]*)?[eE]");
    private static final Set<String> KEYWORDS =
            Set.of("and", "or", "not", "if", "else", "in", "is", "return", "lambda");

    private final List<Map.Entry<Pattern, String>> functionMappings = new ArrayList<>();

    public JavaScriptExpressionTranslator(CompilerConfig config) {
        config.getFunctionMappings().entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed()
                        .thenComparing(Map.Entry::getKey))
                .forEach(e -> functionMappings.add(Map.entry(
                        Pattern.compile("(?<![\\w.])" + Pattern.quote(e.getKey()) + "(?=\\s*\\()"),
                        Matcher.quoteReplacement(e.getValue()))));
    }

    public String translate(String expression) {
        String text = CodeText.mapCode(expression, this::mapFunctions);
        text = floorDivision(text);
        text = negations(text);
        return CodeText.mapCode(text, code -> {
            String out = AND.matcher(code).replaceAll("&&");
            out = OR.matcher(out).replaceAll("||");
            out = TRUE.matcher(out).replaceAll("true");
            out = FALSE.matcher(out).replaceAll("false");
            out = NONE.matcher(out).replaceAll("null");
            return NUMBER.matcher(out).replaceAll(r -> r.group().replace("_", ""));
        });
    }

    private String mapFunctions(String code) {
        String out = code;
        for (Map.Entry<Pattern, String> mapping : functionMappings) {
            out = mapping.getKey().matcher(out).replaceAll(mapping.getValue());
        }
        return out;
    }

    /**
     * Rewrites every {@code l // r} outside strings into {@code Math.floor(l / r)}.
     */
    static String floorDivision(String text) {
        String current = text;
        int from = 0;
        while (true) {
            int op = current.indexOf("//", from);
            if (op < 0) return current;
            if (CodeText.insideString(current, op)) {
                from = op + 2;
                continue;
            }
            int leftStart = operandStart(current, op);
            int rightEnd = operandEnd(current, op + 2);
            if (leftStart < 0 || rightEnd < 0) {
                from = op + 2;
                continue;
            }
            String left = current.substring(leftStart, op).trim();
            String right = current.substring(op + 2, rightEnd).trim();
            String replacement = "Math.floor(" + left + " / " + right + ")";
            current = current.substring(0, leftStart) + replacement + current.substring(rightEnd);
            from = leftStart + replacement.length();
        }
    }

    /**
     * Rewrites {@code not x} into {@code !(x)}. The operand runs to the next
     * {@code and}, {@code or}, ternary mark, separator or closing bracket at
     * its own nesting level, matching the low precedence of {@code not}.
     */
    static String negations(String text) {
        String current = text;
        int from = 0;
        while (true) {
            Matcher m = NOT.matcher(current);
            if (!m.find(from)) return current;
            if (CodeText.insideString(current, m.start())) {
                from = m.end();
                continue;
            }
            int end = negationEnd(current, m.end());
            String operand = current.substring(m.end(), end).trim();
            if (operand.isEmpty()) {
                from = m.end();
                continue;
            }
            String replacement = "!(" + operand + ")";
            current = current.substring(0, m.start()) + replacement + current.substring(end);
            from = m.start() + 2;
        }
    }

    private static int negationEnd(String text, int from) {
        int depth = 0;
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = CallSites.skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) break;
                depth--;
            } else if (depth == 0) {
                if (c == ',' || c == '?' || c == ':' || c == ';') break;
                if (wordAt(text, i, "and") || wordAt(text, i, "or")
                        || text.startsWith("&&", i) || text.startsWith("||", i)) break;
            }
            i++;
        }
        // keep the whitespace that separated the operand from what follows
        while (i > from && Character.isWhitespace(text.charAt(i - 1))) i--;
        return i;
    }

    private static boolean wordAt(String text, int i, String word) {
        if (!text.startsWith(word, i)) return false;
        boolean before = i == 0 || !CodeText.isWordChar(text.charAt(i - 1));
        int after = i + word.length();
        return before && (after >= text.length() || !CodeText.isWordChar(text.charAt(after)));
    }

    /**
     * Start of the left operand of the {@code //} at {@code op}. Python groups
     * {@code * / // %} left to right, so the operand is the whole run of
     * multiplicative terms before the operator, unary signs and {@code **}
     * included. The scan stops at anything binding looser, an unclosed bracket
     * among them.
     */
    private static int operandStart(String text, int op) {
        int start = -1;
        int i = op - 1;
        while (i >= 0) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i--;
            } else if (c == ')' || c == ']') {
                int open = CodeText.openingBracket(text, i);
                if (open < 0) return -1;
                start = open;
                i = open - 1;
            } else if (CodeText.isWordChar(c) || c == '.') {
                int j = wordStart(text, i);
                if (KEYWORDS.contains(text.substring(j, i + 1))) break;
                start = j;
                i = j - 1;
            } else if (c == '*' || c == '/' || c == '%') {
                if (start < 0) return -1;
                i--;
            } else if (c == '+' || c == '-') {
                if (start < 0) return -1;
                if (i > 0 && CodeText.isWordChar(text.charAt(i - 1))
                        && EXPONENT_MANTISSA.matcher(text.substring(wordStart(text, i - 1), i)).matches()) {
                    // sign of an exponent such as 1e-5
                    i--;
                    continue;
                }
                if (!unarySign(text, i)) break;
                start = i;
                i--;
            } else {
                break;
            }
        }
        return start >= 0 && start < op ? start : -1;
    }

    /**
     * End of the right operand of a {@code //}: one unary operand, extended
     * through any {@code **} chain since power binds tighter.
     */
    private static int operandEnd(String text, int from) {
        int i = unaryEnd(text, from);
        while (i >= 0) {
            int next = skipSpaces(text, i);
            if (!text.startsWith("**", next)) return i;
            i = unaryEnd(text, next + 2);
        }
        return -1;
    }

    private static int unaryEnd(String text, int from) {
        int i = skipSpaces(text, from);
        while (i < text.length() && (text.charAt(i) == '-' || text.charAt(i) == '+')) {
            i = skipSpaces(text, i + 1);
        }
        int start = i;
        if (i < text.length() && (text.charAt(i) == '(' || text.charAt(i) == '[')) {
            int close = CallSites.closingBracket(text, i);
            if (close < 0) return -1;
            i = close + 1;
        }
        i = wordEnd(text, i);
        while (i < text.length() && (text.charAt(i) == '(' || text.charAt(i) == '[')) {
            int close = CallSites.closingBracket(text, i);
            if (close < 0) return -1;
            i = wordEnd(text, close + 1);
        }
        return i > start ? i : -1;
    }

    private static int wordEnd(String text, int from) {
        int i = from;
        while (i < text.length() && (CodeText.isWordChar(text.charAt(i)) || text.charAt(i) == '.')) i++;
        if (i > from && i + 1 < text.length() && (text.charAt(i) == '-' || text.charAt(i) == '+')
                && EXPONENT_MANTISSA.matcher(text.substring(from, i)).matches()) {
            return wordEnd(text, i + 1);
        }
        return i;
    }

    private static int wordStart(String text, int end) {
        int j = end;
        while (j >= 0 && (CodeText.isWordChar(text.charAt(j)) || text.charAt(j) == '.')) j--;
        return j + 1;
    }

    /**
     * True when the sign at {@code index} has no left operand of its own.
     */
    private static boolean unarySign(String text, int index) {
        int p = index - 1;
        while (p >= 0 && Character.isWhitespace(text.charAt(p))) p--;
        if (p < 0) return true;
        char c = text.charAt(p);
        if (CodeText.isWordChar(c)) {
            return KEYWORDS.contains(text.substring(wordStart(text, p), p + 1));
        }
        return c != ')' && c != ']' && c != '}';
    }

    private static int skipSpaces(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }
}
