package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.compiler.analysis.CallSites;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites applied to the code portions of a statement, leaving quoted
 * string literals untouched.
 *
 * <p>The bracket scans here do not skip string literals; callers only hand
 * them code whose brackets inside strings are balanced.
 */
final class CodeText {

    private CodeText() {
    }

    /**
     * Applies {@code fn} to every run of text between string literals.
     */
    static String mapCode(String text, UnaryOperator<String> fn) {
        StringBuilder out = new StringBuilder(text.length());
        int segment = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                out.append(fn.apply(text.substring(segment, i)));
                int end = CallSites.skipString(text, i);
                out.append(text, i, end);
                segment = end;
                i = end;
            } else {
                i++;
            }
        }
        out.append(fn.apply(text.substring(segment)));
        return out.toString();
    }

    /**
     * Replaces every match of {@code pattern} outside string literals.
     */
    static String replaceInCode(String text, Pattern pattern, String replacement) {
        return mapCode(text, code -> pattern.matcher(code).replaceAll(replacement));
    }

    /**
     * Replaces whole-word occurrences of {@code name} outside string literals,
     * skipping attribute accesses such as {@code obj.name}.
     */
    static String renameIdentifier(String text, String name, String replacement) {
        Pattern word = Pattern.compile("(?<![\\w.])" + Pattern.quote(name) + "(?!\\w)");
        return replaceInCode(text, word, Matcher.quoteReplacement(replacement));
    }

    /**
     * Start of the receiver expression whose member access begins with the
     * dot at {@code dot}: a run of names, dots and balanced call or subscript
     * groups, as in {@code f(x)[0].household}. Returns {@code dot} when there
     * is no receiver.
     */
    static int receiverStart(String text, int dot) {
        int i = dot - 1;
        while (i >= 0) {
            char c = text.charAt(i);
            if (c == ')' || c == ']') {
                int open = openingBracket(text, i);
                if (open < 0) break;
                i = open - 1;
            } else if (isWordChar(c) || c == '.') {
                i--;
            } else {
                break;
            }
        }
        return i + 1;
    }

    /**
     * Index of the bracket opening the one closed at {@code close}, or -1.
     */
    static int openingBracket(String text, int close) {
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == ')' || c == ']' || c == '}') depth++;
            if (c == '(' || c == '[' || c == '{') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * True when {@code index} falls inside a quoted string literal.
     */
    static boolean insideString(String text, int index) {
        int i = 0;
        while (i < text.length() && i <= index) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                int end = CallSites.skipString(text, i);
                if (index < end) return true;
                i = end;
            } else {
                i++;
            }
        }
        return false;
    }
}
