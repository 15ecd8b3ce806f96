package com.solstice.formulac.compiler.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Text-level helpers for locating call arguments. Quoted strings are skipped
 * so brackets and commas inside literals never count.
 */
public final class CallSites {

    private CallSites() {
    }

    /**
     * Index of the bracket closing the one at {@code open}, or -1 when the
     * text ends first.
     */
    public static int closingBracket(CharSequence text, int open) {
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) return i;
                if (depth < 0) return -1;
            }
            i++;
        }
        return -1;
    }

    /**
     * Arguments of the call whose opening parenthesis sits at {@code open},
     * split on top-level commas and trimmed. Null when the call is unclosed.
     */
    public static List<String> arguments(CharSequence text, int open) {
        int close = closingBracket(text, open);
        if (close < 0) return null;
        List<String> args = new ArrayList<>();
        int depth = 0;
        int from = open + 1;
        int i = open + 1;
        while (i < close) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') depth++;
            if (c == ')' || c == ']' || c == '}') depth--;
            if (c == ',' && depth == 0) {
                args.add(text.subSequence(from, i).toString().trim());
                from = i + 1;
            }
            i++;
        }
        String last = text.subSequence(from, close).toString().trim();
        if (!last.isEmpty() || !args.isEmpty()) {
            args.add(last);
        }
        if (!args.isEmpty() && args.get(args.size() - 1).isEmpty()) {
            args.remove(args.size() - 1); // trailing comma
        }
        return args;
    }

    /**
     * Unquoted content when {@code argument} is a single quoted string, else null.
     */
    public static String stringLiteral(String argument) {
        if (argument.length() >= 2) {
            char q = argument.charAt(0);
            if ((q == '\'' || q == '"') && argument.charAt(argument.length() - 1) == q
                    && argument.indexOf(q, 1) == argument.length() - 1) {
                return argument.substring(1, argument.length() - 1);
            }
        }
        return null;
    }

    /**
     * Index just past the string literal starting at {@code start}.
     */
    public static int skipString(CharSequence text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            i++;
        }
        return text.length();
    }
}
