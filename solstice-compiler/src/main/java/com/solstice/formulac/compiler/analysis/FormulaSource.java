package com.solstice.formulac.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A formula split into its declared signature and its logical body statements.
 *
 * <p>Accepts either a full definition:
 * <pre>
 * def formula(person, period, parameters):
 *     p = parameters(period).gov.tax
 *     return person("income", period) * p.rate
 * </pre>
 * or a bare expression such as {@code person("income", period) * 2}.
 * Multi-line statements are joined; each statement's text is rebuilt from
 * its tokens with comments removed and whitespace runs collapsed.
 */
public final class FormulaSource {

    private final String text;
    private final List<String> signature;
    private final List<Statement> statements;

    private FormulaSource(String text, List<String> signature, List<Statement> statements) {
        this.text = text;
        this.signature = signature;
        this.statements = statements;
    }

    /**
     * One logical statement of the body.
     *
     * @param text   normalized statement text
     * @param tokens the statement's tokens, offsets relative to the whole formula
     */
    public record Statement(String text, List<Token> tokens) {

        public boolean isReturn() {
            return !tokens.isEmpty() && tokens.get(0).isName("return");
        }

        /**
         * The returned expression of a {@code return} statement, otherwise the whole text.
         */
        public String expression() {
            return isReturn() ? text.substring("return".length()).trim() : text;
        }

        /**
         * Target name of a plain {@code name = expr} assignment, or null.
         */
        public String assignedName() {
            if (tokens.size() > 2 && tokens.get(0).isName() && tokens.get(1).is("=")) {
                return tokens.get(0).text();
            }
            return null;
        }
    }

    public static FormulaSource parse(String text) throws FormulaSyntaxException {
        List<Token> tokens = FormulaLexer.tokenize(text);
        List<List<Token>> groups = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == Token.Type.NEWLINE || token.is(";")) {
                if (!current.isEmpty()) groups.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        if (!current.isEmpty()) groups.add(current);

        List<String> signature = List.of();
        List<Statement> body = new ArrayList<>();
        boolean headerSeen = false;
        for (List<Token> group : groups) {
            if (group.get(0).is("@")) {
                continue; // decorator
            }
            if (!headerSeen && group.get(0).isName("def")) {
                headerSeen = true;
                int close = group.size() > 2 && group.get(2).is("(") ? matchingClose(group, 2) : -1;
                signature = close > 0 ? parameterNames(group, 3, close) : List.of();
                int colon = indexOf(group, ":", Math.max(close, 0));
                body.clear();
                if (colon >= 0 && colon + 1 < group.size()) {
                    body.add(statement(text, group.subList(colon + 1, group.size())));
                }
                continue;
            }
            body.add(statement(text, group));
        }
        return new FormulaSource(text, signature, Collections.unmodifiableList(body));
    }

    public String getText() {
        return text;
    }

    /**
     * Parameter names of the {@code def} header, empty for bare expressions.
     */
    public List<String> getSignature() {
        return signature;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /**
     * Index of the statement holding the terminal result: the first
     * {@code return}, or the last statement when there is none. -1 for an
     * empty body.
     */
    public int terminalIndex() {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i).isReturn()) return i;
        }
        return statements.size() - 1;
    }

    /**
     * Index of the bracket closing the one opened at {@code open}, or -1.
     */
    public static int matchingClose(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isOpening()) {
                depth++;
            } else if (t.isClosing()) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * Splits the tokens strictly between {@code open} and its closing bracket
     * on commas at depth 1. A trailing comma does not open an empty argument.
     */
    public static List<List<Token>> splitArguments(List<Token> tokens, int open) {
        int close = matchingClose(tokens, open);
        List<List<Token>> args = new ArrayList<>();
        if (close < 0) return args;
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (int i = open + 1; i < close; i++) {
            Token t = tokens.get(i);
            if (t.isOpening()) depth++;
            if (t.isClosing()) depth--;
            if (depth == 0 && t.is(",")) {
                args.add(current);
                current = new ArrayList<>();
            } else {
                current.add(t);
            }
        }
        if (!current.isEmpty()) args.add(current);
        return args;
    }

    static Statement statement(String source, List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && token.start() > previous.end()) {
                sb.append(' ');
            }
            sb.append(token.text());
            previous = token;
        }
        return new Statement(sb.toString(), List.copyOf(tokens));
    }

    private static List<String> parameterNames(List<Token> group, int from, int close) {
        List<String> names = new ArrayList<>();
        int depth = 0;
        boolean expectName = true;
        for (int i = from; i < close; i++) {
            Token t = group.get(i);
            if (t.isOpening()) depth++;
            if (t.isClosing()) depth--;
            if (depth != 0) continue;
            if (t.is(",")) {
                expectName = true;
            } else if (expectName && t.isName()) {
                names.add(t.text());
                expectName = false;
            } else {
                expectName = false;
            }
        }
        return List.copyOf(names);
    }

    private static int indexOf(List<Token> tokens, String op, int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (tokens.get(i).is(op)) return i;
        }
        return -1;
    }
}
