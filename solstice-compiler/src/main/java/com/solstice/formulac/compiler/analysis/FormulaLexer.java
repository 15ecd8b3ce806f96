package com.solstice.formulac.compiler.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizer for the formula dialect.
 *
 * <p>Emits {@link Token.Type#NEWLINE} only at bracket depth 0, so each
 * NEWLINE-delimited run of tokens is one logical statement. Comments and
 * explicit line continuations are dropped. Brackets must balance; an
 * unterminated string, a mismatched bracket or a character outside the
 * dialect makes the whole formula structurally unparseable.
 */
public final class FormulaLexer {

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=",
            "**", "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "->", ":=", "<<", ">>",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Character> brackets = new ArrayDeque<>();
    private int pos;

    private FormulaLexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) throws FormulaSyntaxException {
        FormulaLexer lexer = new FormulaLexer(source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() throws FormulaSyntaxException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                pos++;
            } else if (c == '\n') {
                newline();
                pos++;
            } else if (c == '\\' && pos + 1 < source.length()
                    && (source.charAt(pos + 1) == '\n' || source.charAt(pos + 1) == '\r')) {
                pos += 2;
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') pos++;
            } else if (isStringStart()) {
                readString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                    && Character.isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else {
                readOperator();
            }
        }
        if (!brackets.isEmpty()) {
            throw new FormulaSyntaxException("Unclosed '" + brackets.peek() + "'", source.length());
        }
        newline();
    }

    private void newline() {
        if (brackets.isEmpty() && !tokens.isEmpty()
                && tokens.get(tokens.size() - 1).type() != Token.Type.NEWLINE) {
            tokens.add(new Token(Token.Type.NEWLINE, "\n", "\n", pos, pos));
        }
    }

    private boolean isStringStart() {
        int p = pos;
        while (p < source.length() && p - pos < 2 && "rRbBuUfF".indexOf(source.charAt(p)) >= 0) p++;
        return p < source.length() && (source.charAt(p) == '"' || source.charAt(p) == '\'');
    }

    private void readString() throws FormulaSyntaxException {
        int start = pos;
        boolean raw = false;
        while ("rRbBuUfF".indexOf(source.charAt(pos)) >= 0) {
            if (source.charAt(pos) == 'r' || source.charAt(pos) == 'R') raw = true;
            pos++;
        }
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        String delimiter = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        pos += delimiter.length();

        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw new FormulaSyntaxException("Unterminated string", start);
            }
            if (source.startsWith(delimiter, pos)) {
                pos += delimiter.length();
                break;
            }
            char c = source.charAt(pos);
            if (c == '\n' && !triple) {
                throw new FormulaSyntaxException("Unterminated string", start);
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                if (raw) {
                    value.append(c).append(next);
                } else {
                    value.append(switch (next) {
                        case 'n' -> '\n';
                        case 't' -> '\t';
                        default -> next;
                    });
                }
                pos += 2;
                continue;
            }
            value.append(c);
            pos++;
        }
        tokens.add(new Token(Token.Type.STRING, source.substring(start, pos), value.toString(), start, pos));
    }

    private void readNumber() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else if ((c == '+' || c == '-') && (source.charAt(pos - 1) == 'e' || source.charAt(pos - 1) == 'E')) {
                pos++;
            } else {
                break;
            }
        }
        String text = source.substring(start, pos);
        tokens.add(new Token(Token.Type.NUMBER, text, text, start, pos));
    }

    private void readName() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String text = source.substring(start, pos);
        tokens.add(new Token(Token.Type.NAME, text, text, start, pos));
    }

    private void readOperator() throws FormulaSyntaxException {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                trackBracket(op);
                tokens.add(new Token(Token.Type.OP, op, op, pos, pos + op.length()));
                pos += op.length();
                return;
            }
        }
        throw new FormulaSyntaxException("Unexpected character '" + source.charAt(pos) + "'", pos);
    }

    private void trackBracket(String op) throws FormulaSyntaxException {
        switch (op) {
            case "(", "[", "{" -> brackets.push(op.charAt(0));
            case ")", "]", "}" -> {
                char expected = switch (op.charAt(0)) {
                    case ')' -> '(';
                    case ']' -> '[';
                    default -> '{';
                };
                if (brackets.isEmpty() || brackets.pop() != expected) {
                    throw new FormulaSyntaxException("Unbalanced '" + op + "'", pos);
                }
            }
            default -> {
                // not a bracket
            }
        }
    }
}
