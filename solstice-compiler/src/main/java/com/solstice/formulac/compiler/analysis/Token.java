package com.solstice.formulac.compiler.analysis;

/**
 * One lexical token of a formula.
 *
 * @param type  token category
 * @param text  exact source text of the token
 * @param value unquoted content for strings, otherwise the text
 * @param start offset of the first character in the formula
 * @param end   offset one past the last character
 */
public record Token(Type type, String text, String value, int start, int end) {

    public enum Type {
        NAME,
        NUMBER,
        STRING,
        OP,
        NEWLINE
    }

    public boolean is(String op) {
        return (type == Type.OP || type == Type.NAME) && text.equals(op);
    }

    public boolean isName() {
        return type == Type.NAME;
    }

    public boolean isName(String name) {
        return type == Type.NAME && text.equals(name);
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public boolean isOpening() {
        return type == Type.OP && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    public boolean isClosing() {
        return type == Type.OP && (text.equals(")") || text.equals("]") || text.equals("}"));
    }
}
