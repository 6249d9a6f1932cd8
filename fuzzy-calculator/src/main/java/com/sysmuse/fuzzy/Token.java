package com.sysmuse.fuzzy;

import java.util.Objects;

/**
 * Immutable classified unit of input.
 * Numbers keep their literal text; conversion happens at evaluation time.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int priority;
    private final int position;
    private final boolean inserted;

    private Token(TokenType type, String text, int priority, int position, boolean inserted) {
        this.type = type;
        this.text = text;
        this.priority = priority;
        this.position = position;
        this.inserted = inserted;
    }

    public static Token number(String text, int position) {
        return new Token(TokenType.NUMBER, text, 0, position, false);
    }

    public static Token constant(String name, int position) {
        return new Token(TokenType.CONSTANT, name, 0, position, false);
    }

    public static Token variable(String name, int position) {
        return new Token(TokenType.VARIABLE, name, 0, position, false);
    }

    public static Token function(String name, int position) {
        return new Token(TokenType.FUNCTION, name, 0, position, false);
    }

    public static Token infix(String symbol, int priority, int position) {
        return new Token(TokenType.INFIX, symbol, priority, position, false);
    }

    /**
     * Multiplication made explicit by the expander; it has no source text.
     */
    public static Token insertedInfix(String symbol, int priority, int position) {
        return new Token(TokenType.INFIX, symbol, priority, position, true);
    }

    public static Token open(int position) {
        return new Token(TokenType.BRACKET_OPEN, "(", 0, position, false);
    }

    public static Token close(int position) {
        return new Token(TokenType.BRACKET_CLOSE, ")", 0, position, false);
    }

    public static Token comma(int position) {
        return new Token(TokenType.COMMA, ",", 0, position, false);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPriority() {
        return priority;
    }

    public int getPosition() {
        return position;
    }

    public boolean isInserted() {
        return inserted;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    public boolean isInfix(String symbol) {
        return type == TokenType.INFIX && text.equals(symbol);
    }

    // position is not compared
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type
                && priority == other.priority
                && inserted == other.inserted
                && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, priority, inserted);
    }

    @Override
    public String toString() {
        return type.getLabel() + ":'" + text + "'" + (inserted ? "+" : "");
    }
}
