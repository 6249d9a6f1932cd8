package com.sysmuse.fuzzy;

/**
 * Base class for every user-facing failure of the parser and the evaluator.
 * Carries the 0-based character position of the offending token when known.
 */
public class ExpressionException extends RuntimeException {

    public static final int UNKNOWN_POSITION = -1;

    private final int position;

    public ExpressionException(String message) {
        this(message, UNKNOWN_POSITION, null);
    }

    public ExpressionException(String message, int position) {
        this(message, position, null);
    }

    public ExpressionException(String message, int position, Throwable cause) {
        super(position >= 0 ? message + " (at position " + position + ")" : message, cause);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position >= 0;
    }

    /**
     * Renders the expression with a caret under the given position:
     * <pre>
     * 2x*cos(3y+)
     *           ^
     * </pre>
     */
    public static String pointer(String expression, int position) {
        StringBuilder sb = new StringBuilder(expression);
        if (position >= 0 && position < expression.length()) {
            sb.append(System.lineSeparator());
            sb.append(" ".repeat(position)).append('^');
        }
        return sb.toString();
    }
}
