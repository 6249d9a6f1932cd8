package com.sysmuse.fuzzy;

/**
 * Raised when a token sequence does not form a valid expression:
 * dangling operators, misplaced commas or brackets, empty arguments.
 */
public class SyntaxException extends ExpressionException {

    public SyntaxException(String message) {
        super(message);
    }

    public SyntaxException(String message, int position) {
        super(message, position);
    }
}
