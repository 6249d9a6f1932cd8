package com.sysmuse.fuzzy;

/**
 * Raised when the raw text cannot be split into tokens.
 */
public class LexerException extends ExpressionException {

    public LexerException(String message, int position) {
        super(message, position);
    }
}
