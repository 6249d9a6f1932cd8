package com.sysmuse.fuzzy;

/**
 * Raised while computing the value of a tree: division by zero,
 * arguments outside a function's domain, unsupported constants.
 */
public class EvaluationException extends ExpressionException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, int position) {
        super(message, position);
    }

    public EvaluationException(String message, int position, Throwable cause) {
        super(message, position, cause);
    }
}
