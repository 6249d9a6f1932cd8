package com.sysmuse.fuzzy;

/**
 * An accepted-but-ambiguous construct, promoted to an error by {@link AmbiguityMode#EXCEPTION}.
 */
public class AmbiguityException extends SyntaxException {

    public AmbiguityException(String message, int position) {
        super(message, position);
    }
}
