package com.sysmuse.fuzzy;

/**
 * Defines how the parser reacts to input it accepts but considers ambiguous
 * (implicit products such as {@code pi4x}, {@code x2.0}, or {@code *-} chains).
 */
public enum AmbiguityMode {
    /**
     * Reject the expression with an {@link AmbiguityException}.
     */
    EXCEPTION,

    /**
     * Log a warning, record it on the parsed tree and continue.
     */
    WARNING,

    /**
     * Record it on the parsed tree without logging.
     */
    ACCEPT
}
