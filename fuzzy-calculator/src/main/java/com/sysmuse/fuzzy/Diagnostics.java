package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the ambiguity warnings raised while one expression is parsed.
 */
public class Diagnostics {

    private final AmbiguityMode mode;
    private final List<String> warnings = new ArrayList<>();

    public Diagnostics(AmbiguityMode mode) {
        this.mode = mode;
    }

    public Diagnostics() {
        this(AmbiguityMode.WARNING);
    }

    public void ambiguity(String message, int position) {
        String located = position >= 0 ? message + " (at position " + position + ")" : message;
        switch (mode) {
            case EXCEPTION:
                throw new AmbiguityException(message, position);
            case WARNING:
                LoggingUtil.warn(located);
                break;
            case ACCEPT:
                LoggingUtil.debug(located);
                break;
        }
        warnings.add(located);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public AmbiguityMode getMode() {
        return mode;
    }
}
