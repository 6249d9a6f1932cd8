package com.sysmuse.fuzzy;

/**
 * Internal consistency failure: a tree reached a stage in a shape an earlier
 * stage should have made impossible. Indicates a defect, never bad user input.
 */
public class MalformedTreeException extends IllegalStateException {

    public MalformedTreeException(String message) {
        super(message);
    }
}
