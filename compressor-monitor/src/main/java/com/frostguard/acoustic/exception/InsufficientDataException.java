package com.frostguard.acoustic.exception;

import lombok.Getter;

/**
 * Raised by an explicit training call when fewer samples than required are supplied.
 */
@Getter
public class InsufficientDataException extends RuntimeException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String what, int required, int actual) {
        super(String.format("%s needs at least %d samples, got %d", what, required, actual));
        this.required = required;
        this.actual = actual;
    }
}
